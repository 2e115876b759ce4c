/*
 * Text.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Hatter, an HTML5 parser.
 * For more information please visit https://www.nongnu.org/gumdrop/
 *
 * Hatter is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Hatter is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Hatter.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.hatter;

/**
 * A text node.
 * Adjacent character tokens are merged into a single text node.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Text extends Node {

    private final StringBuilder data;

    Text(Document ownerDocument, String data) {
        super(ownerDocument);
        this.data = new StringBuilder(data);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.TEXT;
    }

    @Override
    public String getNodeName() {
        return "#text";
    }

    public String getData() {
        return data.toString();
    }

    void appendData(String more) {
        data.append(more);
    }

    @Override
    public String getTextContent() {
        return data.toString();
    }

    @Override
    public String toString() {
        return "\"" + data + "\"";
    }

}
