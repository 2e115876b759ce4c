/*
 * DocumentFragment.java
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
 * A parentless container of nodes, used for template contents.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DocumentFragment extends Node {

    DocumentFragment(Document ownerDocument) {
        super(ownerDocument);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.DOCUMENT_FRAGMENT;
    }

    @Override
    public String getNodeName() {
        return "#document-fragment";
    }

    @Override
    boolean canHaveChildren() {
        return true;
    }

}
