/*
 * ScriptHandler.java
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
 * Callback invoked when the parser pauses at the end of a script element.
 * <p>
 * The handler runs synchronously on the parsing thread. Any text it
 * returns is tokenized next, ahead of the rest of the document, the way
 * {@code document.write} output is. The partially built tree is visible
 * through {@link Element#getOwnerDocument()} but must not be modified.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface ScriptHandler {

    /**
     * Runs a script.
     *
     * @param script the script element, already in the tree
     * @param source the text content of the script element
     * @return markup to insert into the input, or null
     */
    String executeScript(Element script, String source);

}
