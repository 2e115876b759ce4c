/*
 * TokenType.java
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
 * The kind of a token in an HTML stream.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum TokenType {

    DOCTYPE(true), // <!DOCTYPE name PUBLIC "..." "...">
    START_TAG(true), // <name attr=value>
    END_TAG(true), // </name>
    COMMENT(true), // <!--data-->
    CHARACTER(true), // one or more characters of text
    EOF(false); // end of input

    private final boolean hasAssociatedText;

    TokenType(boolean hasAssociatedText) {
        this.hasAssociatedText = hasAssociatedText;
    }

    /**
     * Returns true if tokens of this type carry a name or character data.
     * @return true if this token type has associated text
     */
    public boolean hasAssociatedText() {
        return hasAssociatedText;
    }

}
