/*
 * ParseError.java
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
 * A recoverable parse error notification.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ParseError {

    private final ParseErrorKind kind;
    private final int lineNumber;
    private final int columnNumber;
    private final String message;

    public ParseError(ParseErrorKind kind, int lineNumber, int columnNumber, String message) {
        this.kind = kind;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
        this.message = message;
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the 1-based line of the input position where the error was
     * detected.
     * @return the line number
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns the 1-based column of the input position where the error
     * was detected.
     * @return the column number
     */
    public int getColumnNumber() {
        return columnNumber;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return lineNumber + ":" + columnNumber + ": " + kind + ": " + message;
    }

}
