/*
 * ErrorReporter.java
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

import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.xml.sax.Locator;

/**
 * Formats parse errors and delivers them to the registered handler.
 * <p>
 * Shared by the tokenizer and the tree constructor of one parse so that
 * both report positions from the same locator. When no handler is
 * registered, errors are logged at FINE.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ErrorReporter {

    private static final Logger LOGGER = Logger.getLogger(ErrorReporter.class.getName());

    private final ParseErrorHandler handler;
    private Locator locator;
    private int errorCount;

    ErrorReporter(ParseErrorHandler handler) {
        this.handler = handler;
    }

    void setLocator(Locator locator) {
        this.locator = locator;
    }

    /**
     * Reports an error of the given kind. The arguments are substituted
     * into the localized message for the kind.
     *
     * @param kind the error kind
     * @param args message arguments, typically a tag name
     */
    void report(ParseErrorKind kind, Object... args) {
        errorCount++;
        if (handler == null && !LOGGER.isLoggable(Level.FINE)) {
            return;
        }
        String message = MessageFormat.format(Parser.L10N.getString(kind.getMessageKey()), args);
        int line = (locator == null) ? -1 : locator.getLineNumber();
        int column = (locator == null) ? -1 : locator.getColumnNumber();
        ParseError error = new ParseError(kind, line, column, message);
        if (handler != null) {
            handler.error(error);
        } else {
            LOGGER.fine(error.toString());
        }
    }

    int getErrorCount() {
        return errorCount;
    }

}
