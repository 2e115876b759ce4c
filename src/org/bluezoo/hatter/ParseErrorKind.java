/*
 * ParseErrorKind.java
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

import java.util.Locale;

/**
 * Classification of recoverable parse errors.
 * <p>
 * None of these are fatal: each one is reported once and the parser
 * continues with the recovery action the HTML standard defines.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum ParseErrorKind {

    // Tokenizer-level errors

    EOF_IN_TAG,
    EOF_IN_COMMENT,
    EOF_IN_DOCTYPE,
    EOF_IN_CDATA,
    EOF_IN_ATTRIBUTE_VALUE,
    INVALID_CHARACTER_REFERENCE,
    UNEXPECTED_NULL_CHARACTER,
    UNEXPECTED_CHARACTER,
    MISSING_ATTRIBUTE_VALUE,
    DUPLICATE_ATTRIBUTE,
    END_TAG_WITH_ATTRIBUTES,
    END_TAG_WITH_TRAILING_SOLIDUS,
    MISSING_END_TAG_NAME,
    MALFORMED_COMMENT,
    MALFORMED_DOCTYPE,

    // Tree construction errors

    MISSING_DOCTYPE,
    UNEXPECTED_DOCTYPE,
    UNEXPECTED_START_TAG,
    UNEXPECTED_END_TAG,
    UNEXPECTED_CHARACTERS,
    MISNESTED_FORMATTING,
    STRAY_STRUCTURAL_TAG,
    FOSTER_PARENTED,
    NON_VOID_SELF_CLOSING,
    NESTED_FORM,
    UNCLOSED_ELEMENTS,
    UNEXPECTED_EOF;

    /**
     * Returns true for errors raised while scanning characters, as opposed
     * to errors raised while building the tree.
     * @return true for tokenizer-level errors
     */
    public boolean isTokenizerError() {
        return ordinal() <= MALFORMED_DOCTYPE.ordinal();
    }

    /**
     * Returns the key of this error's message in the L10N bundle.
     */
    String getMessageKey() {
        return "err." + name().toLowerCase(Locale.ROOT);
    }

}
