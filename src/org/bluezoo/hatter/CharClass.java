/*
 * CharClass.java
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
 * Character classification for HTML tokenization.
 * <p>
 * CharClass reduces the input character space to the handful of classes
 * that the tokenizer states actually distinguish. Every state transition
 * in {@link Tokenizer} is chosen by the class of the next input character
 * rather than by the character itself.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
enum CharClass {

    /** Tab, line feed, form feed, space (carriage returns are normalized away) */
    WHITESPACE,

    /** '&lt;' - starts tags and markup declarations */
    LT,

    /** '&gt;' - ends tags, comments and DOCTYPEs */
    GT,

    /** '/' - end tags and self-closing start tags */
    SLASH,

    /** '=' - separates attribute names from values */
    EQ,

    /** '"' - attribute value and DOCTYPE identifier delimiter */
    QUOT,

    /** '\'' - attribute value and DOCTYPE identifier delimiter */
    APOS,

    /** '&amp;' - starts character references */
    AMP,

    /** '!' - markup declarations and "--!&gt;" */
    BANG,

    /** '-' - comment delimiters */
    DASH,

    /** '?' - processing-instruction-shaped bogus comments */
    QUERY,

    /** ']' - CDATA section end */
    CLOSE_BRACKET,

    /** ASCII upper alpha [A-Z], lowercased in names */
    UPPER_ALPHA,

    /** ASCII lower alpha [a-z] */
    LOWER_ALPHA,

    /** U+0000 */
    NULL,

    /** End of input */
    EOF,

    /** Anything else */
    OTHER;

    /**
     * Character value used by the input stack to signal end of input.
     */
    static final int EOF_CHAR = -1;

    /**
     * Pre-computed lookup table for ASCII characters (0-127).
     */
    private static final CharClass[] ASCII_LOOKUP = new CharClass[128];

    static {
        for (int i = 0; i < 128; i++) {
            ASCII_LOOKUP[i] = OTHER;
        }
        ASCII_LOOKUP['\t'] = WHITESPACE;
        ASCII_LOOKUP['\n'] = WHITESPACE;
        ASCII_LOOKUP['\f'] = WHITESPACE;
        ASCII_LOOKUP[' '] = WHITESPACE;
        ASCII_LOOKUP['<'] = LT;
        ASCII_LOOKUP['>'] = GT;
        ASCII_LOOKUP['/'] = SLASH;
        ASCII_LOOKUP['='] = EQ;
        ASCII_LOOKUP['"'] = QUOT;
        ASCII_LOOKUP['\''] = APOS;
        ASCII_LOOKUP['&'] = AMP;
        ASCII_LOOKUP['!'] = BANG;
        ASCII_LOOKUP['-'] = DASH;
        ASCII_LOOKUP['?'] = QUERY;
        ASCII_LOOKUP[']'] = CLOSE_BRACKET;
        ASCII_LOOKUP[0] = NULL;
        for (char c = 'A'; c <= 'Z'; c++) {
            ASCII_LOOKUP[c] = UPPER_ALPHA;
        }
        for (char c = 'a'; c <= 'z'; c++) {
            ASCII_LOOKUP[c] = LOWER_ALPHA;
        }
    }

    /**
     * Classifies a character read from the input stack.
     *
     * @param c the character, or {@link #EOF_CHAR}
     * @return the character class
     */
    static CharClass classify(int c) {
        if (c == EOF_CHAR) {
            return EOF;
        }
        if (c < 128) {
            return ASCII_LOOKUP[c];
        }
        return OTHER;
    }

    /**
     * Returns true if the character is HTML whitespace.
     * Carriage return is included here because the tree constructor sees
     * text that came from character references as well as normalized input.
     */
    static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\f' || c == '\r';
    }

    static boolean isAsciiAlpha(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isAsciiDigit(int c) {
        return c >= '0' && c <= '9';
    }

    static boolean isAsciiHexDigit(int c) {
        return isAsciiDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    static boolean isAsciiAlphanumeric(int c) {
        return isAsciiAlpha(c) || isAsciiDigit(c);
    }

    static char toLower(int c) {
        if (c >= 'A' && c <= 'Z') {
            return (char) (c + 0x20);
        }
        return (char) c;
    }

}
