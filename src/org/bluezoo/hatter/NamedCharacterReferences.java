/*
 * NamedCharacterReferences.java
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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Named character references recognised by the tokenizer.
 * <p>
 * The table is the full list of the HTML standard, loaded from the
 * {@code entities.properties} resource in this package. Names listed
 * there without a terminating semicolon (the Latin-1 set and a few
 * others) are also recognised without one, for compatibility with
 * legacy content.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class NamedCharacterReferences {

    static final String RESOURCE = "entities.properties";

    /**
     * Replacements for numeric references in the C1 control range,
     * indexed from 0x80. Zero means no replacement.
     */
    private static final int[] WINDOWS_1252 = {
        0x20AC, 0, 0x201A, 0x0192, 0x201E, 0x2026, 0x2020, 0x2021,
        0x02C6, 0x2030, 0x0160, 0x2039, 0x0152, 0, 0x017D, 0,
        0, 0x2018, 0x2019, 0x201C, 0x201D, 0x2022, 0x2013, 0x2014,
        0x02DC, 0x2122, 0x0161, 0x203A, 0x0153, 0, 0x017E, 0x0178
    };

    private static final Map<String, String> REFERENCES = new HashMap<>(4096);
    private static final Set<String> LEGACY = new HashSet<>(128);
    private static final int MAX_NAME_LENGTH;

    static {
        Properties table = new Properties();
        try (InputStream in = NamedCharacterReferences.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + RESOURCE);
            }
            table.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        int max = 0;
        for (String key : table.stringPropertyNames()) {
            String value = table.getProperty(key);
            if (key.endsWith(";")) {
                String name = key.substring(0, key.length() - 1);
                REFERENCES.put(name, value);
                max = Math.max(max, name.length());
            } else {
                LEGACY.add(key);
            }
        }
        MAX_NAME_LENGTH = max;
    }

    private NamedCharacterReferences() {
    }

    /**
     * Returns the replacement text for a reference name (without the
     * leading ampersand or trailing semicolon).
     *
     * @param name the reference name
     * @return the replacement text, or null if the name is unknown
     */
    static String get(String name) {
        return REFERENCES.get(name);
    }

    /**
     * Returns true if the name may be used without a terminating semicolon.
     */
    static boolean isLegacy(String name) {
        return LEGACY.contains(name);
    }

    static int getMaxNameLength() {
        return MAX_NAME_LENGTH;
    }

    /**
     * Maps the code point of a numeric character reference to the code
     * point it stands for.
     *
     * @param codePoint the numeric value, possibly out of range
     * @return the replacement code point
     */
    static int numericReplacement(long codePoint) {
        if (codePoint == 0 || codePoint > 0x10FFFF) {
            return 0xFFFD;
        }
        if (codePoint >= 0xD800 && codePoint <= 0xDFFF) {
            return 0xFFFD;
        }
        if (codePoint >= 0x80 && codePoint <= 0x9F) {
            int replacement = WINDOWS_1252[(int) codePoint - 0x80];
            if (replacement != 0) {
                return replacement;
            }
        }
        return (int) codePoint;
    }

    /**
     * Returns true if a numeric reference to this code point is a parse
     * error (even when it still produces a character).
     */
    static boolean isErroneousNumeric(long codePoint) {
        if (codePoint == 0 || codePoint > 0x10FFFF) {
            return true;
        }
        if (codePoint >= 0xD800 && codePoint <= 0xDFFF) {
            return true;
        }
        if (codePoint >= 0xFDD0 && codePoint <= 0xFDEF) {
            return true;
        }
        if ((codePoint & 0xFFFE) == 0xFFFE) {
            return true;
        }
        if (codePoint == 0x0D || (codePoint < 0x20 && codePoint != 0x09 && codePoint != 0x0A && codePoint != 0x0C)) {
            return true;
        }
        return codePoint >= 0x7F && codePoint <= 0x9F;
    }

}
