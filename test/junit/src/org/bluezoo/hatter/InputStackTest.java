/*
 * InputStackTest.java
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

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for InputStack.
 */
public class InputStackTest {

    private static String drain(InputStack input) {
        StringBuilder buf = new StringBuilder();
        for (int c = input.read(); c != CharClass.EOF_CHAR; c = input.read()) {
            buf.append((char) c);
        }
        return buf.toString();
    }

    @Test
    public void testPushedTextIsReadFirst() {
        InputStack input = new InputStack("abcdef");
        assertEquals('a', input.read());
        assertEquals('b', input.read());
        input.push("XY");
        assertEquals(2, input.depth());
        assertEquals("XYcdef", drain(input));
        assertEquals(0, input.depth());
    }

    @Test
    public void testNestedPushes() {
        InputStack input = new InputStack("1");
        input.push("2");
        assertEquals('2', input.read());
        input.push("3");
        input.push("4");
        assertEquals("431", drain(input));
    }

    @Test
    public void testPeekSpansBuffers() {
        InputStack input = new InputStack("cd");
        input.push("ab");
        assertEquals('a', input.peek(0));
        assertEquals('c', input.peek(2));
        assertEquals(CharClass.EOF_CHAR, input.peek(4));
        assertTrue(input.lookingAt("abc", false));
        assertFalse(input.lookingAt("abd", false));
    }

    @Test
    public void testLookingAtIgnoreCase() {
        InputStack input = new InputStack("DocType");
        assertTrue(input.lookingAt("doctype", true));
        assertFalse(input.lookingAt("doctype", false));
        assertFalse(input.lookingAt("doctypes", true));
        input.skip(3);
        assertEquals('T', input.read());
    }

    @Test
    public void testEmptyPushIgnored() {
        InputStack input = new InputStack("x");
        input.push("");
        input.push(null);
        assertEquals(1, input.depth());
        assertEquals("x", drain(input));
    }

    @Test
    public void testLineAndColumn() {
        InputStack input = new InputStack("ab\r\nc");
        drain(input);
        assertEquals(2, input.lineNumber);
        assertEquals(1, input.columnNumber);
    }

}
