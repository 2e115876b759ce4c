/*
 * InputStack.java
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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * A stack of character buffers feeding the tokenizer.
 * <p>
 * The document source is the bottom buffer. Text injected by a script
 * while parsing is paused is pushed on top and read to exhaustion before
 * reading resumes in the buffer below. Line ends are normalized when a
 * buffer is pushed: CR LF and lone CR both become LF.
 * <p>
 * Positions are tracked for the {@link org.xml.sax.Locator} interface:
 * the line and column are those of the character most recently read.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class InputStack {

    private static final class Buffer {

        final String text;
        int position;

        Buffer(String text) {
            this.text = text;
        }

        boolean hasRemaining() {
            return position < text.length();
        }

    }

    private final Deque<Buffer> buffers = new ArrayDeque<>();

    int lineNumber = 1;
    int columnNumber = 0;

    InputStack(CharSequence input) {
        push(input);
    }

    /**
     * Pushes text to be read before whatever remains of the current input.
     *
     * @param text the text to insert
     */
    void push(CharSequence text) {
        if (text == null || text.length() == 0) {
            return;
        }
        buffers.push(new Buffer(normalizeNewlines(text)));
    }

    /**
     * Returns the number of buffers with unread characters.
     */
    int depth() {
        int depth = 0;
        for (Buffer buffer : buffers) {
            if (buffer.hasRemaining()) {
                depth++;
            }
        }
        return depth;
    }

    /**
     * Reads the next character.
     *
     * @return the character, or {@link CharClass#EOF_CHAR} at end of input
     */
    int read() {
        while (!buffers.isEmpty()) {
            Buffer top = buffers.peek();
            if (top.hasRemaining()) {
                char c = top.text.charAt(top.position++);
                if (c == '\n') {
                    lineNumber++;
                    columnNumber = 0;
                } else {
                    columnNumber++;
                }
                return c;
            }
            buffers.pop();
        }
        return CharClass.EOF_CHAR;
    }

    /**
     * Returns the character at the given offset ahead of the read
     * position without consuming anything. Offset 0 is the character the
     * next call to {@link #read()} would return.
     *
     * @param offset the lookahead distance
     * @return the character, or {@link CharClass#EOF_CHAR}
     */
    int peek(int offset) {
        Iterator<Buffer> i = buffers.iterator();
        while (i.hasNext()) {
            Buffer buffer = i.next();
            int available = buffer.text.length() - buffer.position;
            if (offset < available) {
                return buffer.text.charAt(buffer.position + offset);
            }
            offset -= available;
        }
        return CharClass.EOF_CHAR;
    }

    /**
     * Returns true if the upcoming characters match the given string.
     * The string must be lowercase when {@code ignoreCase} is true.
     *
     * @param s the expected characters
     * @param ignoreCase whether ASCII case is ignored
     * @return true on a match
     */
    boolean lookingAt(String s, boolean ignoreCase) {
        for (int i = 0; i < s.length(); i++) {
            int c = peek(i);
            if (c == CharClass.EOF_CHAR) {
                return false;
            }
            if (ignoreCase) {
                c = CharClass.toLower(c);
            }
            if (c != s.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Consumes the given number of characters.
     */
    void skip(int count) {
        for (int i = 0; i < count; i++) {
            read();
        }
    }

    private static String normalizeNewlines(CharSequence text) {
        String s = text.toString();
        if (s.indexOf('\r') < 0) {
            return s;
        }
        StringBuilder buf = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\r') {
                buf.append('\n');
                if (i + 1 < s.length() && s.charAt(i + 1) == '\n') {
                    i++;
                }
            } else {
                buf.append(c);
            }
        }
        return buf.toString();
    }

}
