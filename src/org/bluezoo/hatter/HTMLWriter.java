/*
 * HTMLWriter.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;

/**
 * Serializes a node tree as HTML.
 * <p>
 * Output is UTF-8, collected in an internal buffer and sent to a
 * {@link WritableByteChannel} in chunks once the buffer passes a
 * threshold. Void elements have no end tag, attribute order is
 * preserved, and the children of raw text elements such as
 * {@code script} and {@code style} are written unescaped.
 * <pre>{@code
 * HTMLWriter writer = new HTMLWriter(out);
 * writer.serializeChildren(document);
 * writer.close();
 * }</pre>
 * <p>
 * This class is not thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HTMLWriter {

    private static final int DEFAULT_CAPACITY = 4096;
    private static final float SEND_THRESHOLD = 0.75f;

    private final WritableByteChannel channel;
    private ByteBuffer buffer;
    private final int sendThreshold;
    private boolean scripting;

    /**
     * Creates a writer for the given output stream.
     *
     * @param out the output stream to write to
     */
    public HTMLWriter(OutputStream out) {
        this(new OutputStreamChannel(out), DEFAULT_CAPACITY);
    }

    /**
     * Creates a writer for the given channel.
     *
     * @param channel the channel to write to
     */
    public HTMLWriter(WritableByteChannel channel) {
        this(channel, DEFAULT_CAPACITY);
    }

    /**
     * Creates a writer with the specified initial buffer capacity.
     *
     * @param channel the channel to write to
     * @param bufferCapacity initial buffer capacity in bytes
     */
    public HTMLWriter(WritableByteChannel channel, int bufferCapacity) {
        this.channel = channel;
        this.buffer = ByteBuffer.allocate(bufferCapacity);
        this.sendThreshold = (int) (bufferCapacity * SEND_THRESHOLD);
    }

    /**
     * Sets whether the tree was parsed with scripting enabled. If so, the
     * content of {@code noscript} is written unescaped.
     *
     * @param scripting the scripting flag used when parsing
     */
    public void setScriptingEnabled(boolean scripting) {
        this.scripting = scripting;
    }

    /**
     * Returns the serialization of the children of a node.
     *
     * @param node the node
     * @return the HTML text
     */
    public static String toString(Node node) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HTMLWriter writer = new HTMLWriter(out);
        try {
            writer.serializeChildren(node);
            writer.close();
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    // -- Serialization --

    /**
     * Writes a node and its descendants.
     *
     * @param node the node to write
     * @throws IOException if there is an error writing data
     */
    public void serialize(Node node) throws IOException {
        switch (node.getNodeType()) {
            case ELEMENT:
                writeElement((Element) node);
                break;
            case TEXT:
                writeText((Text) node);
                break;
            case COMMENT:
                writeRaw("<!--");
                writeRaw(((Comment) node).getData());
                writeRaw("-->");
                break;
            case DOCUMENT_TYPE:
                writeRaw("<!DOCTYPE ");
                writeRaw(((DocumentType) node).getName());
                writeRaw(">");
                break;
            default:
                serializeChildren(node);
                break;
        }
        sendIfNeeded();
    }

    /**
     * Writes the descendants of a node but not the node itself. For a
     * template element the contents of its template content fragment are
     * written.
     *
     * @param node the node whose children to write
     * @throws IOException if there is an error writing data
     */
    public void serializeChildren(Node node) throws IOException {
        Node parent = node;
        if (node instanceof Element && ((Element) node).isHTML("template")) {
            parent = ((Element) node).getContent();
        }
        for (Node child : parent.getChildNodes()) {
            serialize(child);
        }
    }

    private void writeElement(Element element) throws IOException {
        String name = element.getTagName();
        ensureCapacity(1);
        buffer.put((byte) '<');
        writeRaw(name);
        for (Attribute attribute : element.getAttributes()) {
            ensureCapacity(1);
            buffer.put((byte) ' ');
            writeRaw(attribute.getName());
            writeRaw("=\"");
            writeEscapedAttributeValue(attribute.getValue());
            ensureCapacity(1);
            buffer.put((byte) '"');
        }
        ensureCapacity(1);
        buffer.put((byte) '>');
        if (element.isHTML() && ElementTypes.VOID.contains(name)) {
            return;
        }
        serializeChildren(element);
        writeRaw("</");
        writeRaw(name);
        ensureCapacity(1);
        buffer.put((byte) '>');
    }

    private void writeText(Text text) throws IOException {
        Node parent = text.getParentNode();
        if (parent instanceof Element && isRawText((Element) parent)) {
            writeRaw(text.getData());
        } else {
            writeEscapedCharacters(text.getData());
        }
    }

    private boolean isRawText(Element element) {
        if (!element.isHTML()) {
            return false;
        }
        String name = element.getLocalName();
        return ElementTypes.RAW_TEXT.contains(name) || (scripting && "noscript".equals(name));
    }

    // -- Flush and close --

    /**
     * Flushes any buffered data to the channel.
     *
     * @throws IOException if there is an error sending data
     */
    public void flush() throws IOException {
        if (buffer.position() > 0) {
            send();
        }
    }

    /**
     * Flushes the writer. The underlying channel is not closed.
     *
     * @throws IOException if there is an error flushing data
     */
    public void close() throws IOException {
        flush();
    }

    // -- Encoding --

    private void writeRaw(String s) throws IOException {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        ensureCapacity(bytes.length);
        buffer.put(bytes);
    }

    /**
     * Writes text content escaping &amp;, &lt;, &gt; and no-break space.
     */
    private void writeEscapedCharacters(String s) throws IOException {
        for (int i = 0; i < s.length(); ) {
            int codePoint = s.codePointAt(i);
            if (buffer.remaining() < 8) {
                growBuffer(buffer.capacity() * 2);
            }
            switch (codePoint) {
                case '&':
                    putAscii("&amp;");
                    break;
                case '<':
                    putAscii("&lt;");
                    break;
                case '>':
                    putAscii("&gt;");
                    break;
                case 0xa0:
                    putAscii("&nbsp;");
                    break;
                default:
                    writeUtf8CodePoint(codePoint);
            }
            i += Character.charCount(codePoint);
        }
    }

    /**
     * Writes an attribute value escaping &amp;, &quot; and no-break space.
     */
    private void writeEscapedAttributeValue(String s) throws IOException {
        for (int i = 0; i < s.length(); ) {
            int codePoint = s.codePointAt(i);
            if (buffer.remaining() < 8) {
                growBuffer(buffer.capacity() * 2);
            }
            switch (codePoint) {
                case '&':
                    putAscii("&amp;");
                    break;
                case '"':
                    putAscii("&quot;");
                    break;
                case 0xa0:
                    putAscii("&nbsp;");
                    break;
                default:
                    writeUtf8CodePoint(codePoint);
            }
            i += Character.charCount(codePoint);
        }
    }

    private void putAscii(String s) {
        for (int i = 0; i < s.length(); i++) {
            buffer.put((byte) s.charAt(i));
        }
    }

    private void writeUtf8CodePoint(int codePoint) {
        if (codePoint < 0x80) {
            buffer.put((byte) codePoint);
        } else if (codePoint < 0x800) {
            buffer.put((byte) (0xC0 | (codePoint >> 6)));
            buffer.put((byte) (0x80 | (codePoint & 0x3F)));
        } else if (codePoint < 0x10000) {
            buffer.put((byte) (0xE0 | (codePoint >> 12)));
            buffer.put((byte) (0x80 | ((codePoint >> 6) & 0x3F)));
            buffer.put((byte) (0x80 | (codePoint & 0x3F)));
        } else {
            buffer.put((byte) (0xF0 | (codePoint >> 18)));
            buffer.put((byte) (0x80 | ((codePoint >> 12) & 0x3F)));
            buffer.put((byte) (0x80 | ((codePoint >> 6) & 0x3F)));
            buffer.put((byte) (0x80 | (codePoint & 0x3F)));
        }
    }

    private void ensureCapacity(int needed) {
        if (buffer.remaining() < needed) {
            growBuffer(Math.max(buffer.capacity() * 2, buffer.position() + needed));
        }
    }

    private void growBuffer(int newCapacity) {
        ByteBuffer newBuffer = ByteBuffer.allocate(newCapacity);
        buffer.flip();
        newBuffer.put(buffer);
        buffer = newBuffer;
    }

    private void sendIfNeeded() throws IOException {
        if (buffer.position() >= sendThreshold) {
            send();
        }
    }

    private void send() throws IOException {
        buffer.flip();
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        buffer.clear();
    }

    /**
     * Adapter that presents an OutputStream as a WritableByteChannel.
     */
    static class OutputStreamChannel implements WritableByteChannel {

        private final OutputStream out;
        private boolean open = true;

        OutputStreamChannel(OutputStream out) {
            this.out = out;
        }

        @Override
        public int write(ByteBuffer src) throws IOException {
            if (!open) {
                throw new IOException("Channel is closed");
            }
            int written = src.remaining();
            if (src.hasArray()) {
                out.write(src.array(), src.arrayOffset() + src.position(), written);
                src.position(src.limit());
            } else {
                while (src.hasRemaining()) {
                    out.write(src.get());
                }
            }
            return written;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() throws IOException {
            if (open) {
                open = false;
                out.close();
            }
        }

    }

}
