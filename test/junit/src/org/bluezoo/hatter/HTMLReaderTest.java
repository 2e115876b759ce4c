/*
 * HTMLReaderTest.java
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

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXNotRecognizedException;
import org.xml.sax.SAXNotSupportedException;
import org.xml.sax.SAXParseException;
import org.xml.sax.ext.DefaultHandler2;

/**
 * Unit tests for HTMLReader.
 */
public class HTMLReaderTest {

    private HTMLReader reader;
    private RecordingHandler handler;

    @Before
    public void setUp() throws SAXException {
        reader = new HTMLReader();
        handler = new RecordingHandler();
        reader.setContentHandler(handler);
        reader.setErrorHandler(handler);
        reader.setProperty(HTMLReader.PROPERTY_LEXICAL_HANDLER, handler);
    }

    private void parse(String html) throws Exception {
        reader.parse(new InputSource(new StringReader(html)));
    }

    /**
     * Records events in a compact textual form.
     */
    static class RecordingHandler extends DefaultHandler2 {

        final StringBuilder events = new StringBuilder();
        final List<SAXParseException> errors = new ArrayList<>();
        int depth;

        @Override
        public void startDocument() {
            events.append("[");
        }

        @Override
        public void endDocument() {
            events.append("]");
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes atts) {
            depth++;
            events.append('<').append(localName);
            for (int i = 0; i < atts.getLength(); i++) {
                events.append(' ').append(atts.getLocalName(i)).append('=').append(atts.getValue(i));
            }
            events.append('>');
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            depth--;
            events.append("</").append(localName).append('>');
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            events.append(ch, start, length);
        }

        @Override
        public void comment(char[] ch, int start, int length) {
            events.append("{").append(ch, start, length).append("}");
        }

        @Override
        public void startDTD(String name, String publicId, String systemId) {
            events.append("DTD(").append(name).append(',').append(publicId).append(',').append(systemId).append(')');
        }

        @Override
        public void error(SAXParseException e) {
            errors.add(e);
        }

    }

    @Test
    public void testBalancedEvents() throws Exception {
        parse("<!DOCTYPE html><p class=a>x<b>y</p>z<!--c-->");
        assertEquals("[DTD(html,null,null)<html><head></head><body><p class=a>x<b>y</b></p><b>z{c}</b></body></html>]",
                handler.events.toString());
        assertEquals(0, handler.depth);
    }

    @Test
    public void testNamespaceURIs() throws Exception {
        final List<String> uris = new ArrayList<>();
        reader.setContentHandler(new DefaultHandler2() {
            @Override
            public void startElement(String uri, String localName, String qName, Attributes atts) {
                uris.add(localName + "=" + uri);
            }
        });
        parse("<!DOCTYPE html><svg><circle/></svg>");
        assertTrue(uris.contains("html=" + Namespaces.HTML));
        assertTrue(uris.contains("svg=" + Namespaces.SVG));
        assertTrue(uris.contains("circle=" + Namespaces.SVG));
    }

    @Test
    public void testErrorsReported() throws Exception {
        parse("<p>x");
        assertEquals(1, handler.errors.size());
        assertEquals(1, handler.errors.get(0).getLineNumber());
        assertEquals(0, handler.events.indexOf("["));
    }

    @Test
    public void testNoErrorsForConformingDocument() throws Exception {
        parse("<!DOCTYPE html><title>t</title><p>x</p>");
        assertTrue(handler.errors.isEmpty());
    }

    @Test
    public void testByteStreamWithEncoding() throws Exception {
        byte[] bytes = "<!DOCTYPE html><p>caf\u00e9</p>".getBytes(StandardCharsets.ISO_8859_1);
        InputSource source = new InputSource(new ByteArrayInputStream(bytes));
        source.setEncoding("ISO-8859-1");
        reader.parse(source);
        assertTrue(handler.events.toString().contains("<p>caf\u00e9</p>"));
    }

    @Test
    public void testByteStreamDefaultsToUtf8() throws Exception {
        byte[] bytes = "<!DOCTYPE html><p>caf\u00e9</p>".getBytes(StandardCharsets.UTF_8);
        InputSource source = new InputSource(new ByteArrayInputStream(bytes));
        source.setEncoding("x-no-such-encoding");
        reader.parse(source);
        assertTrue(handler.events.toString().contains("<p>caf\u00e9</p>"));
    }

    @Test(expected = SAXException.class)
    public void testEmptyInputSource() throws Exception {
        reader.parse(new InputSource());
    }

    @Test
    public void testEntityResolverConsulted() throws Exception {
        reader.setEntityResolver((publicId, systemId) -> {
            assertEquals("urn:test", systemId);
            return new InputSource(new StringReader("<!DOCTYPE html>resolved"));
        });
        reader.parse("urn:test");
        assertTrue(handler.events.toString().contains("<body>resolved</body>"));
    }

    @Test
    public void testFeatures() throws Exception {
        assertTrue(reader.getFeature(HTMLReader.FEATURE_NAMESPACES));
        assertFalse(reader.getFeature(HTMLReader.FEATURE_NAMESPACE_PREFIXES));
        reader.setFeature(HTMLReader.FEATURE_NAMESPACES, true);
        assertFalse(reader.getFeature(HTMLReader.FEATURE_SCRIPTING));
        reader.setFeature(HTMLReader.FEATURE_SCRIPTING, true);
        assertTrue(reader.getFeature(HTMLReader.FEATURE_SCRIPTING));
    }

    @Test(expected = SAXNotSupportedException.class)
    public void testReadOnlyFeature() throws Exception {
        reader.setFeature(HTMLReader.FEATURE_NAMESPACES, false);
    }

    @Test(expected = SAXNotRecognizedException.class)
    public void testUnrecognizedFeature() throws Exception {
        reader.getFeature("http://example.com/no-such-feature");
    }

    @Test
    public void testProperties() throws Exception {
        assertSame(handler, reader.getProperty(HTMLReader.PROPERTY_LEXICAL_HANDLER));
        try {
            reader.setProperty(HTMLReader.PROPERTY_LEXICAL_HANDLER, "not a handler");
            fail("Expected SAXNotSupportedException");
        } catch (SAXNotSupportedException e) {
            // expected
        }
        try {
            reader.getProperty("http://example.com/no-such-property");
            fail("Expected SAXNotRecognizedException");
        } catch (SAXNotRecognizedException e) {
            // expected
        }
    }

}
