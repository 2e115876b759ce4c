/*
 * ScriptTest.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Tests for script pauses and scripting-dependent parsing.
 */
public class ScriptTest {

    private Parser parser;
    private List<String> sources;

    @Before
    public void setUp() {
        parser = new Parser();
        sources = new ArrayList<>();
    }

    @Test
    public void testInsertedMarkupIsParsedNext() {
        parser.setScriptHandler((script, source) -> {
            sources.add(source);
            return "<b>inserted</b>";
        });
        Document document = parser.parse("<script>x</script><p>after");
        assertEquals("<html><head><script>x</script></head><body><b>inserted</b><p>after</p></body></html>",
                HTMLWriter.toString(document));
        assertEquals(1, sources.size());
        assertEquals("x", sources.get(0));
    }

    @Test
    public void testScriptElementIsInTree() {
        final List<Element> scripts = new ArrayList<>();
        parser.setScriptHandler((script, source) -> {
            scripts.add(script);
            return null;
        });
        Document document = parser.parse("<body><div><script>a()</script></div>");
        assertEquals(1, scripts.size());
        Element script = scripts.get(0);
        assertEquals("div", ((Element) script.getParentNode()).getLocalName());
        assertSame(document, script.getOwnerDocument());
    }

    @Test
    public void testInsertedScriptRuns() {
        parser.setScriptHandler((script, source) -> {
            sources.add(source);
            return "1".equals(source) ? "<script>2</script>" : null;
        });
        Document document = parser.parse("<script>1</script>");
        assertEquals(2, sources.size());
        assertEquals("2", sources.get(1));
        assertEquals(2, document.getHead().getElementsByTagName("script").size());
    }

    @Test
    public void testScriptsSkippedWithoutHandler() {
        Document document = parser.parse("<script>x</script><p>after");
        assertEquals("x", document.getHead().getTextContent());
        assertEquals(1, document.getElementsByTagName("p").size());
    }

    @Test
    public void testAbortFromScriptHandler() {
        parser.setScriptHandler((script, source) -> {
            parser.abort();
            return "<p>never</p>";
        });
        Document document = parser.parse("<script>x</script><p>after");
        assertTrue(document.getElementsByTagName("p").isEmpty());
        assertEquals(1, document.getElementsByTagName("script").size());
    }

    @Test(expected = IllegalStateException.class)
    public void testReentrantParse() {
        parser.setScriptHandler((script, source) -> {
            parser.parse("<p>nested");
            return null;
        });
        parser.parse("<script>x</script>");
    }

    @Test
    public void testParserUsableAfterReentrantFailure() {
        parser.setScriptHandler((script, source) -> {
            parser.parse("<p>nested");
            return null;
        });
        try {
            parser.parse("<script>x</script>");
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
        parser.setScriptHandler(null);
        assertNotNull(parser.parse("<p>ok").getBody());
    }

    @Test
    public void testNoscriptWithScripting() {
        parser.setScriptingEnabled(true);
        Document document = parser.parse("<body><noscript><p>x</p></noscript>");
        Element noscript = document.getElementsByTagName("noscript").get(0);
        assertEquals(1, noscript.getChildNodes().size());
        assertTrue(noscript.getFirstChild() instanceof Text);
        assertEquals("<p>x</p>", noscript.getTextContent());
    }

    @Test
    public void testNoscriptWithoutScripting() {
        assertFalse(parser.isScriptingEnabled());
        Document document = parser.parse("<body><noscript><p>x</p></noscript>");
        Element noscript = document.getElementsByTagName("noscript").get(0);
        assertEquals("p", ((Element) noscript.getFirstChild()).getLocalName());
    }

    @Test
    public void testWriterHonoursScripting() throws IOException {
        parser.setScriptingEnabled(true);
        Document document = parser.parse("<body><noscript><b>&amp;</b></noscript>");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HTMLWriter writer = new HTMLWriter(out);
        writer.setScriptingEnabled(true);
        writer.serializeChildren(document.getBody());
        writer.close();
        assertEquals("<noscript><b>&amp;</b></noscript>",
                new String(out.toByteArray(), StandardCharsets.UTF_8));
    }

}
