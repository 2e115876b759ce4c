/*
 * FragmentParsingTest.java
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
import java.util.List;

/**
 * Tests for parsing fragments in the context of an element.
 */
public class FragmentParsingTest {

    private Parser parser;
    private Document owner;

    @Before
    public void setUp() {
        parser = new Parser();
        owner = new Document();
    }

    private static String serialize(List<Node> nodes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HTMLWriter writer = new HTMLWriter(out);
        for (Node node : nodes) {
            writer.serialize(node);
        }
        writer.close();
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testDivContext() {
        List<Node> nodes = parser.parseFragment("<b>x</b>y", owner.createElement("div"));
        assertEquals(2, nodes.size());
        Element b = (Element) nodes.get(0);
        assertEquals("b", b.getLocalName());
        assertEquals("x", b.getTextContent());
        assertTrue(nodes.get(1) instanceof Text);
        assertNull(b.getParentNode());
    }

    @Test
    public void testUnclosedElement() throws IOException {
        List<Node> nodes = parser.parseFragment("<b>x", owner.createElement("div"));
        assertEquals("<b>x</b>", serialize(nodes));
    }

    @Test
    public void testRowContext() {
        List<Node> nodes = parser.parseFragment("<td>a<td>b", owner.createElement("tr"));
        assertEquals(2, nodes.size());
        assertEquals("td", ((Element) nodes.get(0)).getLocalName());
        assertEquals("a", nodes.get(0).getTextContent());
        assertEquals("b", nodes.get(1).getTextContent());
    }

    @Test
    public void testTableContext() throws IOException {
        List<Node> nodes = parser.parseFragment("<tr><td>x", owner.createElement("table"));
        assertEquals("<tbody><tr><td>x</td></tr></tbody>", serialize(nodes));
    }

    @Test
    public void testTextareaContextIsRawText() {
        List<Node> nodes = parser.parseFragment("a</textarea>b", owner.createElement("textarea"));
        assertEquals(1, nodes.size());
        assertTrue(nodes.get(0) instanceof Text);
        assertEquals("ab", ((Text) nodes.get(0)).getData());
    }

    @Test
    public void testTitleContextKeepsMarkup() {
        List<Node> nodes = parser.parseFragment("<b>&amp;</b>", owner.createElement("title"));
        assertEquals(1, nodes.size());
        assertEquals("<b>&</b>", nodes.get(0).getTextContent());
    }

    @Test
    public void testContextIsNotModified() {
        Element context = owner.createElement("div");
        parser.parseFragment("<p>x", context);
        assertFalse(context.hasChildNodes());
    }

    @Test
    public void testSelectContext() {
        List<Node> nodes = parser.parseFragment("<option>a<option>b<div>", owner.createElement("select"));
        assertEquals(2, nodes.size());
        assertEquals("option", ((Element) nodes.get(1)).getLocalName());
    }

    @Test
    public void testSvgContext() {
        Element svg = owner.createElementNS(Namespaces.SVG, "svg");
        List<Node> nodes = parser.parseFragment("<circle/>", svg);
        assertEquals(1, nodes.size());
        assertEquals(Namespaces.SVG, ((Element) nodes.get(0)).getNamespaceURI());
    }

    @Test
    public void testEmptyFragment() {
        assertTrue(parser.parseFragment("", owner.createElement("div")).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullContext() {
        parser.parseFragment("x", null);
    }

}
