/*
 * DocumentTest.java
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

/**
 * Unit tests for Document.
 */
public class DocumentTest {

    private Document document;

    @Before
    public void setUp() {
        document = new Document();
    }

    @Test
    public void testElementDoesNotShareTagAttributes() {
        AttributeList attributes = new AttributeList();
        attributes.add("class", "a");
        Element element = document.createElement("p", Namespaces.HTML, attributes);
        attributes.set("class", "b");
        attributes.add("id", "x");
        assertEquals("a", element.getAttribute("class"));
        assertFalse(element.hasAttribute("id"));
        assertNotSame(attributes, element.getAttributes());
    }

    @Test
    public void testElementWithoutAttributes() {
        Element element = document.createElement("p", Namespaces.HTML, null);
        assertFalse(element.getAttributes().iterator().hasNext());
    }

    @Test
    public void testParsedElementDoesNotShareTokenAttributes() {
        Token.StartTag tag = new Token.StartTag("div");
        tag.getAttributes().add("title", "t");
        Element element = document.createElement(tag.getName(), Namespaces.HTML, tag.getAttributes());
        tag.getAttributes().remove("title");
        assertEquals("t", element.getAttribute("title"));
    }

}
