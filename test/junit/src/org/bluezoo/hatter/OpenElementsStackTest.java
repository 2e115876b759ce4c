/*
 * OpenElementsStackTest.java
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
 * Unit tests for OpenElementsStack.
 */
public class OpenElementsStackTest {

    private Document document;
    private OpenElementsStack stack;

    @Before
    public void setUp() {
        document = new Document();
        stack = new OpenElementsStack();
    }

    private Element push(String name) {
        Element element = document.createElement(name);
        stack.push(element);
        return element;
    }

    @Test
    public void testPushPop() {
        assertNull(stack.current());
        Element html = push("html");
        Element body = push("body");
        assertEquals(2, stack.size());
        assertSame(body, stack.current());
        assertSame(body, stack.pop());
        assertSame(html, stack.current());
    }

    @Test
    public void testDefaultScope() {
        push("html");
        push("body");
        push("p");
        push("table");
        push("b");
        assertTrue(stack.hasElementInScope("b"));
        assertFalse(stack.hasElementInScope("p"));
        assertTrue(stack.containsHTML("p"));
    }

    @Test
    public void testButtonScope() {
        push("html");
        push("p");
        push("button");
        assertFalse(stack.hasElementInButtonScope("p"));
        assertTrue(stack.hasElementInScope("p"));
    }

    @Test
    public void testListItemScope() {
        push("html");
        push("li");
        push("ul");
        assertFalse(stack.hasElementInListItemScope("li"));
        assertTrue(stack.hasElementInScope("li"));
    }

    @Test
    public void testTableScope() {
        push("html");
        push("table");
        push("tbody");
        push("tr");
        push("td");
        push("div");
        assertTrue(stack.hasElementInTableScope("tr"));
        assertTrue(stack.hasElementInTableScope("table"));
        assertFalse(stack.hasElementInScope("tr"));
    }

    @Test
    public void testSelectScope() {
        push("html");
        push("select");
        push("optgroup");
        push("option");
        assertTrue(stack.hasElementInSelectScope("select"));
        push("div");
        assertFalse(stack.hasElementInSelectScope("select"));
    }

    @Test
    public void testForeignElementsBoundScope() {
        push("html");
        push("p");
        stack.push(document.createElementNS(Namespaces.SVG, "foreignObject"));
        assertFalse(stack.hasElementInScope("p"));
    }

    @Test
    public void testPopUntil() {
        push("html");
        push("body");
        push("p");
        push("b");
        push("i");
        stack.popUntil("p");
        assertEquals("body", stack.current().getLocalName());
    }

    @Test
    public void testGenerateImpliedEndTags() {
        push("html");
        push("body");
        push("ul");
        push("li");
        push("p");
        stack.generateImpliedEndTags("li");
        assertEquals("li", stack.current().getLocalName());
        stack.generateImpliedEndTags(null);
        assertEquals("ul", stack.current().getLocalName());
    }

    @Test
    public void testClearToTableContext() {
        push("html");
        push("table");
        push("caption");
        push("b");
        stack.clearToTableContext();
        assertEquals("table", stack.current().getLocalName());
    }

    @Test
    public void testRemoveAndInsert() {
        push("html");
        Element body = push("body");
        Element b = push("b");
        Element p = push("p");
        stack.remove(b);
        assertEquals(3, stack.size());
        assertSame(p, stack.current());
        Element clone = b.cloneShallow();
        stack.insert(stack.indexOf(p) + 1, clone);
        assertSame(clone, stack.current());
        stack.replace(clone, b);
        assertSame(b, stack.current());
        assertEquals(1, stack.indexOf(body));
        assertEquals("[html, body, p, b]", stack.toString());
    }

}
