/*
 * TreeConstructorTest.java
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

import java.util.ArrayList;
import java.util.List;

/**
 * Tests for misnested markup: the adoption agency, reconstruction of
 * formatting elements and foster parenting out of tables.
 */
public class TreeConstructorTest {

    private Parser parser;
    private List<ParseError> errors;

    @Before
    public void setUp() {
        parser = new Parser();
        errors = new ArrayList<>();
        parser.setErrorHandler(errors::add);
    }

    private String body(String input) {
        return HTMLWriter.toString(parser.parse(input).getBody());
    }

    private boolean hasError(ParseErrorKind kind) {
        for (ParseError error : errors) {
            if (error.getKind() == kind) {
                return true;
            }
        }
        return false;
    }

    // -- Adoption agency --

    @Test
    public void testMisnestedFormattingAcrossBlock() {
        Document document = parser.parse("<b>1<i>2<p>3</b>4</p>5</i>");
        assertEquals("<b>1<i>2</i></b><i><p><b>3</b>4</p>5</i>",
                HTMLWriter.toString(document.getBody()));
        assertEquals("12345", document.getBody().getTextContent());
        assertTrue(hasError(ParseErrorKind.MISNESTED_FORMATTING));
    }

    @Test
    public void testFormattingEndTagInsideBlock() {
        assertEquals("<a></a><p><a>x</a>y</p>", body("<a><p>x</a>y"));
    }

    @Test
    public void testSimpleMisnesting() {
        assertEquals("<b>1<i>2</i></b><i>3</i>", body("<b>1<i>2</b>3</i>"));
    }

    @Test
    public void testNestedAnchorClosesPrevious() {
        assertEquals("<a>1</a><a>2</a>", body("<a>1<a>2</a>"));
        assertTrue(hasError(ParseErrorKind.MISNESTED_FORMATTING));
    }

    @Test
    public void testInnerLoopDropsDeepFormattingEntries() {
        assertEquals("<a><b><big><em><strong></strong></em></big></b></a>"
                + "<big><em><strong><div><a>X</a></div></strong></em></big>",
                body("<a><b><big><em><strong><div>X</a>"));
    }

    @Test
    public void testOuterLoopStopsAfterEightIterations() {
        StringBuilder input = new StringBuilder("<div><a><b>");
        for (int i = 0; i < 10; i++) {
            input.append("<div>");
        }
        input.append("</a>");
        StringBuilder expected = new StringBuilder("<div><a><b></b></a><b>");
        for (int i = 0; i < 7; i++) {
            expected.append("<div><a></a>");
        }
        expected.append("<div><a><div><div></div></div></a>");
        for (int i = 0; i < 8; i++) {
            expected.append("</div>");
        }
        expected.append("</b></div>");
        assertEquals(expected.toString(), body(input.toString()));
    }

    @Test
    public void testEndTagWithoutFormattingEntry() {
        assertEquals("<p>x</p>", body("<p>x</b></p>"));
        assertTrue(hasError(ParseErrorKind.UNEXPECTED_END_TAG));
    }

    // -- Reconstruction --

    @Test
    public void testReconstructionAcrossParagraphs() {
        assertEquals("<p><b>x</b></p><p><b>y</b></p>", body("<p><b>x</p><p>y"));
    }

    @Test
    public void testReconstructionPreservesAttributes() {
        Document document = parser.parse("<p><font color=red>x</p>y");
        List<Element> fonts = document.getElementsByTagName("font");
        assertEquals(2, fonts.size());
        assertNotSame(fonts.get(0), fonts.get(1));
        assertEquals("red", fonts.get(1).getAttribute("color"));
        assertEquals("y", fonts.get(1).getTextContent());
    }

    @Test
    public void testNoahsArkLimitsReconstruction() {
        assertEquals("<b><b><b><b>x</b></b></b></b>", body("<b><b><b><b>x</b></b></b></b>"));
        assertEquals("<p><b><b><b><b>x</b></b></b></b></p><p><b><b><b>y</b></b></b></p>",
                body("<p><b><b><b><b>x</p><p>y"));
    }

    @Test
    public void testMarkerStopsReconstruction() {
        assertEquals("<b><table><tbody><tr><td>x</td></tr></tbody></table>y</b>",
                body("<b><table><td>x</td></table>y"));
    }

    // -- Tables --

    @Test
    public void testImpliedTableSections() {
        assertEquals("<table><tbody><tr><td>a</td><td>b</td></tr><tr><td>c</td></tr></tbody></table>",
                body("<table><tr><td>a<td>b<tr><td>c</table>"));
    }

    @Test
    public void testFosterParentedText() {
        assertEquals("x<table><tbody><tr><td>y</td></tr></tbody></table>",
                body("<table>x<tr><td>y</table>"));
        assertTrue(hasError(ParseErrorKind.FOSTER_PARENTED));
    }

    @Test
    public void testFosterParentedTextAfterRow() {
        assertEquals("b<table><tbody><tr><td>a</td></tr></tbody></table>",
                body("<table><tr><td>a</td></tr>b</table>"));
    }

    @Test
    public void testWhitespaceStaysInTable() {
        assertEquals("<table> <tbody><tr><td>a</td></tr></tbody></table>",
                body("<table> <tr><td>a</td></tr></table>"));
        assertFalse(hasError(ParseErrorKind.FOSTER_PARENTED));
    }

    @Test
    public void testFosterParentedElement() {
        assertEquals("<div>x</div><table></table>", body("<table><div>x</div></table>"));
    }

    @Test
    public void testCaptionAndColgroup() {
        assertEquals("<table><caption>c</caption><colgroup><col></colgroup><tbody><tr><td>d</td></tr></tbody></table>",
                body("<table><caption>c<col><tr><td>d</table>"));
    }

    @Test
    public void testHiddenInputStaysInTable() {
        assertEquals("<table><input type=\"hidden\"></table>", body("<table><input type=hidden></table>"));
    }

    @Test
    public void testSelectInTable() {
        assertEquals("<table><tbody><tr><td><select><option>a</option></select></td><td>b</td></tr></tbody></table>",
                body("<table><tr><td><select><option>a<td>b</table>"));
    }

    @Test
    public void testNestedTableClosesOuter() {
        assertEquals("<table></table><table></table>", body("<table><table>"));
    }

}
