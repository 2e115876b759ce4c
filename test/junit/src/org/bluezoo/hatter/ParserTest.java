/*
 * ParserTest.java
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

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Unit tests for Parser: document structure, implied tags, DOCTYPE
 * handling and error reporting.
 */
public class ParserTest {

    private Parser parser;
    private List<ParseError> errors;

    @Before
    public void setUp() {
        parser = new Parser();
        errors = new ArrayList<>();
        parser.setErrorHandler(errors::add);
    }

    private String parseToString(String input) {
        return HTMLWriter.toString(parser.parse(input));
    }

    private boolean hasError(ParseErrorKind kind) {
        for (ParseError error : errors) {
            if (error.getKind() == kind) {
                return true;
            }
        }
        return false;
    }

    @Test
    public void testTurkishDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Document document = parser.parse("<!DOCTYPE HTML PUBLIC \"-//IETF//DTD HTML//EN\">"
                    + "<div a=1 a=2>&#0;<svg><lineargradient/></svg><!--x");
            assertEquals(QuirksMode.QUIRKS, document.getQuirksMode());
            assertTrue(hasError(ParseErrorKind.DUPLICATE_ATTRIBUTE));
            assertTrue(hasError(ParseErrorKind.INVALID_CHARACTER_REFERENCE));
            assertTrue(hasError(ParseErrorKind.EOF_IN_COMMENT));
            for (ParseError error : errors) {
                assertNotNull(error.getMessage());
            }
            assertEquals("linearGradient",
                    document.getElementsByTagName("linearGradient").get(0).getTagName());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    public void testEmptyInputYieldsSkeleton() {
        Document document = parser.parse("");
        Element html = document.getDocumentElement();
        assertNotNull(html);
        assertEquals("html", html.getLocalName());
        assertEquals(2, html.getChildNodes().size());
        assertNotNull(document.getHead());
        assertNotNull(document.getBody());
        assertEquals("<html><head></head><body></body></html>", HTMLWriter.toString(document));
        assertEquals(QuirksMode.QUIRKS, document.getQuirksMode());
        assertTrue(hasError(ParseErrorKind.MISSING_DOCTYPE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullInput() {
        parser.parse((CharSequence) null);
    }

    @Test
    public void testImpliedParagraphEnd() {
        assertEquals("<html><head></head><body><p>Hello</p><p>World</p></body></html>",
                parseToString("<p>Hello<p>World"));
    }

    @Test
    public void testStandardsDocument() {
        Document document = parser.parse("<!DOCTYPE html><title>T &amp; U</title><p>x");
        assertEquals(QuirksMode.NO_QUIRKS, document.getQuirksMode());
        assertEquals("html", document.getDoctype().getName());
        assertEquals("T & U", document.getHead().getTextContent());
        assertEquals("<!DOCTYPE html><html><head><title>T &amp; U</title></head><body><p>x</p></body></html>",
                HTMLWriter.toString(document));
        assertTrue(errors.isEmpty());
    }

    @Test
    public void testLegacyDoctypes() {
        Document document = parser.parse("<!DOCTYPE HTML PUBLIC \"-//W3C//DTD HTML 4.01 Transitional//EN\">");
        assertEquals(QuirksMode.QUIRKS, document.getQuirksMode());
        document = parser.parse("<!DOCTYPE HTML PUBLIC \"-//W3C//DTD HTML 4.01 Transitional//EN\" "
                + "\"http://www.w3.org/TR/html4/loose.dtd\">");
        assertEquals(QuirksMode.LIMITED_QUIRKS, document.getQuirksMode());
        document = parser.parse("<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Strict//EN\" "
                + "\"http://www.w3.org/TR/xhtml1/DTD/xhtml1-strict.dtd\">");
        assertEquals(QuirksMode.NO_QUIRKS, document.getQuirksMode());
        assertTrue(errors.isEmpty());
    }

    @Test
    public void testTableClosesParagraphOnlyInStandardsMode() {
        assertEquals("<!DOCTYPE html><html><head></head><body><p></p><table></table></body></html>",
                parseToString("<!DOCTYPE html><p><table></table>"));
        assertEquals("<html><head></head><body><p><table></table></p></body></html>",
                parseToString("<p><table></table>"));
    }

    @Test
    public void testHeadElementsBeforeBody() {
        Document document = parser.parse("<meta charset=utf-8><link rel=x><style>p{}</style><p>x");
        Element head = document.getHead();
        assertEquals(3, head.getChildNodes().size());
        assertEquals("style", ((Element) head.getLastChild()).getLocalName());
        assertEquals("p{}", head.getLastChild().getTextContent());
    }

    @Test
    public void testVoidElementsHaveNoChildren() {
        Document document = parser.parse("<br>text<img src=x>more");
        Element br = document.getElementsByTagName("br").get(0);
        Element img = document.getElementsByTagName("img").get(0);
        assertFalse(br.hasChildNodes());
        assertFalse(img.hasChildNodes());
        assertEquals("<br>text<img src=\"x\">more", HTMLWriter.toString(document.getBody()));
    }

    @Test
    public void testSelfClosingNonVoid() {
        Document document = parser.parse("<div/>x");
        assertTrue(hasError(ParseErrorKind.NON_VOID_SELF_CLOSING));
        assertEquals("<div>x</div>", HTMLWriter.toString(document.getBody()));
    }

    @Test
    public void testListItems() {
        assertEquals("<ul><li>a</li><li>b</li></ul><dl><dt>t</dt><dd>d</dd></dl>",
                HTMLWriter.toString(parser.parse("<ul><li>a<li>b</ul><dl><dt>t<dd>d</dl>").getBody()));
    }

    @Test
    public void testSelect() {
        assertEquals("<select><option>a</option><option>b</option></select>",
                HTMLWriter.toString(parser.parse("<select><option>a<option>b</select>").getBody()));
    }

    @Test
    public void testHeadings() {
        assertEquals("<h1>a</h1><h2>b</h2>",
                HTMLWriter.toString(parser.parse("<h1>a<h2>b</h2>").getBody()));
        assertTrue(hasError(ParseErrorKind.UNEXPECTED_START_TAG));
    }

    @Test
    public void testMismatchedEndTagIgnored() {
        assertEquals("<div>x</div>",
                HTMLWriter.toString(parser.parse("<div></span>x</div>").getBody()));
        assertTrue(hasError(ParseErrorKind.UNEXPECTED_END_TAG));
    }

    @Test
    public void testTruncatedInput() {
        Document document = parser.parse("<div><span");
        assertNotNull(document.getDocumentElement());
        assertTrue(hasError(ParseErrorKind.EOF_IN_TAG));
        assertTrue(hasError(ParseErrorKind.UNCLOSED_ELEMENTS));
        assertEquals("<div><span></span></div>", HTMLWriter.toString(document.getBody()));
    }

    @Test
    public void testEOFInComment() {
        Document document = parser.parse("<p>a<!-- never closed");
        assertNotNull(document.getBody());
        assertTrue(hasError(ParseErrorKind.EOF_IN_COMMENT));
        Node p = document.getBody().getFirstChild();
        assertTrue(p.getLastChild() instanceof Comment);
    }

    @Test
    public void testNestedForm() {
        Document document = parser.parse("<form><form></form>");
        assertEquals(1, document.getElementsByTagName("form").size());
        assertTrue(hasError(ParseErrorKind.NESTED_FORM));
    }

    @Test
    public void testStrayHtmlMergesAttributes() {
        Document document = parser.parse("<html a=1><body><html a=2 b=3>");
        Element html = document.getDocumentElement();
        assertEquals("1", html.getAttribute("a"));
        assertEquals("3", html.getAttribute("b"));
        assertTrue(hasError(ParseErrorKind.STRAY_STRUCTURAL_TAG));
    }

    @Test
    public void testNullCharacterDroppedInBody() {
        Document document = parser.parse("a\u0000b");
        Element body = document.getBody();
        assertEquals(1, body.getChildNodes().size());
        assertEquals("ab", body.getTextContent());
        assertTrue(hasError(ParseErrorKind.UNEXPECTED_NULL_CHARACTER));
    }

    @Test
    public void testLeadingNewlineDropped() {
        Document document = parser.parse("<textarea>\nabc</textarea><pre>\n\nx</pre>");
        assertEquals("abc", document.getElementsByTagName("textarea").get(0).getTextContent());
        assertEquals("\nx", document.getElementsByTagName("pre").get(0).getTextContent());
    }

    @Test
    public void testCharacterReferencesInTextAndAttributes() {
        Document document = parser.parse("<p title=\"a&amp;b&notx\">&lt;&copy;&notit;&#x41;&#128;</p>");
        Element p = document.getElementsByTagName("p").get(0);
        assertEquals("a&b&notx", p.getAttribute("title"));
        assertEquals("<©¬it;A€", p.getTextContent());
    }

    @Test
    public void testCommentsOutsideRoot() {
        Document document = parser.parse("<!--a--><p>x</p></body></html><!--b-->");
        assertTrue(document.getFirstChild() instanceof Comment);
        assertTrue(document.getLastChild() instanceof Comment);
        assertEquals("b", ((Comment) document.getLastChild()).getData());
    }

    @Test
    public void testFrameset() {
        Document document = parser.parse("<frameset><frame></frameset>");
        assertEquals("<html><head></head><frameset><frame></frameset></html>",
                HTMLWriter.toString(document));
        assertEquals("frameset", document.getBody().getLocalName());
    }

    @Test
    public void testTemplateContent() {
        Document document = parser.parse("<template><td>x</td></template>");
        Element template = document.getElementsByTagName("template").get(0);
        assertSame(document.getHead(), template.getParentNode());
        assertFalse(template.hasChildNodes());
        Element td = (Element) template.getContent().getFirstChild();
        assertEquals("td", td.getLocalName());
        assertEquals("x", td.getTextContent());
        assertEquals("<html><head><template><td>x</td></template></head><body></body></html>",
                HTMLWriter.toString(document));
    }

    @Test
    public void testForeignContent() {
        Document document = parser.parse("<svg viewbox=\"0 0 1 1\"><foreignobject><p>x</p></foreignobject></svg>"
                + "<math><mi>y</mi></math>");
        Element svg = document.getElementsByTagName("svg").get(0);
        assertEquals(Namespaces.SVG, svg.getNamespaceURI());
        assertEquals("0 0 1 1", svg.getAttribute("viewBox"));
        Element foreignObject = (Element) svg.getFirstChild();
        assertEquals("foreignObject", foreignObject.getLocalName());
        Element p = (Element) foreignObject.getFirstChild();
        assertEquals(Namespaces.HTML, p.getNamespaceURI());
        Element mi = document.getElementsByTagName("mi").get(0);
        assertEquals(Namespaces.MATHML, mi.getNamespaceURI());
        assertEquals("<svg viewBox=\"0 0 1 1\"><foreignObject><p>x</p></foreignObject></svg><math><mi>y</mi></math>",
                HTMLWriter.toString(document.getBody()));
    }

    @Test
    public void testBreakoutFromForeignContent() {
        Document document = parser.parse("<svg><circle/><p>x");
        assertEquals("<svg><circle></circle></svg><p>x</p>", HTMLWriter.toString(document.getBody()));
        assertEquals(Namespaces.HTML, document.getElementsByTagName("p").get(0).getNamespaceURI());
    }

    @Test
    public void testCDATAInForeignContent() {
        Document document = parser.parse("<svg><![CDATA[a<b]]></svg><![CDATA[c]]>");
        Element svg = document.getElementsByTagName("svg").get(0);
        assertEquals("a<b", svg.getTextContent());
        assertTrue(svg.getNextSibling() instanceof Comment);
    }

    @Test
    public void testParseReader() throws IOException {
        Document document = parser.parse(new StringReader("<p>from reader"));
        assertEquals("from reader", document.getBody().getTextContent());
    }

    @Test
    public void testAbortFromErrorHandler() {
        parser.setErrorHandler(error -> parser.abort());
        Document document = parser.parse("<p>x<p>y");
        assertNotNull(document.getDocumentElement());
        Element p = document.getElementsByTagName("p").get(0);
        assertFalse(p.hasChildNodes());
        assertEquals(1, document.getElementsByTagName("p").size());
    }

    @Test
    public void testParserReuse() {
        parser.parse("<p>one");
        Document document = parser.parse("<p>two");
        assertEquals("two", document.getBody().getTextContent());
    }

    @Test
    public void testErrorPositions() {
        parser.parse("<!DOCTYPE html>\n<p></div>");
        assertEquals(1, errors.size());
        ParseError error = errors.get(0);
        assertEquals(ParseErrorKind.UNEXPECTED_END_TAG, error.getKind());
        assertEquals(2, error.getLineNumber());
        assertNotNull(error.getMessage());
    }

}
