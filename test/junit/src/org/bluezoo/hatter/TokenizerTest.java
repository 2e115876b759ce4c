/*
 * TokenizerTest.java
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
 * Unit tests for Tokenizer.
 */
public class TokenizerTest {

    private List<ParseError> errors;

    @Before
    public void setUp() {
        errors = new ArrayList<>();
    }

    private Tokenizer tokenizer(String input) {
        Tokenizer tokenizer = Parser.createTokenizer(input);
        tokenizer.setErrorHandler(errors::add);
        return tokenizer;
    }

    private List<Token> tokenize(Tokenizer tokenizer) {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = tokenizer.nextToken();
            tokens.add(token);
        } while (token.getType() != TokenType.EOF);
        return tokens;
    }

    private List<Token> tokenize(String input) {
        return tokenize(tokenizer(input));
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
    public void testSimpleElement() {
        List<Token> tokens = tokenize("<a href=x>t</a>");
        assertEquals(4, tokens.size());
        Token.StartTag start = (Token.StartTag) tokens.get(0);
        assertEquals("a", start.getName());
        assertEquals("x", start.getAttributes().getValue("href"));
        assertFalse(start.isSelfClosing());
        assertEquals("t", ((Token.Character) tokens.get(1)).getData());
        assertEquals("a", ((Token.EndTag) tokens.get(2)).getName());
        assertEquals(TokenType.EOF, tokens.get(3).getType());
        assertTrue(errors.isEmpty());
    }

    @Test
    public void testNamesAreLowercased() {
        List<Token> tokens = tokenize("<DIV CLASS='a'></Div>");
        Token.StartTag start = (Token.StartTag) tokens.get(0);
        assertEquals("div", start.getName());
        assertEquals("a", start.getAttributes().getValue("class"));
        assertEquals("div", ((Token.EndTag) tokens.get(1)).getName());
    }

    @Test
    public void testAttributeForms() {
        List<Token> tokens = tokenize("<input disabled value=\"a b\" name='n' size=3 />");
        Token.StartTag tag = (Token.StartTag) tokens.get(0);
        AttributeList attributes = tag.getAttributes();
        assertEquals(4, attributes.size());
        assertEquals("", attributes.getValue("disabled"));
        assertEquals("a b", attributes.getValue("value"));
        assertEquals("n", attributes.getValue("name"));
        assertEquals("3", attributes.getValue("size"));
        assertEquals("disabled", attributes.get(0).getName());
        assertEquals("size", attributes.get(3).getName());
        assertTrue(tag.isSelfClosing());
    }

    @Test
    public void testDuplicateAttributeKeepsFirst() {
        List<Token> tokens = tokenize("<p a=1 a=2>");
        Token.StartTag tag = (Token.StartTag) tokens.get(0);
        assertEquals(1, tag.getAttributes().size());
        assertEquals("1", tag.getAttributes().getValue("a"));
        assertTrue(hasError(ParseErrorKind.DUPLICATE_ATTRIBUTE));
    }

    @Test
    public void testTextIsCoalesced() {
        List<Token> tokens = tokenize("one &amp; two");
        assertEquals(2, tokens.size());
        assertEquals("one & two", ((Token.Character) tokens.get(0)).getData());
    }

    @Test
    public void testComment() {
        List<Token> tokens = tokenize("<!-- hello -->");
        assertEquals(" hello ", ((Token.Comment) tokens.get(0)).getData());
        assertTrue(errors.isEmpty());
    }

    @Test
    public void testEOFInComment() {
        List<Token> tokens = tokenize("<!-- abc");
        assertEquals(2, tokens.size());
        assertEquals(" abc", ((Token.Comment) tokens.get(0)).getData());
        assertTrue(hasError(ParseErrorKind.EOF_IN_COMMENT));
    }

    @Test
    public void testEOFInTag() {
        List<Token> tokens = tokenize("<div class=a");
        assertEquals(TokenType.START_TAG, tokens.get(0).getType());
        assertEquals("div", ((Token.StartTag) tokens.get(0)).getName());
        assertEquals(TokenType.EOF, tokens.get(1).getType());
        assertTrue(hasError(ParseErrorKind.EOF_IN_TAG));
    }

    @Test
    public void testLessThanAtEOFIsText() {
        List<Token> tokens = tokenize("a<");
        assertEquals("a<", ((Token.Character) tokens.get(0)).getData());
    }

    @Test
    public void testDoctype() {
        List<Token> tokens = tokenize("<!DOCTYPE html PUBLIC \"-//W3C//DTD HTML 4.01//EN\" \"http://www.w3.org/TR/html4/strict.dtd\">");
        Token.Doctype doctype = (Token.Doctype) tokens.get(0);
        assertEquals("html", doctype.getName());
        assertEquals("-//W3C//DTD HTML 4.01//EN", doctype.getPublicId());
        assertEquals("http://www.w3.org/TR/html4/strict.dtd", doctype.getSystemId());
        assertFalse(doctype.isForceQuirks());
    }

    @Test
    public void testEOFInDoctypeForcesQuirks() {
        List<Token> tokens = tokenize("<!DOCTYPE html");
        Token.Doctype doctype = (Token.Doctype) tokens.get(0);
        assertTrue(doctype.isForceQuirks());
        assertTrue(hasError(ParseErrorKind.EOF_IN_DOCTYPE));
    }

    @Test
    public void testNamedCharacterReferences() {
        List<Token> tokens = tokenize("&lt;&copy;&notit;&hellip;");
        assertEquals("<©¬it;…", ((Token.Character) tokens.get(0)).getData());
        assertTrue(hasError(ParseErrorKind.INVALID_CHARACTER_REFERENCE));
    }

    @Test
    public void testFullReferenceTable() {
        List<Token> tokens = tokenize("&check;&hookrightarrow;&NotEqual;&lbrace;&Afr;&fjlig;"
                + "&CounterClockwiseContourIntegral;");
        assertEquals("✓↪≠{𝔄fj∳", ((Token.Character) tokens.get(0)).getData());
        assertTrue(errors.isEmpty());
    }

    @Test
    public void testLongestMatchWins() {
        List<Token> tokens = tokenize("&notinva;&notin;&not;&notx");
        assertEquals("∉∉¬¬x", ((Token.Character) tokens.get(0)).getData());
    }

    @Test
    public void testUnknownReferenceIsLiteral() {
        List<Token> tokens = tokenize("&bogus; & x");
        assertEquals("&bogus; & x", ((Token.Character) tokens.get(0)).getData());
    }

    @Test
    public void testNumericCharacterReferences() {
        List<Token> tokens = tokenize("&#65;&#x42;&#128;&#0;");
        assertEquals("AB€�", ((Token.Character) tokens.get(0)).getData());
    }

    @Test
    public void testLegacyReferenceInAttribute() {
        List<Token> tokens = tokenize("<a href=\"?x=1&copy=2&amp;y\" title=\"&copy 2025\">");
        AttributeList attributes = ((Token.StartTag) tokens.get(0)).getAttributes();
        assertEquals("?x=1&copy=2&y", attributes.getValue("href"));
        assertEquals("© 2025", attributes.getValue("title"));
    }

    @Test
    public void testEndTagWithAttributes() {
        tokenize("<p></p class=x>");
        assertTrue(hasError(ParseErrorKind.END_TAG_WITH_ATTRIBUTES));
    }

    @Test
    public void testRawTextState() {
        Tokenizer tokenizer = tokenizer("<b>&amp;</style></STYLE>");
        tokenizer.setState(TokenizerState.RAWTEXT);
        tokenizer.setLastStartTagName("style");
        List<Token> tokens = tokenize(tokenizer);
        assertEquals("<b>&amp;", ((Token.Character) tokens.get(0)).getData());
        assertEquals("style", ((Token.EndTag) tokens.get(1)).getName());
        assertEquals("style", ((Token.EndTag) tokens.get(2)).getName());
    }

    @Test
    public void testRCDATADecodesReferences() {
        Tokenizer tokenizer = tokenizer("a &amp; <b></title>");
        tokenizer.setState(TokenizerState.RCDATA);
        tokenizer.setLastStartTagName("title");
        List<Token> tokens = tokenize(tokenizer);
        assertEquals("a & <b>", ((Token.Character) tokens.get(0)).getData());
        assertEquals("title", ((Token.EndTag) tokens.get(1)).getName());
    }

    @Test
    public void testInappropriateEndTagInRawText() {
        Tokenizer tokenizer = tokenizer("x</p>y</script>");
        tokenizer.setState(TokenizerState.SCRIPT_DATA);
        tokenizer.setLastStartTagName("script");
        List<Token> tokens = tokenize(tokenizer);
        assertEquals("x</p>y", ((Token.Character) tokens.get(0)).getData());
        assertEquals("script", ((Token.EndTag) tokens.get(1)).getName());
    }

    @Test
    public void testNewlinesNormalized() {
        List<Token> tokens = tokenize("a\r\nb\rc");
        assertEquals("a\nb\nc", ((Token.Character) tokens.get(0)).getData());
    }

    @Test
    public void testLocator() {
        Tokenizer tokenizer = tokenizer("ab\ncd<p>");
        tokenizer.nextToken();
        assertEquals(2, tokenizer.getLineNumber());
    }

    @Test
    public void testInsert() {
        Tokenizer tokenizer = tokenizer("<p>tail");
        assertEquals("p", ((Token.StartTag) tokenizer.nextToken()).getName());
        tokenizer.insert("<i>");
        assertEquals("i", ((Token.StartTag) tokenizer.nextToken()).getName());
        assertEquals("tail", ((Token.Character) tokenizer.nextToken()).getData());
    }

    @Test(expected = IllegalStateException.class)
    public void testInsertAfterEOF() {
        Tokenizer tokenizer = tokenizer("");
        assertEquals(TokenType.EOF, tokenizer.nextToken().getType());
        tokenizer.insert("more");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullInput() {
        Parser.createTokenizer(null);
    }

    @Test
    public void testEOFRepeats() {
        Tokenizer tokenizer = tokenizer("x");
        tokenizer.nextToken();
        assertEquals(TokenType.EOF, tokenizer.nextToken().getType());
        assertEquals(TokenType.EOF, tokenizer.nextToken().getType());
    }

}
