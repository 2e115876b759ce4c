/*
 * package-info.java
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

/**
 * Hatter: an HTML5 tokenizer and tree builder.
 *
 * <h2>Overview</h2>
 *
 * <p>Hatter turns HTML text into a document tree the way a web browser
 * does. It never rejects input: every syntax error is reported to a
 * {@link org.bluezoo.hatter.ParseErrorHandler} and recovered from, so that
 * any string of characters yields a well-formed tree.
 *
 * <p>Parsing happens in two stages. The {@link org.bluezoo.hatter.Tokenizer}
 * turns characters into start tags, end tags, comments, DOCTYPEs and runs
 * of text, decoding character references as it goes. The tree constructor
 * places those tokens in the tree, inferring omitted tags, repairing
 * misnested formatting elements and moving stray table content out of
 * tables. The tree constructor also tells the tokenizer which content
 * model applies, for instance raw text inside {@code script} or
 * {@code style}.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * import org.bluezoo.hatter.Document;
 * import org.bluezoo.hatter.Parser;
 *
 * Parser parser = new Parser();
 * parser.setErrorHandler(error -> System.err.println(error));
 * Document document = parser.parse("<p>Hello<p>World");
 * // <html><head></head><body><p>Hello</p><p>World</p></body></html>
 * String html = HTMLWriter.toString(document);
 * }</pre>
 *
 * <p>Fragments are parsed in the context of an element, as when setting
 * {@code innerHTML}:
 *
 * <pre>{@code
 * List<Node> cells = parser.parseFragment("<td>a<td>b", row);
 * }</pre>
 *
 * <h2>Scripts</h2>
 *
 * <p>The parser does not run scripts itself. When a {@code script} end tag
 * is processed it pauses and calls the registered
 * {@link org.bluezoo.hatter.ScriptHandler}; text the handler returns is
 * parsed next, ahead of the rest of the input.
 *
 * <h2>SAX</h2>
 *
 * <p>{@link org.bluezoo.hatter.HTMLReader} is a SAX2
 * {@link org.xml.sax.XMLReader} over the parser, for use with XML
 * tooling such as XSLT transformers.
 *
 * <h2>Logging</h2>
 *
 * <p>Hatter logs through {@code java.util.logging}. Document start and end
 * and script pauses are logged at {@code FINE}, as are parse errors when
 * no error handler is set. Insertion mode changes are logged at
 * {@code FINEST}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.hatter;
