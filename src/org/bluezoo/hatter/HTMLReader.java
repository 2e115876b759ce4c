/*
 * HTMLReader.java
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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.xml.sax.ContentHandler;
import org.xml.sax.DTDHandler;
import org.xml.sax.EntityResolver;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXNotRecognizedException;
import org.xml.sax.SAXNotSupportedException;
import org.xml.sax.SAXParseException;
import org.xml.sax.XMLReader;
import org.xml.sax.ext.LexicalHandler;
import org.xml.sax.helpers.AttributesImpl;

/**
 * SAX2 driver for the HTML parser.
 * <p>
 * The document is parsed completely into a tree and the tree is then
 * replayed as SAX events, so that HTML can be fed to XML tooling. Parse
 * errors are reported to the {@link ErrorHandler} as
 * {@link SAXParseException}s through {@code error} before the content
 * events.
 * <p>
 * Supported features:
 * <ul>
 * <li>{@code http://xml.org/sax/features/namespaces}: true, read-only</li>
 * <li>{@code http://xml.org/sax/features/namespace-prefixes}: false,
 * read-only</li>
 * <li>{@code http://bluezoo.org/hatter/features/scripting}: the scripting
 * flag, false by default</li>
 * </ul>
 * Supported properties: {@code http://xml.org/sax/properties/lexical-handler}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HTMLReader implements XMLReader {

    static final String FEATURE_NAMESPACES = "http://xml.org/sax/features/namespaces";
    static final String FEATURE_NAMESPACE_PREFIXES = "http://xml.org/sax/features/namespace-prefixes";
    static final String FEATURE_SCRIPTING = "http://bluezoo.org/hatter/features/scripting";
    static final String PROPERTY_LEXICAL_HANDLER = "http://xml.org/sax/properties/lexical-handler";

    private static final Logger LOGGER = Logger.getLogger(HTMLReader.class.getName());

    private final Parser parser = new Parser();

    private ContentHandler contentHandler;
    private DTDHandler dtdHandler;
    private EntityResolver entityResolver;
    private ErrorHandler errorHandler;
    private LexicalHandler lexicalHandler;

    @Override
    public void parse(InputSource input) throws IOException, SAXException {
        if (input == null) {
            throw new IllegalArgumentException("InputSource cannot be null");
        }
        String systemId = input.getSystemId();
        Reader reader = input.getCharacterStream();
        InputStream in = null;
        if (reader == null) {
            in = input.getByteStream();
            if (in == null) {
                if (systemId == null) {
                    throw new SAXException("InputSource has no character stream, byte stream or system ID");
                }
                in = new URL(systemId).openStream();
            }
            reader = new InputStreamReader(in, charsetFor(input.getEncoding()));
        }
        Document document;
        List<ParseError> errors = new ArrayList<>();
        try {
            parser.setSystemId(systemId);
            parser.setErrorHandler(errors::add);
            document = parser.parse(reader);
        } finally {
            if (in != null && input.getByteStream() == null) {
                in.close();
            }
        }
        if (errorHandler != null) {
            for (ParseError error : errors) {
                errorHandler.error(new SAXParseException(error.getMessage(), input.getPublicId(), systemId,
                            error.getLineNumber(), error.getColumnNumber()));
            }
        }
        replay(document);
    }

    private static Charset charsetFor(String encoding) {
        if (encoding != null) {
            try {
                return Charset.forName(encoding);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                String message = Parser.L10N.getString("warn.unsupported_encoding");
                LOGGER.warning(MessageFormat.format(message, encoding));
            }
        }
        return StandardCharsets.UTF_8;
    }

    @Override
    public void parse(String systemId) throws IOException, SAXException {
        if (systemId == null) {
            throw new IllegalArgumentException("System ID cannot be null");
        }
        if (entityResolver != null) {
            InputSource source = entityResolver.resolveEntity(null, systemId);
            if (source != null) {
                parse(source);
                return;
            }
        }
        parse(new InputSource(systemId));
    }

    // -- Replay --

    private void replay(Document document) throws SAXException {
        if (contentHandler != null) {
            contentHandler.startDocument();
        }
        replayChildren(document);
        if (contentHandler != null) {
            contentHandler.endDocument();
        }
    }

    private void replayChildren(Node parent) throws SAXException {
        for (Node child : parent.getChildNodes()) {
            replayNode(child);
        }
    }

    private void replayNode(Node node) throws SAXException {
        switch (node.getNodeType()) {
            case ELEMENT:
                Element element = (Element) node;
                String namespaceURI = element.getNamespaceURI();
                String localName = element.getLocalName();
                if (contentHandler != null) {
                    contentHandler.startElement(namespaceURI, localName, localName, toAttributes(element));
                }
                replayChildren(element.isHTML("template") ? element.getContent() : element);
                if (contentHandler != null) {
                    contentHandler.endElement(namespaceURI, localName, localName);
                }
                break;
            case TEXT:
                if (contentHandler != null) {
                    char[] chars = ((Text) node).getData().toCharArray();
                    contentHandler.characters(chars, 0, chars.length);
                }
                break;
            case COMMENT:
                if (lexicalHandler != null) {
                    char[] chars = ((Comment) node).getData().toCharArray();
                    lexicalHandler.comment(chars, 0, chars.length);
                }
                break;
            case DOCUMENT_TYPE:
                if (lexicalHandler != null) {
                    DocumentType doctype = (DocumentType) node;
                    String publicId = doctype.getPublicId().isEmpty() ? null : doctype.getPublicId();
                    String systemId = doctype.getSystemId().isEmpty() ? null : doctype.getSystemId();
                    lexicalHandler.startDTD(doctype.getName(), publicId, systemId);
                    lexicalHandler.endDTD();
                }
                break;
            default:
                replayChildren(node);
                break;
        }
    }

    private static AttributesImpl toAttributes(Element element) {
        AttributesImpl attributes = new AttributesImpl();
        for (Attribute attribute : element.getAttributes()) {
            String namespaceURI = attribute.getNamespaceURI();
            attributes.addAttribute(namespaceURI == null ? "" : namespaceURI, attribute.getLocalName(),
                    attribute.getName(), "CDATA", attribute.getValue());
        }
        return attributes;
    }

    // -- Handlers --

    @Override
    public ContentHandler getContentHandler() {
        return contentHandler;
    }

    @Override
    public void setContentHandler(ContentHandler handler) {
        contentHandler = handler;
    }

    @Override
    public DTDHandler getDTDHandler() {
        return dtdHandler;
    }

    /**
     * Sets the DTD handler. HTML has no notations or unparsed entities,
     * so it never receives events.
     */
    @Override
    public void setDTDHandler(DTDHandler handler) {
        dtdHandler = handler;
    }

    @Override
    public EntityResolver getEntityResolver() {
        return entityResolver;
    }

    /**
     * Sets the resolver consulted by {@link #parse(String)}.
     */
    @Override
    public void setEntityResolver(EntityResolver resolver) {
        entityResolver = resolver;
    }

    @Override
    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }

    @Override
    public void setErrorHandler(ErrorHandler handler) {
        errorHandler = handler;
    }

    /**
     * Sets the script handler of the underlying parser.
     *
     * @param handler the script handler, or null
     */
    public void setScriptHandler(ScriptHandler handler) {
        parser.setScriptHandler(handler);
    }

    // -- Features and properties --

    @Override
    public boolean getFeature(String name) throws SAXNotRecognizedException, SAXNotSupportedException {
        if (name == null) {
            throw new NullPointerException("Feature name cannot be null");
        }
        switch (name) {
            case FEATURE_NAMESPACES:
                return true;
            case FEATURE_NAMESPACE_PREFIXES:
                return false;
            case FEATURE_SCRIPTING:
                return parser.isScriptingEnabled();
            default:
                throw new SAXNotRecognizedException("Feature not recognized: " + name);
        }
    }

    @Override
    public void setFeature(String name, boolean value) throws SAXNotRecognizedException, SAXNotSupportedException {
        if (name == null) {
            throw new NullPointerException("Feature name cannot be null");
        }
        switch (name) {
            case FEATURE_NAMESPACES:
            case FEATURE_NAMESPACE_PREFIXES:
                if (value != getFeature(name)) {
                    throw new SAXNotSupportedException(
                        "Feature is read-only: " + name + " (current value: " + getFeature(name) + ")");
                }
                break;
            case FEATURE_SCRIPTING:
                parser.setScriptingEnabled(value);
                break;
            default:
                throw new SAXNotRecognizedException("Feature not recognized: " + name);
        }
    }

    @Override
    public Object getProperty(String name) throws SAXNotRecognizedException, SAXNotSupportedException {
        if (PROPERTY_LEXICAL_HANDLER.equals(name)) {
            return lexicalHandler;
        }
        throw new SAXNotRecognizedException("Property not recognized: " + name);
    }

    @Override
    public void setProperty(String name, Object value) throws SAXNotRecognizedException, SAXNotSupportedException {
        if (PROPERTY_LEXICAL_HANDLER.equals(name)) {
            if (value == null || value instanceof LexicalHandler) {
                lexicalHandler = (LexicalHandler) value;
            } else {
                throw new SAXNotSupportedException("Value must be a LexicalHandler");
            }
        } else {
            throw new SAXNotRecognizedException("Property not recognized: " + name);
        }
    }

}
