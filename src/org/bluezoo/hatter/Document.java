/*
 * Document.java
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

import java.util.ArrayList;
import java.util.List;

/**
 * The root of a parsed HTML tree.
 * <p>
 * The document owns its whole subtree. The {@code head} and {@code body}
 * accessors look the elements up in the tree rather than caching them, so
 * they stay correct if the caller rearranges the tree after parsing.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Document extends Node {

    private QuirksMode quirksMode = QuirksMode.NO_QUIRKS;

    public Document() {
        super(null);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.DOCUMENT;
    }

    @Override
    public String getNodeName() {
        return "#document";
    }

    @Override
    public Document getOwnerDocument() {
        return this;
    }

    @Override
    boolean canHaveChildren() {
        return true;
    }

    @Override
    public String getTextContent() {
        return null;
    }

    /**
     * Returns the root element of the document.
     * @return the document element, or null if there is none
     */
    public Element getDocumentElement() {
        for (Node child : getChildNodes()) {
            if (child instanceof Element) {
                return (Element) child;
            }
        }
        return null;
    }

    public DocumentType getDoctype() {
        for (Node child : getChildNodes()) {
            if (child instanceof DocumentType) {
                return (DocumentType) child;
            }
        }
        return null;
    }

    /**
     * Returns the first {@code head} child of the {@code html} root element.
     * @return the head element, or null
     */
    public Element getHead() {
        Element root = getDocumentElement();
        if (root == null || !root.isHTML("html")) {
            return null;
        }
        for (Node child : root.getChildNodes()) {
            if (child instanceof Element && ((Element) child).isHTML("head")) {
                return (Element) child;
            }
        }
        return null;
    }

    /**
     * Returns the first {@code body} or {@code frameset} child of the
     * {@code html} root element.
     * @return the body element, or null
     */
    public Element getBody() {
        Element root = getDocumentElement();
        if (root == null || !root.isHTML("html")) {
            return null;
        }
        for (Node child : root.getChildNodes()) {
            if (child instanceof Element) {
                Element element = (Element) child;
                if (element.isHTML("body") || element.isHTML("frameset")) {
                    return element;
                }
            }
        }
        return null;
    }

    public QuirksMode getQuirksMode() {
        return quirksMode;
    }

    void setQuirksMode(QuirksMode quirksMode) {
        this.quirksMode = quirksMode;
    }

    /**
     * Returns all elements in the document with the given local name.
     *
     * @param name the local name, or "*" for every element
     * @return the elements in document order
     */
    public List<Element> getElementsByTagName(String name) {
        List<Element> result = new ArrayList<>();
        Element.collectElements(this, name, result);
        return result;
    }

    // -- Factory methods --

    public Element createElement(String localName) {
        return new Element(this, localName, Namespaces.HTML, null);
    }

    public Element createElementNS(String namespaceURI, String localName) {
        return new Element(this, localName, namespaceURI, null);
    }

    /**
     * Creates an element from a start tag. The attributes are copied so
     * the element does not share the token's list.
     */
    Element createElement(String localName, String namespaceURI, AttributeList attributes) {
        AttributeList copy = (attributes == null) ? null : attributes.copy();
        return new Element(this, localName, namespaceURI, copy);
    }

    public Text createTextNode(String data) {
        return new Text(this, data);
    }

    public Comment createComment(String data) {
        return new Comment(this, data);
    }

    public DocumentType createDocumentType(String name, String publicId, String systemId) {
        return new DocumentType(this, name, publicId, systemId);
    }

    public DocumentFragment createDocumentFragment() {
        return new DocumentFragment(this);
    }

}
