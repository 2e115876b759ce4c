/*
 * Element.java
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
 * An element node.
 * <p>
 * Elements in the HTML namespace have lowercase local names. SVG and
 * MathML elements keep the case adjustments made by the tree constructor
 * (for example {@code foreignObject}). A {@code template} element in the
 * HTML namespace owns a separate {@link DocumentFragment} holding its
 * contents; those nodes are not children of the element.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Element extends Node {

    private final String localName;
    private final String namespaceURI;
    private final AttributeList attributes;
    private DocumentFragment content;

    Element(Document ownerDocument, String localName, String namespaceURI, AttributeList attributes) {
        super(ownerDocument);
        this.localName = localName;
        this.namespaceURI = namespaceURI;
        this.attributes = (attributes == null) ? new AttributeList() : attributes;
        if ("template".equals(localName) && Namespaces.HTML.equals(namespaceURI)) {
            content = new DocumentFragment(ownerDocument);
        }
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.ELEMENT;
    }

    @Override
    public String getNodeName() {
        return localName;
    }

    @Override
    boolean canHaveChildren() {
        return true;
    }

    public String getLocalName() {
        return localName;
    }

    /**
     * Returns the tag name. This is the local name as the parser created
     * it: lowercase for HTML elements, case-adjusted for foreign ones.
     * @return the tag name
     */
    public String getTagName() {
        return localName;
    }

    public String getNamespaceURI() {
        return namespaceURI;
    }

    /**
     * Returns true if this element is in the HTML namespace and has the
     * given local name.
     */
    public boolean isHTML(String name) {
        return Namespaces.HTML.equals(namespaceURI) && localName.equals(name);
    }

    boolean isHTML() {
        return Namespaces.HTML.equals(namespaceURI);
    }

    boolean is(String namespace, String name) {
        return namespace.equals(namespaceURI) && localName.equals(name);
    }

    public AttributeList getAttributes() {
        return attributes;
    }

    public String getAttribute(String name) {
        return attributes.getValue(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.contains(name);
    }

    public void setAttribute(String name, String value) {
        attributes.set(name, value);
    }

    public boolean removeAttribute(String name) {
        return attributes.remove(name);
    }

    /**
     * Returns the template contents for an HTML {@code template} element.
     * @return the contents fragment, or null for any other element
     */
    public DocumentFragment getContent() {
        return content;
    }

    /**
     * Returns all descendant elements with the given local name, in
     * document order. The name "*" matches every element.
     *
     * @param name the local name to match
     * @return the matching elements
     */
    public List<Element> getElementsByTagName(String name) {
        List<Element> result = new ArrayList<>();
        collectElements(this, name, result);
        return result;
    }

    static void collectElements(Node node, String name, List<Element> result) {
        for (Node child : node.getChildNodes()) {
            if (child instanceof Element) {
                Element element = (Element) child;
                if ("*".equals(name) || element.localName.equals(name)) {
                    result.add(element);
                }
                collectElements(element, name, result);
            }
        }
    }

    /**
     * Creates an element with the same name, namespace and attributes and
     * no children. Used when formatting elements are reopened.
     *
     * @return the clone
     */
    Element cloneShallow() {
        return new Element(getOwnerDocument(), localName, namespaceURI, attributes.copy());
    }

}
