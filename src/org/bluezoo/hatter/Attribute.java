/*
 * Attribute.java
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

/**
 * An attribute of a start tag or element.
 * <p>
 * Most attributes have no namespace. Attributes on foreign elements such
 * as {@code xlink:href} are given a prefix and namespace URI by the tree
 * constructor; their name remains the qualified name as written.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Attribute {

    private final String name;
    private final String prefix;
    private final String localName;
    private final String namespaceURI;
    private String value;

    public Attribute(String name, String value) {
        this(null, name, null, value);
    }

    public Attribute(String prefix, String localName, String namespaceURI, String value) {
        this.prefix = prefix;
        this.localName = localName;
        this.namespaceURI = namespaceURI;
        this.name = (prefix == null) ? localName : prefix + ":" + localName;
        this.value = value;
    }

    /**
     * Returns the qualified name of this attribute.
     * @return the name
     */
    public String getName() {
        return name;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getLocalName() {
        return localName;
    }

    /**
     * Returns the namespace URI, or null for attributes in no namespace.
     * @return the namespace URI
     */
    public String getNamespaceURI() {
        return namespaceURI;
    }

    public String getValue() {
        return value;
    }

    void setValue(String value) {
        this.value = value;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Attribute)) {
            return false;
        }
        Attribute o = (Attribute) other;
        return name.equals(o.name)
                && value.equals(o.value)
                && (namespaceURI == null ? o.namespaceURI == null : namespaceURI.equals(o.namespaceURI));
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + value.hashCode();
    }

    @Override
    public String toString() {
        return name + "=\"" + value + "\"";
    }

}
