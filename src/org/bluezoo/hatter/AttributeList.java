/*
 * AttributeList.java
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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered list of attributes, unique by qualified name.
 * <p>
 * Insertion order is preserved. Adding an attribute whose name is already
 * present leaves the list unchanged, so the first occurrence always wins.
 * Lists are small in practice, so lookup is a linear scan.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class AttributeList implements Iterable<Attribute> {

    private final List<Attribute> attributes;

    public AttributeList() {
        attributes = new ArrayList<>(4);
    }

    /**
     * Adds an attribute unless one with the same name is already present.
     *
     * @param attribute the attribute to add
     * @return true if added, false if the name was a duplicate
     */
    public boolean add(Attribute attribute) {
        if (indexOf(attribute.getName()) >= 0) {
            return false;
        }
        attributes.add(attribute);
        return true;
    }

    /**
     * Adds an attribute with no namespace unless the name is a duplicate.
     *
     * @param name the attribute name
     * @param value the attribute value
     * @return true if added, false if the name was a duplicate
     */
    public boolean add(String name, String value) {
        return add(new Attribute(name, value));
    }

    /**
     * Sets the value of the named attribute, appending it if absent.
     *
     * @param name the attribute name
     * @param value the new value
     */
    public void set(String name, String value) {
        int index = indexOf(name);
        if (index >= 0) {
            attributes.get(index).setValue(value);
        } else {
            attributes.add(new Attribute(name, value));
        }
    }

    /**
     * Replaces the attribute at the given index, used when the tree
     * constructor adjusts foreign attribute names.
     */
    void replace(int index, Attribute attribute) {
        attributes.set(index, attribute);
    }

    public boolean remove(String name) {
        int index = indexOf(name);
        if (index >= 0) {
            attributes.remove(index);
            return true;
        }
        return false;
    }

    public Attribute get(String name) {
        int index = indexOf(name);
        return (index >= 0) ? attributes.get(index) : null;
    }

    public Attribute get(int index) {
        return attributes.get(index);
    }

    /**
     * Returns the value of the named attribute.
     *
     * @param name the attribute name
     * @return the value, or null if there is no such attribute
     */
    public String getValue(String name) {
        Attribute attribute = get(name);
        return (attribute == null) ? null : attribute.getValue();
    }

    public boolean contains(String name) {
        return indexOf(name) >= 0;
    }

    public int indexOf(String name) {
        for (int i = 0; i < attributes.size(); i++) {
            if (attributes.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public int size() {
        return attributes.size();
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    /**
     * Returns true if both lists hold the same name/value pairs,
     * regardless of order.
     *
     * @param other the list to compare
     * @return true if the attribute sets are equal
     */
    public boolean sameAttributes(AttributeList other) {
        if (other.size() != size()) {
            return false;
        }
        for (Attribute attribute : attributes) {
            Attribute match = other.get(attribute.getName());
            if (match == null || !match.equals(attribute)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a deep copy of this list.
     * @return the copy
     */
    public AttributeList copy() {
        AttributeList copy = new AttributeList();
        for (Attribute attribute : attributes) {
            copy.attributes.add(new Attribute(attribute.getPrefix(), attribute.getLocalName(),
                    attribute.getNamespaceURI(), attribute.getValue()));
        }
        return copy;
    }

    public List<Attribute> asList() {
        return Collections.unmodifiableList(attributes);
    }

    @Override
    public Iterator<Attribute> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return attributes.toString();
    }

}
