/*
 * ActiveFormattingList.java
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
 * The list of active formatting elements.
 * <p>
 * Entries are formatting elements or markers. A marker is pushed when
 * entering a table cell, caption, {@code applet}, {@code object},
 * {@code marquee} or {@code template}, and bounds every search made from
 * the end of the list.
 * <p>
 * At most three entries after the last marker may have the same name,
 * namespace and attributes; pushing a fourth removes the earliest.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ActiveFormattingList {

    private static final int NOAHS_ARK_LIMIT = 3;

    /**
     * Entry in the list. A marker has a null element.
     */
    static final class Entry {

        Element element;

        Entry(Element element) {
            this.element = element;
        }

        boolean isMarker() {
            return element == null;
        }

    }

    private final List<Entry> entries = new ArrayList<>();

    int size() {
        return entries.size();
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns the element at the given index, or null for a marker.
     */
    Element get(int index) {
        return entries.get(index).element;
    }

    boolean isMarker(int index) {
        return entries.get(index).isMarker();
    }

    void pushMarker() {
        entries.add(new Entry(null));
    }

    /**
     * Pushes a formatting element, applying the three-entry limit.
     */
    void push(Element element) {
        int count = 0;
        int earliest = -1;
        for (int i = entries.size() - 1; i >= 0; i--) {
            Entry entry = entries.get(i);
            if (entry.isMarker()) {
                break;
            }
            if (matches(entry.element, element)) {
                count++;
                earliest = i;
            }
        }
        if (count >= NOAHS_ARK_LIMIT) {
            entries.remove(earliest);
        }
        entries.add(new Entry(element));
    }

    private static boolean matches(Element a, Element b) {
        return a.getLocalName().equals(b.getLocalName())
                && a.getNamespaceURI().equals(b.getNamespaceURI())
                && a.getAttributes().sameAttributes(b.getAttributes());
    }

    /**
     * Inserts an element at a bookmark position.
     */
    void insert(int index, Element element) {
        entries.add(index, new Entry(element));
    }

    int indexOf(Element element) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).element == element) {
                return i;
            }
        }
        return -1;
    }

    boolean contains(Element element) {
        return indexOf(element) >= 0;
    }

    void remove(Element element) {
        int index = indexOf(element);
        if (index >= 0) {
            entries.remove(index);
        }
    }

    void replace(Element oldElement, Element newElement) {
        int index = indexOf(oldElement);
        if (index >= 0) {
            entries.get(index).element = newElement;
        }
    }

    void set(int index, Element element) {
        entries.get(index).element = element;
    }

    /**
     * Removes entries up to and including the last marker.
     */
    void clearToLastMarker() {
        while (!entries.isEmpty()) {
            Entry entry = entries.remove(entries.size() - 1);
            if (entry.isMarker()) {
                return;
            }
        }
    }

    /**
     * Returns the last HTML element with the given name after the last
     * marker, or null.
     */
    Element lastElementAfterMarker(String name) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            Entry entry = entries.get(i);
            if (entry.isMarker()) {
                return null;
            }
            if (entry.element.isHTML(name)) {
                return entry.element;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("[");
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                buf.append(", ");
            }
            Entry entry = entries.get(i);
            buf.append(entry.isMarker() ? "|" : entry.element.getLocalName());
        }
        return buf.append(']').toString();
    }

}
