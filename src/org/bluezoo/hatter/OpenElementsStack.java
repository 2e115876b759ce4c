/*
 * OpenElementsStack.java
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
import java.util.Set;

/**
 * The stack of open elements.
 * <p>
 * Index 0 is the bottom of the stack (normally the {@code html} element);
 * the last entry is the current node. Entries are references into the
 * tree; the stack does not own them.
 * <p>
 * The scope queries walk from the current node towards the root and stop
 * at the first element in the boundary set of the scope kind. Only HTML
 * elements match a target name.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class OpenElementsStack {

    /**
     * Kinds of element scope.
     */
    enum Scope {
        DEFAULT,
        LIST_ITEM,
        BUTTON,
        TABLE,
        SELECT
    }

    private final List<Element> elements = new ArrayList<>();

    void push(Element element) {
        elements.add(element);
    }

    Element pop() {
        return elements.remove(elements.size() - 1);
    }

    /**
     * Returns the current node, or null if the stack is empty.
     */
    Element current() {
        return elements.isEmpty() ? null : elements.get(elements.size() - 1);
    }

    Element get(int index) {
        return elements.get(index);
    }

    int size() {
        return elements.size();
    }

    boolean isEmpty() {
        return elements.isEmpty();
    }

    boolean contains(Element element) {
        return indexOf(element) >= 0;
    }

    int indexOf(Element element) {
        for (int i = elements.size() - 1; i >= 0; i--) {
            if (elements.get(i) == element) {
                return i;
            }
        }
        return -1;
    }

    void remove(Element element) {
        int index = indexOf(element);
        if (index >= 0) {
            elements.remove(index);
        }
    }

    void insert(int index, Element element) {
        elements.add(index, element);
    }

    void replace(Element oldElement, Element newElement) {
        int index = indexOf(oldElement);
        if (index >= 0) {
            elements.set(index, newElement);
        }
    }

    /**
     * Returns true if the stack holds an HTML element with the given name
     * anywhere, regardless of scope.
     */
    boolean containsHTML(String name) {
        for (int i = elements.size() - 1; i >= 0; i--) {
            if (elements.get(i).isHTML(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the topmost HTML element with the given name, or null.
     */
    Element findHTML(String name) {
        for (int i = elements.size() - 1; i >= 0; i--) {
            Element element = elements.get(i);
            if (element.isHTML(name)) {
                return element;
            }
        }
        return null;
    }

    // -- Scope queries --

    boolean hasElementInScope(String name) {
        return inScope(name, null, Scope.DEFAULT);
    }

    boolean hasElementInListItemScope(String name) {
        return inScope(name, null, Scope.LIST_ITEM);
    }

    boolean hasElementInButtonScope(String name) {
        return inScope(name, null, Scope.BUTTON);
    }

    boolean hasElementInTableScope(String name) {
        return inScope(name, null, Scope.TABLE);
    }

    boolean hasElementInSelectScope(String name) {
        return inScope(name, null, Scope.SELECT);
    }

    /**
     * Returns true if any HTML element with one of the given names is in
     * the given scope.
     */
    boolean hasAnyInScope(Set<String> names, Scope scope) {
        for (int i = elements.size() - 1; i >= 0; i--) {
            Element element = elements.get(i);
            if (element.isHTML() && names.contains(element.getLocalName())) {
                return true;
            }
            if (isBoundary(element, scope)) {
                return false;
            }
        }
        return false;
    }

    /**
     * Returns true if this exact element is in default scope.
     */
    boolean hasElementInScope(Element target) {
        return inScope(null, target, Scope.DEFAULT);
    }

    private boolean inScope(String name, Element target, Scope scope) {
        for (int i = elements.size() - 1; i >= 0; i--) {
            Element element = elements.get(i);
            if (target != null ? element == target : element.isHTML(name)) {
                return true;
            }
            if (isBoundary(element, scope)) {
                return false;
            }
        }
        return false;
    }

    private static boolean isBoundary(Element element, Scope scope) {
        switch (scope) {
            case LIST_ITEM:
                return ElementTypes.isScopeBoundary(element)
                        || element.isHTML("ol") || element.isHTML("ul");
            case BUTTON:
                return ElementTypes.isScopeBoundary(element) || element.isHTML("button");
            case TABLE:
                return element.isHTML("html") || element.isHTML("table") || element.isHTML("template");
            case SELECT:
                // Every element except optgroup and option is a boundary
                return !(element.isHTML("optgroup") || element.isHTML("option"));
            default:
                return ElementTypes.isScopeBoundary(element);
        }
    }

    // -- Popping --

    /**
     * Pops elements until an HTML element with the given name has been
     * popped.
     */
    void popUntil(String name) {
        while (!elements.isEmpty()) {
            if (pop().isHTML(name)) {
                return;
            }
        }
    }

    /**
     * Pops elements until one of the named HTML elements has been popped.
     */
    void popUntil(Set<String> names) {
        while (!elements.isEmpty()) {
            Element element = pop();
            if (element.isHTML() && names.contains(element.getLocalName())) {
                return;
            }
        }
    }

    /**
     * Pops elements until the given element has been popped.
     */
    void popUntil(Element target) {
        while (!elements.isEmpty()) {
            if (pop() == target) {
                return;
            }
        }
    }

    /**
     * Pops the current node while it is an HTML element in the implied end
     * tag set, except for the named element.
     *
     * @param except the name to leave open, or null
     */
    void generateImpliedEndTags(String except) {
        while (!elements.isEmpty()) {
            Element current = current();
            if (!current.isHTML()
                    || !ElementTypes.IMPLIED_END_TAGS.contains(current.getLocalName())
                    || current.getLocalName().equals(except)) {
                return;
            }
            pop();
        }
    }

    void generateImpliedEndTagsThoroughly() {
        while (!elements.isEmpty()) {
            Element current = current();
            if (!current.isHTML() || !ElementTypes.IMPLIED_END_TAGS_THOROUGH.contains(current.getLocalName())) {
                return;
            }
            pop();
        }
    }

    // -- Clearing back to a table context --

    void clearToTableContext() {
        clearTo("table", "template", "html");
    }

    void clearToTableBodyContext() {
        clearTo("tbody", "tfoot", "thead", "template", "html");
    }

    void clearToTableRowContext() {
        clearTo("tr", "template", "html");
    }

    private void clearTo(String... names) {
        while (!elements.isEmpty()) {
            Element current = current();
            for (String name : names) {
                if (current.isHTML(name)) {
                    return;
                }
            }
            pop();
        }
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                buf.append(", ");
            }
            buf.append(elements.get(i).getLocalName());
        }
        return buf.append(']').toString();
    }

}
