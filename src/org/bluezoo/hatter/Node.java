/*
 * Node.java
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
import java.util.List;

/**
 * A node in a parsed HTML tree.
 * <p>
 * A parent owns its children in an ordered list and each child keeps a
 * reference back to its parent. Siblings are found through the parent's
 * list, so moving a node only has to update two places: the old parent's
 * list and the new one's.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Node {

    private final Document ownerDocument;
    private Node parent;
    private List<Node> children;

    Node(Document ownerDocument) {
        this.ownerDocument = ownerDocument;
    }

    public abstract NodeType getNodeType();

    public abstract String getNodeName();

    /**
     * Returns true if this kind of node may contain children.
     * @return whether children are permitted
     */
    boolean canHaveChildren() {
        return false;
    }

    /**
     * Returns the document this node was created by.
     * A document returns itself.
     * @return the owner document
     */
    public Document getOwnerDocument() {
        return ownerDocument;
    }

    public Node getParentNode() {
        return parent;
    }

    /**
     * Returns the children of this node as an unmodifiable list.
     * @return the child nodes
     */
    public List<Node> getChildNodes() {
        if (children == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildNodes() {
        return children != null && !children.isEmpty();
    }

    public Node getFirstChild() {
        return hasChildNodes() ? children.get(0) : null;
    }

    public Node getLastChild() {
        return hasChildNodes() ? children.get(children.size() - 1) : null;
    }

    public Node getPreviousSibling() {
        if (parent == null) {
            return null;
        }
        int index = parent.indexOfChild(this);
        return (index > 0) ? parent.children.get(index - 1) : null;
    }

    public Node getNextSibling() {
        if (parent == null) {
            return null;
        }
        int index = parent.indexOfChild(this);
        return (index + 1 < parent.children.size()) ? parent.children.get(index + 1) : null;
    }

    /**
     * Appends a child, detaching it from any previous parent first.
     *
     * @param child the node to append
     * @return the appended node
     * @throws IllegalArgumentException if this node cannot hold the child
     */
    public Node appendChild(Node child) {
        return insertBefore(child, null);
    }

    /**
     * Inserts a child before the given reference child, detaching it from
     * any previous parent first.
     *
     * @param child the node to insert
     * @param reference the existing child to insert before, or null to append
     * @return the inserted node
     * @throws IllegalArgumentException if this node cannot hold the child
     *         or the reference is not a child of this node
     */
    public Node insertBefore(Node child, Node reference) {
        checkInsertable(child);
        if (child.parent != null) {
            child.parent.removeChild(child);
        }
        if (children == null) {
            children = new ArrayList<>(4);
        }
        if (reference == null) {
            children.add(child);
        } else {
            int index = indexOfChild(reference);
            if (index < 0) {
                throw new IllegalArgumentException("Reference node is not a child of this node");
            }
            children.add(index, child);
        }
        child.parent = this;
        return child;
    }

    /**
     * Removes a child of this node.
     *
     * @param child the child to remove
     * @return the removed node
     * @throws IllegalArgumentException if the node is not a child of this node
     */
    public Node removeChild(Node child) {
        int index = (child.parent == this) ? indexOfChild(child) : -1;
        if (index < 0) {
            throw new IllegalArgumentException("Node is not a child of this node");
        }
        children.remove(index);
        child.parent = null;
        return child;
    }

    /**
     * Moves all children of this node to the end of another node,
     * preserving their order.
     */
    void moveChildrenTo(Node newParent) {
        if (children == null) {
            return;
        }
        List<Node> moving = new ArrayList<>(children);
        for (Node child : moving) {
            newParent.appendChild(child);
        }
    }

    int indexOfChild(Node child) {
        if (children == null) {
            return -1;
        }
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    private void checkInsertable(Node child) {
        if (!canHaveChildren()) {
            throw new IllegalArgumentException(getNodeName() + " nodes cannot have children");
        }
        if (child instanceof Document) {
            throw new IllegalArgumentException("A document cannot be inserted into a tree");
        }
        for (Node ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw new IllegalArgumentException("A node cannot be inserted into itself");
            }
        }
    }

    /**
     * Returns the concatenated text of all descendant text nodes.
     * @return the text content, or null for documents and DOCTYPEs
     */
    public String getTextContent() {
        StringBuilder buf = new StringBuilder();
        collectText(this, buf);
        return buf.toString();
    }

    private static void collectText(Node node, StringBuilder buf) {
        for (Node child : node.getChildNodes()) {
            if (child instanceof Text) {
                buf.append(((Text) child).getData());
            } else if (child instanceof Element) {
                collectText(child, buf);
            }
        }
    }

    @Override
    public String toString() {
        return getNodeName();
    }

}
