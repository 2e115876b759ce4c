/*
 * Token.java
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
 * A token emitted by the {@link Tokenizer}.
 * <p>
 * Tokens are plain data. The concrete subclasses correspond one-to-one
 * with the values of {@link TokenType}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Token {

    private final TokenType type;

    Token(TokenType type) {
        this.type = type;
    }

    /**
     * Returns the kind of this token.
     * @return the token type
     */
    public final TokenType getType() {
        return type;
    }

    /**
     * A DOCTYPE token. Missing identifiers are null, which is distinct
     * from an empty identifier.
     */
    public static final class Doctype extends Token {

        String name;
        String publicId;
        String systemId;
        boolean forceQuirks;

        Doctype() {
            super(TokenType.DOCTYPE);
        }

        public Doctype(String name, String publicId, String systemId, boolean forceQuirks) {
            super(TokenType.DOCTYPE);
            this.name = name;
            this.publicId = publicId;
            this.systemId = systemId;
            this.forceQuirks = forceQuirks;
        }

        public String getName() {
            return name;
        }

        public String getPublicId() {
            return publicId;
        }

        public String getSystemId() {
            return systemId;
        }

        public boolean isForceQuirks() {
            return forceQuirks;
        }

        @Override
        public String toString() {
            return "DOCTYPE(" + name + ", " + publicId + ", " + systemId + (forceQuirks ? ", quirks)" : ")");
        }

    }

    /**
     * Common base for start and end tags.
     */
    public abstract static class Tag extends Token {

        String name;

        Tag(TokenType type, String name) {
            super(type);
            this.name = name;
        }

        /**
         * Returns the tag name, lowercased by the tokenizer.
         * @return the tag name
         */
        public String getName() {
            return name;
        }

    }

    /**
     * A start tag token.
     */
    public static final class StartTag extends Tag {

        final AttributeList attributes;
        boolean selfClosing;
        boolean selfClosingAcknowledged;

        public StartTag(String name) {
            this(name, new AttributeList(), false);
        }

        public StartTag(String name, AttributeList attributes, boolean selfClosing) {
            super(TokenType.START_TAG, name);
            this.attributes = attributes;
            this.selfClosing = selfClosing;
        }

        public AttributeList getAttributes() {
            return attributes;
        }

        public boolean isSelfClosing() {
            return selfClosing;
        }

        /**
         * Marks the self-closing flag as handled, so that the tree
         * constructor does not report it as an error.
         */
        void acknowledgeSelfClosing() {
            selfClosingAcknowledged = true;
        }

        boolean isSelfClosingAcknowledged() {
            return selfClosingAcknowledged;
        }

        @Override
        public String toString() {
            StringBuilder buf = new StringBuilder("StartTag(");
            buf.append(name);
            for (Attribute attribute : attributes) {
                buf.append(' ').append(attribute.getName()).append("=\"").append(attribute.getValue()).append('"');
            }
            if (selfClosing) {
                buf.append(" /");
            }
            return buf.append(')').toString();
        }

    }

    /**
     * An end tag token.
     */
    public static final class EndTag extends Tag {

        public EndTag(String name) {
            super(TokenType.END_TAG, name);
        }

        @Override
        public String toString() {
            return "EndTag(" + name + ")";
        }

    }

    /**
     * A comment token.
     */
    public static final class Comment extends Token {

        private final String data;

        public Comment(String data) {
            super(TokenType.COMMENT);
            this.data = data;
        }

        public String getData() {
            return data;
        }

        @Override
        public String toString() {
            return "Comment(" + data + ")";
        }

    }

    /**
     * A run of one or more characters.
     */
    public static final class Character extends Token {

        private final String data;

        public Character(String data) {
            super(TokenType.CHARACTER);
            this.data = data;
        }

        public String getData() {
            return data;
        }

        @Override
        public String toString() {
            return "Character(" + data + ")";
        }

    }

    /**
     * The end of the input.
     */
    public static final class EndOfFile extends Token {

        static final EndOfFile INSTANCE = new EndOfFile();

        private EndOfFile() {
            super(TokenType.EOF);
        }

        @Override
        public String toString() {
            return "EOF";
        }

    }

}
