/*
 * Tokenizer.java
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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.BooleanSupplier;
import org.xml.sax.Locator;

/**
 * Converts a stream of characters into HTML tokens.
 * <p>
 * The tokenizer is a deterministic state machine. Each step reads one
 * character, classifies it with {@link CharClass}, and the current
 * {@link TokenizerState} decides what to accumulate, what to emit and
 * which state comes next. A state may ask for the same character to be
 * <em>reconsumed</em> in another state; the input is never rewound. The
 * only lookahead is a bounded peek used to recognise {@code --},
 * {@code DOCTYPE}, {@code [CDATA[}, {@code PUBLIC}, {@code SYSTEM} and
 * character references.
 * <p>
 * Consecutive characters are coalesced into a single
 * {@link Token.Character} token, which is flushed before any other token
 * is emitted. Malformed input never causes an exception: each problem is
 * reported as a {@link ParseErrorKind} and scanning continues. End of
 * input inside a tag, comment or DOCTYPE emits what has been scanned so
 * far, followed by {@link Token.EndOfFile}.
 * <p>
 * Tokens are produced lazily by {@link #nextToken()}. After the
 * end-of-file token every further call returns it again.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Tokenizer implements Locator {

    private static final char REPLACEMENT_CHARACTER = '�';

    // ===== Input =====

    private final InputStack input;

    /**
     * The character being processed.
     */
    private int c;

    /**
     * If set, the next step processes {@link #c} again instead of reading.
     */
    private boolean reconsume;

    // ===== State Machine =====

    private TokenizerState state = TokenizerState.DATA;

    /**
     * The content state to return to from the raw-text less-than and end
     * tag states (RCDATA, RAWTEXT or SCRIPT_DATA).
     */
    private TokenizerState rawState = TokenizerState.RAWTEXT;

    /**
     * Decides whether {@code <![CDATA[} opens a CDATA section. The tree
     * constructor answers true when the adjusted current node is foreign.
     */
    private BooleanSupplier cdataAllowed;

    // ===== Output =====

    private final Deque<Token> pending = new ArrayDeque<>();
    private final StringBuilder text = new StringBuilder();
    private boolean eofEmitted;

    // ===== Token Under Construction =====

    private final StringBuilder tagName = new StringBuilder();
    private boolean endTag;
    private boolean selfClosing;
    private AttributeList attributes;
    private final StringBuilder attributeName = new StringBuilder();
    private final StringBuilder attributeValue = new StringBuilder();
    private boolean inAttribute;
    private String lastStartTagName;

    /**
     * Characters of a candidate end tag name in raw text, echoed as text
     * if the end tag turns out not to be appropriate.
     */
    private final StringBuilder temporaryBuffer = new StringBuilder();

    private final StringBuilder commentData = new StringBuilder();
    private Token.Doctype doctype;

    // ===== Error Reporting =====

    private ErrorReporter errors;

    private String systemId;

    /**
     * Creates a tokenizer over the given input. Errors are logged but not
     * delivered anywhere until {@link #setErrorHandler} is called.
     *
     * @param input the characters to tokenize
     * @throws IllegalArgumentException if input is null
     */
    public Tokenizer(CharSequence input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        this.input = new InputStack(input);
        setErrorReporter(new ErrorReporter(null));
    }

    /**
     * Sets the handler that receives this tokenizer's parse errors.
     *
     * @param handler the error handler, or null to log errors instead
     */
    public void setErrorHandler(ParseErrorHandler handler) {
        setErrorReporter(new ErrorReporter(handler));
    }

    void setErrorReporter(ErrorReporter errors) {
        this.errors = errors;
        errors.setLocator(this);
    }

    void setCdataAllowed(BooleanSupplier cdataAllowed) {
        this.cdataAllowed = cdataAllowed;
    }

    /**
     * Switches to the given state. Used by the tree constructor to select
     * the content model of the element it just inserted.
     *
     * @param newState the new state
     */
    void setState(TokenizerState newState) {
        if (newState == TokenizerState.RCDATA
                || newState == TokenizerState.RAWTEXT
                || newState == TokenizerState.SCRIPT_DATA) {
            rawState = newState;
        }
        state = newState;
    }

    TokenizerState getState() {
        return state;
    }

    /**
     * Sets the name an end tag must have to close raw text. Normally this
     * is the last start tag emitted; fragment parsing seeds it with the
     * context element's name.
     */
    void setLastStartTagName(String name) {
        lastStartTagName = name;
    }

    /**
     * Pushes characters to be tokenized next, ahead of the remaining
     * input. This is how text written by a script re-enters the parser.
     *
     * @param text the characters to insert
     * @throws IllegalStateException if end of input has already been reported
     */
    public void insert(CharSequence text) {
        if (eofEmitted) {
            throw new IllegalStateException("Tokenizer has already reached end of input");
        }
        input.push(text);
    }

    // ===== Locator Implementation =====

    @Override
    public String getPublicId() {
        return null;
    }

    @Override
    public String getSystemId() {
        return systemId;
    }

    public void setSystemId(String systemId) {
        this.systemId = systemId;
    }

    @Override
    public int getLineNumber() {
        return input.lineNumber;
    }

    @Override
    public int getColumnNumber() {
        return input.columnNumber;
    }

    // ===== Public API =====

    /**
     * Returns the next token.
     *
     * @return the next token, never null; {@link Token.EndOfFile} once the
     *         input is exhausted
     */
    public Token nextToken() {
        while (pending.isEmpty()) {
            if (eofEmitted) {
                return Token.EndOfFile.INSTANCE;
            }
            step();
        }
        return pending.poll();
    }

    // ===== Emission =====

    private void emit(Token token) {
        flushText();
        pending.add(token);
    }

    private void flushText() {
        if (text.length() > 0) {
            pending.add(new Token.Character(text.toString()));
            text.setLength(0);
        }
    }

    private void emitEOF() {
        emit(Token.EndOfFile.INSTANCE);
        eofEmitted = true;
    }

    private void startTag(boolean isEndTag) {
        endTag = isEndTag;
        selfClosing = false;
        tagName.setLength(0);
        attributes = new AttributeList();
        inAttribute = false;
    }

    private void startAttribute() {
        finishAttribute();
        attributeName.setLength(0);
        attributeValue.setLength(0);
        inAttribute = true;
    }

    private void finishAttribute() {
        if (!inAttribute) {
            return;
        }
        inAttribute = false;
        String name = attributeName.toString();
        if (!attributes.add(name, attributeValue.toString())) {
            errors.report(ParseErrorKind.DUPLICATE_ATTRIBUTE, name);
        }
    }

    private void emitTag() {
        finishAttribute();
        String name = tagName.toString();
        if (endTag) {
            if (!attributes.isEmpty()) {
                errors.report(ParseErrorKind.END_TAG_WITH_ATTRIBUTES, name);
            }
            if (selfClosing) {
                errors.report(ParseErrorKind.END_TAG_WITH_TRAILING_SOLIDUS, name);
            }
            emit(new Token.EndTag(name));
        } else {
            lastStartTagName = name;
            emit(new Token.StartTag(name, attributes, selfClosing));
        }
        attributes = null;
    }

    private void emitComment() {
        emit(new Token.Comment(commentData.toString()));
        commentData.setLength(0);
    }

    private void emitDoctype() {
        emit(doctype);
        doctype = null;
    }

    private boolean isAppropriateEndTag() {
        return endTag && lastStartTagName != null && lastStartTagName.contentEquals(tagName);
    }

    private void eofInTag() {
        errors.report(ParseErrorKind.EOF_IN_TAG);
        emitTag();
        emitEOF();
    }

    private void eofInComment() {
        errors.report(ParseErrorKind.EOF_IN_COMMENT);
        emitComment();
        emitEOF();
    }

    private void eofInDoctype() {
        errors.report(ParseErrorKind.EOF_IN_DOCTYPE);
        doctype.forceQuirks = true;
        emitDoctype();
        emitEOF();
    }

    private void malformedDoctype() {
        errors.report(ParseErrorKind.MALFORMED_DOCTYPE);
        doctype.forceQuirks = true;
    }

    private void unexpected(int ch) {
        errors.report(ParseErrorKind.UNEXPECTED_CHARACTER, String.valueOf((char) ch));
    }

    private void unexpectedNull() {
        errors.report(ParseErrorKind.UNEXPECTED_NULL_CHARACTER);
    }

    private void reconsumeIn(TokenizerState newState) {
        state = newState;
        reconsume = true;
    }

    // ===== State Machine =====

    private void step() {
        if (reconsume) {
            reconsume = false;
        } else {
            c = input.read();
        }
        CharClass cc = CharClass.classify(c);
        switch (state) {
            case DATA:
                data(cc);
                break;
            case RCDATA:
            case RAWTEXT:
            case SCRIPT_DATA:
                rawText(cc);
                break;
            case PLAINTEXT:
                plaintext(cc);
                break;
            case TAG_OPEN:
                tagOpen(cc);
                break;
            case END_TAG_OPEN:
                endTagOpen(cc);
                break;
            case TAG_NAME:
                tagName(cc);
                break;
            case RAW_LESS_THAN_SIGN:
                rawLessThanSign(cc);
                break;
            case RAW_END_TAG_OPEN:
                rawEndTagOpen(cc);
                break;
            case RAW_END_TAG_NAME:
                rawEndTagName(cc);
                break;
            case BEFORE_ATTRIBUTE_NAME:
                beforeAttributeName(cc);
                break;
            case ATTRIBUTE_NAME:
                attributeName(cc);
                break;
            case AFTER_ATTRIBUTE_NAME:
                afterAttributeName(cc);
                break;
            case BEFORE_ATTRIBUTE_VALUE:
                beforeAttributeValue(cc);
                break;
            case ATTRIBUTE_VALUE_DOUBLE_QUOTED:
                attributeValueQuoted(cc, CharClass.QUOT);
                break;
            case ATTRIBUTE_VALUE_SINGLE_QUOTED:
                attributeValueQuoted(cc, CharClass.APOS);
                break;
            case ATTRIBUTE_VALUE_UNQUOTED:
                attributeValueUnquoted(cc);
                break;
            case AFTER_ATTRIBUTE_VALUE_QUOTED:
                afterAttributeValueQuoted(cc);
                break;
            case SELF_CLOSING_START_TAG:
                selfClosingStartTag(cc);
                break;
            case BOGUS_COMMENT:
                bogusComment(cc);
                break;
            case MARKUP_DECLARATION_OPEN:
                markupDeclarationOpen();
                break;
            case COMMENT_START:
                commentStart(cc);
                break;
            case COMMENT_START_DASH:
                commentStartDash(cc);
                break;
            case COMMENT:
                comment(cc);
                break;
            case COMMENT_END_DASH:
                commentEndDash(cc);
                break;
            case COMMENT_END:
                commentEnd(cc);
                break;
            case COMMENT_END_BANG:
                commentEndBang(cc);
                break;
            case DOCTYPE:
                doctype(cc);
                break;
            case BEFORE_DOCTYPE_NAME:
                beforeDoctypeName(cc);
                break;
            case DOCTYPE_NAME:
                doctypeName(cc);
                break;
            case AFTER_DOCTYPE_NAME:
                afterDoctypeName(cc);
                break;
            case AFTER_DOCTYPE_PUBLIC_KEYWORD:
                afterDoctypeKeyword(cc, true);
                break;
            case AFTER_DOCTYPE_SYSTEM_KEYWORD:
                afterDoctypeKeyword(cc, false);
                break;
            case BEFORE_DOCTYPE_PUBLIC_IDENTIFIER:
                beforeDoctypeIdentifier(cc, true);
                break;
            case BEFORE_DOCTYPE_SYSTEM_IDENTIFIER:
                beforeDoctypeIdentifier(cc, false);
                break;
            case DOCTYPE_PUBLIC_IDENTIFIER_DOUBLE_QUOTED:
                doctypeIdentifier(cc, CharClass.QUOT, true);
                break;
            case DOCTYPE_PUBLIC_IDENTIFIER_SINGLE_QUOTED:
                doctypeIdentifier(cc, CharClass.APOS, true);
                break;
            case DOCTYPE_SYSTEM_IDENTIFIER_DOUBLE_QUOTED:
                doctypeIdentifier(cc, CharClass.QUOT, false);
                break;
            case DOCTYPE_SYSTEM_IDENTIFIER_SINGLE_QUOTED:
                doctypeIdentifier(cc, CharClass.APOS, false);
                break;
            case AFTER_DOCTYPE_PUBLIC_IDENTIFIER:
                afterDoctypePublicIdentifier(cc);
                break;
            case BETWEEN_DOCTYPE_PUBLIC_AND_SYSTEM_IDENTIFIERS:
                betweenDoctypeIdentifiers(cc);
                break;
            case AFTER_DOCTYPE_SYSTEM_IDENTIFIER:
                afterDoctypeSystemIdentifier(cc);
                break;
            case BOGUS_DOCTYPE:
                bogusDoctype(cc);
                break;
            case CDATA_SECTION:
                cdataSection(cc);
                break;
            case CDATA_SECTION_BRACKET:
                cdataSectionBracket(cc);
                break;
            case CDATA_SECTION_END:
                cdataSectionEnd(cc);
                break;
        }
    }

    // -- Content states --

    private void data(CharClass cc) {
        switch (cc) {
            case AMP:
                text.append(consumeCharacterReference(false));
                break;
            case LT:
                state = TokenizerState.TAG_OPEN;
                break;
            case NULL:
                // Passed through: the tree constructor decides what NUL means
                unexpectedNull();
                text.append((char) c);
                break;
            case EOF:
                emitEOF();
                break;
            default:
                text.append((char) c);
        }
    }

    private void rawText(CharClass cc) {
        switch (cc) {
            case AMP:
                if (state == TokenizerState.RCDATA) {
                    text.append(consumeCharacterReference(false));
                } else {
                    text.append('&');
                }
                break;
            case LT:
                rawState = state;
                state = TokenizerState.RAW_LESS_THAN_SIGN;
                break;
            case NULL:
                unexpectedNull();
                text.append(REPLACEMENT_CHARACTER);
                break;
            case EOF:
                emitEOF();
                break;
            default:
                text.append((char) c);
        }
    }

    private void plaintext(CharClass cc) {
        switch (cc) {
            case NULL:
                unexpectedNull();
                text.append(REPLACEMENT_CHARACTER);
                break;
            case EOF:
                emitEOF();
                break;
            default:
                text.append((char) c);
        }
    }

    // -- Tags --

    private void tagOpen(CharClass cc) {
        switch (cc) {
            case BANG:
                state = TokenizerState.MARKUP_DECLARATION_OPEN;
                break;
            case SLASH:
                state = TokenizerState.END_TAG_OPEN;
                break;
            case UPPER_ALPHA:
            case LOWER_ALPHA:
                startTag(false);
                reconsumeIn(TokenizerState.TAG_NAME);
                break;
            case QUERY:
                unexpected(c);
                commentData.setLength(0);
                reconsumeIn(TokenizerState.BOGUS_COMMENT);
                break;
            case EOF:
                errors.report(ParseErrorKind.EOF_IN_TAG);
                text.append('<');
                emitEOF();
                break;
            default:
                unexpected(c);
                text.append('<');
                reconsumeIn(TokenizerState.DATA);
        }
    }

    private void endTagOpen(CharClass cc) {
        switch (cc) {
            case UPPER_ALPHA:
            case LOWER_ALPHA:
                startTag(true);
                reconsumeIn(TokenizerState.TAG_NAME);
                break;
            case GT:
                errors.report(ParseErrorKind.MISSING_END_TAG_NAME);
                state = TokenizerState.DATA;
                break;
            case EOF:
                errors.report(ParseErrorKind.EOF_IN_TAG);
                text.append("</");
                emitEOF();
                break;
            default:
                unexpected(c);
                commentData.setLength(0);
                reconsumeIn(TokenizerState.BOGUS_COMMENT);
        }
    }

    private void tagName(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                state = TokenizerState.BEFORE_ATTRIBUTE_NAME;
                break;
            case SLASH:
                state = TokenizerState.SELF_CLOSING_START_TAG;
                break;
            case GT:
                state = TokenizerState.DATA;
                emitTag();
                break;
            case UPPER_ALPHA:
                tagName.append(CharClass.toLower(c));
                break;
            case NULL:
                unexpectedNull();
                tagName.append(REPLACEMENT_CHARACTER);
                break;
            case EOF:
                eofInTag();
                break;
            default:
                tagName.append((char) c);
        }
    }

    // -- Raw text end tags --

    private void rawLessThanSign(CharClass cc) {
        if (cc == CharClass.SLASH) {
            temporaryBuffer.setLength(0);
            state = TokenizerState.RAW_END_TAG_OPEN;
        } else {
            text.append('<');
            reconsumeIn(rawState);
        }
    }

    private void rawEndTagOpen(CharClass cc) {
        if (cc == CharClass.UPPER_ALPHA || cc == CharClass.LOWER_ALPHA) {
            startTag(true);
            reconsumeIn(TokenizerState.RAW_END_TAG_NAME);
        } else {
            text.append("</");
            reconsumeIn(rawState);
        }
    }

    private void rawEndTagName(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                if (isAppropriateEndTag()) {
                    state = TokenizerState.BEFORE_ATTRIBUTE_NAME;
                    return;
                }
                break;
            case SLASH:
                if (isAppropriateEndTag()) {
                    state = TokenizerState.SELF_CLOSING_START_TAG;
                    return;
                }
                break;
            case GT:
                if (isAppropriateEndTag()) {
                    state = TokenizerState.DATA;
                    emitTag();
                    return;
                }
                break;
            case UPPER_ALPHA:
                tagName.append(CharClass.toLower(c));
                temporaryBuffer.append((char) c);
                return;
            case LOWER_ALPHA:
                tagName.append((char) c);
                temporaryBuffer.append((char) c);
                return;
            default:
                break;
        }
        // Not the end tag we are looking for: it was just text
        text.append("</").append(temporaryBuffer);
        reconsumeIn(rawState);
    }

    // -- Attributes --

    private void beforeAttributeName(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                break;
            case SLASH:
            case GT:
            case EOF:
                reconsumeIn(TokenizerState.AFTER_ATTRIBUTE_NAME);
                break;
            case EQ:
                unexpected(c);
                startAttribute();
                attributeName.append((char) c);
                state = TokenizerState.ATTRIBUTE_NAME;
                break;
            default:
                startAttribute();
                reconsumeIn(TokenizerState.ATTRIBUTE_NAME);
        }
    }

    private void attributeName(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
            case SLASH:
            case GT:
            case EOF:
                reconsumeIn(TokenizerState.AFTER_ATTRIBUTE_NAME);
                break;
            case EQ:
                state = TokenizerState.BEFORE_ATTRIBUTE_VALUE;
                break;
            case UPPER_ALPHA:
                attributeName.append(CharClass.toLower(c));
                break;
            case NULL:
                unexpectedNull();
                attributeName.append(REPLACEMENT_CHARACTER);
                break;
            case QUOT:
            case APOS:
            case LT:
                unexpected(c);
                attributeName.append((char) c);
                break;
            default:
                attributeName.append((char) c);
        }
    }

    private void afterAttributeName(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                break;
            case SLASH:
                state = TokenizerState.SELF_CLOSING_START_TAG;
                break;
            case EQ:
                state = TokenizerState.BEFORE_ATTRIBUTE_VALUE;
                break;
            case GT:
                state = TokenizerState.DATA;
                emitTag();
                break;
            case EOF:
                eofInTag();
                break;
            default:
                startAttribute();
                reconsumeIn(TokenizerState.ATTRIBUTE_NAME);
        }
    }

    private void beforeAttributeValue(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                break;
            case QUOT:
                state = TokenizerState.ATTRIBUTE_VALUE_DOUBLE_QUOTED;
                break;
            case APOS:
                state = TokenizerState.ATTRIBUTE_VALUE_SINGLE_QUOTED;
                break;
            case GT:
                errors.report(ParseErrorKind.MISSING_ATTRIBUTE_VALUE);
                state = TokenizerState.DATA;
                emitTag();
                break;
            default:
                reconsumeIn(TokenizerState.ATTRIBUTE_VALUE_UNQUOTED);
        }
    }

    private void attributeValueQuoted(CharClass cc, CharClass quote) {
        if (cc == quote) {
            state = TokenizerState.AFTER_ATTRIBUTE_VALUE_QUOTED;
            return;
        }
        switch (cc) {
            case AMP:
                attributeValue.append(consumeCharacterReference(true));
                break;
            case NULL:
                unexpectedNull();
                attributeValue.append(REPLACEMENT_CHARACTER);
                break;
            case EOF:
                errors.report(ParseErrorKind.EOF_IN_ATTRIBUTE_VALUE);
                emitTag();
                emitEOF();
                break;
            default:
                attributeValue.append((char) c);
        }
    }

    private void attributeValueUnquoted(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                state = TokenizerState.BEFORE_ATTRIBUTE_NAME;
                break;
            case AMP:
                attributeValue.append(consumeCharacterReference(true));
                break;
            case GT:
                state = TokenizerState.DATA;
                emitTag();
                break;
            case NULL:
                unexpectedNull();
                attributeValue.append(REPLACEMENT_CHARACTER);
                break;
            case QUOT:
            case APOS:
            case LT:
            case EQ:
                unexpected(c);
                attributeValue.append((char) c);
                break;
            case EOF:
                eofInTag();
                break;
            default:
                if (c == '`') {
                    unexpected(c);
                }
                attributeValue.append((char) c);
        }
    }

    private void afterAttributeValueQuoted(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                state = TokenizerState.BEFORE_ATTRIBUTE_NAME;
                break;
            case SLASH:
                state = TokenizerState.SELF_CLOSING_START_TAG;
                break;
            case GT:
                state = TokenizerState.DATA;
                emitTag();
                break;
            case EOF:
                eofInTag();
                break;
            default:
                // Missing whitespace between attributes
                unexpected(c);
                reconsumeIn(TokenizerState.BEFORE_ATTRIBUTE_NAME);
        }
    }

    private void selfClosingStartTag(CharClass cc) {
        switch (cc) {
            case GT:
                selfClosing = true;
                state = TokenizerState.DATA;
                emitTag();
                break;
            case EOF:
                eofInTag();
                break;
            default:
                unexpected(c);
                reconsumeIn(TokenizerState.BEFORE_ATTRIBUTE_NAME);
        }
    }

    // -- Comments --

    private void bogusComment(CharClass cc) {
        switch (cc) {
            case GT:
                state = TokenizerState.DATA;
                emitComment();
                break;
            case EOF:
                emitComment();
                emitEOF();
                break;
            case NULL:
                unexpectedNull();
                commentData.append(REPLACEMENT_CHARACTER);
                break;
            default:
                commentData.append((char) c);
        }
    }

    private void markupDeclarationOpen() {
        commentData.setLength(0);
        if (c == '-' && input.peek(0) == '-') {
            input.skip(1);
            state = TokenizerState.COMMENT_START;
        } else if (CharClass.toLower(c) == 'd' && input.lookingAt("octype", true)) {
            input.skip(6);
            state = TokenizerState.DOCTYPE;
        } else if (c == '[' && input.lookingAt("CDATA[", false)) {
            input.skip(6);
            if (cdataAllowed != null && cdataAllowed.getAsBoolean()) {
                state = TokenizerState.CDATA_SECTION;
            } else {
                errors.report(ParseErrorKind.MALFORMED_COMMENT);
                commentData.append("[CDATA[");
                state = TokenizerState.BOGUS_COMMENT;
            }
        } else {
            errors.report(ParseErrorKind.MALFORMED_COMMENT);
            reconsumeIn(TokenizerState.BOGUS_COMMENT);
        }
    }

    private void commentStart(CharClass cc) {
        switch (cc) {
            case DASH:
                state = TokenizerState.COMMENT_START_DASH;
                break;
            case GT:
                errors.report(ParseErrorKind.MALFORMED_COMMENT);
                state = TokenizerState.DATA;
                emitComment();
                break;
            default:
                reconsumeIn(TokenizerState.COMMENT);
        }
    }

    private void commentStartDash(CharClass cc) {
        switch (cc) {
            case DASH:
                state = TokenizerState.COMMENT_END;
                break;
            case GT:
                errors.report(ParseErrorKind.MALFORMED_COMMENT);
                state = TokenizerState.DATA;
                emitComment();
                break;
            case EOF:
                eofInComment();
                break;
            default:
                commentData.append('-');
                reconsumeIn(TokenizerState.COMMENT);
        }
    }

    private void comment(CharClass cc) {
        switch (cc) {
            case DASH:
                state = TokenizerState.COMMENT_END_DASH;
                break;
            case NULL:
                unexpectedNull();
                commentData.append(REPLACEMENT_CHARACTER);
                break;
            case EOF:
                eofInComment();
                break;
            default:
                commentData.append((char) c);
        }
    }

    private void commentEndDash(CharClass cc) {
        switch (cc) {
            case DASH:
                state = TokenizerState.COMMENT_END;
                break;
            case EOF:
                eofInComment();
                break;
            default:
                commentData.append('-');
                reconsumeIn(TokenizerState.COMMENT);
        }
    }

    private void commentEnd(CharClass cc) {
        switch (cc) {
            case GT:
                state = TokenizerState.DATA;
                emitComment();
                break;
            case BANG:
                state = TokenizerState.COMMENT_END_BANG;
                break;
            case DASH:
                commentData.append('-');
                break;
            case EOF:
                eofInComment();
                break;
            default:
                commentData.append("--");
                reconsumeIn(TokenizerState.COMMENT);
        }
    }

    private void commentEndBang(CharClass cc) {
        switch (cc) {
            case DASH:
                commentData.append("--!");
                state = TokenizerState.COMMENT_END_DASH;
                break;
            case GT:
                errors.report(ParseErrorKind.MALFORMED_COMMENT);
                state = TokenizerState.DATA;
                emitComment();
                break;
            case EOF:
                eofInComment();
                break;
            default:
                commentData.append("--!");
                reconsumeIn(TokenizerState.COMMENT);
        }
    }

    // -- DOCTYPE --

    private void doctype(CharClass cc) {
        doctype = new Token.Doctype();
        switch (cc) {
            case WHITESPACE:
                state = TokenizerState.BEFORE_DOCTYPE_NAME;
                break;
            case GT:
                reconsumeIn(TokenizerState.BEFORE_DOCTYPE_NAME);
                break;
            case EOF:
                eofInDoctype();
                break;
            default:
                errors.report(ParseErrorKind.MALFORMED_DOCTYPE);
                reconsumeIn(TokenizerState.BEFORE_DOCTYPE_NAME);
        }
    }

    private void beforeDoctypeName(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                break;
            case UPPER_ALPHA:
                doctype.name = String.valueOf(CharClass.toLower(c));
                state = TokenizerState.DOCTYPE_NAME;
                break;
            case NULL:
                unexpectedNull();
                doctype.name = String.valueOf(REPLACEMENT_CHARACTER);
                state = TokenizerState.DOCTYPE_NAME;
                break;
            case GT:
                malformedDoctype();
                state = TokenizerState.DATA;
                emitDoctype();
                break;
            case EOF:
                eofInDoctype();
                break;
            default:
                doctype.name = String.valueOf((char) c);
                state = TokenizerState.DOCTYPE_NAME;
        }
    }

    private void doctypeName(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                state = TokenizerState.AFTER_DOCTYPE_NAME;
                break;
            case GT:
                state = TokenizerState.DATA;
                emitDoctype();
                break;
            case UPPER_ALPHA:
                doctype.name += CharClass.toLower(c);
                break;
            case NULL:
                unexpectedNull();
                doctype.name += REPLACEMENT_CHARACTER;
                break;
            case EOF:
                eofInDoctype();
                break;
            default:
                doctype.name += (char) c;
        }
    }

    private void afterDoctypeName(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                break;
            case GT:
                state = TokenizerState.DATA;
                emitDoctype();
                break;
            case EOF:
                eofInDoctype();
                break;
            default:
                char lower = CharClass.toLower(c);
                if (lower == 'p' && input.lookingAt("ublic", true)) {
                    input.skip(5);
                    state = TokenizerState.AFTER_DOCTYPE_PUBLIC_KEYWORD;
                } else if (lower == 's' && input.lookingAt("ystem", true)) {
                    input.skip(5);
                    state = TokenizerState.AFTER_DOCTYPE_SYSTEM_KEYWORD;
                } else {
                    malformedDoctype();
                    reconsumeIn(TokenizerState.BOGUS_DOCTYPE);
                }
        }
    }

    private void afterDoctypeKeyword(CharClass cc, boolean isPublic) {
        switch (cc) {
            case WHITESPACE:
                state = isPublic
                        ? TokenizerState.BEFORE_DOCTYPE_PUBLIC_IDENTIFIER
                        : TokenizerState.BEFORE_DOCTYPE_SYSTEM_IDENTIFIER;
                break;
            case QUOT:
            case APOS:
                // Missing whitespace after the keyword
                errors.report(ParseErrorKind.MALFORMED_DOCTYPE);
                openDoctypeIdentifier(cc, isPublic);
                break;
            case GT:
                malformedDoctype();
                state = TokenizerState.DATA;
                emitDoctype();
                break;
            case EOF:
                eofInDoctype();
                break;
            default:
                malformedDoctype();
                reconsumeIn(TokenizerState.BOGUS_DOCTYPE);
        }
    }

    private void beforeDoctypeIdentifier(CharClass cc, boolean isPublic) {
        switch (cc) {
            case WHITESPACE:
                break;
            case QUOT:
            case APOS:
                openDoctypeIdentifier(cc, isPublic);
                break;
            case GT:
                malformedDoctype();
                state = TokenizerState.DATA;
                emitDoctype();
                break;
            case EOF:
                eofInDoctype();
                break;
            default:
                malformedDoctype();
                reconsumeIn(TokenizerState.BOGUS_DOCTYPE);
        }
    }

    private void openDoctypeIdentifier(CharClass quote, boolean isPublic) {
        boolean doubleQuoted = (quote == CharClass.QUOT);
        if (isPublic) {
            doctype.publicId = "";
            state = doubleQuoted
                    ? TokenizerState.DOCTYPE_PUBLIC_IDENTIFIER_DOUBLE_QUOTED
                    : TokenizerState.DOCTYPE_PUBLIC_IDENTIFIER_SINGLE_QUOTED;
        } else {
            doctype.systemId = "";
            state = doubleQuoted
                    ? TokenizerState.DOCTYPE_SYSTEM_IDENTIFIER_DOUBLE_QUOTED
                    : TokenizerState.DOCTYPE_SYSTEM_IDENTIFIER_SINGLE_QUOTED;
        }
    }

    private void doctypeIdentifier(CharClass cc, CharClass quote, boolean isPublic) {
        if (cc == quote) {
            state = isPublic
                    ? TokenizerState.AFTER_DOCTYPE_PUBLIC_IDENTIFIER
                    : TokenizerState.AFTER_DOCTYPE_SYSTEM_IDENTIFIER;
            return;
        }
        switch (cc) {
            case NULL:
                unexpectedNull();
                appendIdentifier(REPLACEMENT_CHARACTER, isPublic);
                break;
            case GT:
                malformedDoctype();
                state = TokenizerState.DATA;
                emitDoctype();
                break;
            case EOF:
                eofInDoctype();
                break;
            default:
                appendIdentifier((char) c, isPublic);
        }
    }

    private void appendIdentifier(char ch, boolean isPublic) {
        if (isPublic) {
            doctype.publicId += ch;
        } else {
            doctype.systemId += ch;
        }
    }

    private void afterDoctypePublicIdentifier(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                state = TokenizerState.BETWEEN_DOCTYPE_PUBLIC_AND_SYSTEM_IDENTIFIERS;
                break;
            case GT:
                state = TokenizerState.DATA;
                emitDoctype();
                break;
            case QUOT:
            case APOS:
                errors.report(ParseErrorKind.MALFORMED_DOCTYPE);
                openDoctypeIdentifier(cc, false);
                break;
            case EOF:
                eofInDoctype();
                break;
            default:
                malformedDoctype();
                reconsumeIn(TokenizerState.BOGUS_DOCTYPE);
        }
    }

    private void betweenDoctypeIdentifiers(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                break;
            case GT:
                state = TokenizerState.DATA;
                emitDoctype();
                break;
            case QUOT:
            case APOS:
                openDoctypeIdentifier(cc, false);
                break;
            case EOF:
                eofInDoctype();
                break;
            default:
                malformedDoctype();
                reconsumeIn(TokenizerState.BOGUS_DOCTYPE);
        }
    }

    private void afterDoctypeSystemIdentifier(CharClass cc) {
        switch (cc) {
            case WHITESPACE:
                break;
            case GT:
                state = TokenizerState.DATA;
                emitDoctype();
                break;
            case EOF:
                eofInDoctype();
                break;
            default:
                // Trailing junk does not force quirks mode
                errors.report(ParseErrorKind.MALFORMED_DOCTYPE);
                reconsumeIn(TokenizerState.BOGUS_DOCTYPE);
        }
    }

    private void bogusDoctype(CharClass cc) {
        switch (cc) {
            case GT:
                state = TokenizerState.DATA;
                emitDoctype();
                break;
            case NULL:
                unexpectedNull();
                break;
            case EOF:
                emitDoctype();
                emitEOF();
                break;
            default:
                break;
        }
    }

    // -- CDATA sections --

    private void cdataSection(CharClass cc) {
        switch (cc) {
            case CLOSE_BRACKET:
                state = TokenizerState.CDATA_SECTION_BRACKET;
                break;
            case EOF:
                errors.report(ParseErrorKind.EOF_IN_CDATA);
                emitEOF();
                break;
            default:
                text.append((char) c);
        }
    }

    private void cdataSectionBracket(CharClass cc) {
        if (cc == CharClass.CLOSE_BRACKET) {
            state = TokenizerState.CDATA_SECTION_END;
        } else {
            text.append(']');
            reconsumeIn(TokenizerState.CDATA_SECTION);
        }
    }

    private void cdataSectionEnd(CharClass cc) {
        switch (cc) {
            case CLOSE_BRACKET:
                text.append(']');
                break;
            case GT:
                state = TokenizerState.DATA;
                break;
            default:
                text.append("]]");
                reconsumeIn(TokenizerState.CDATA_SECTION);
        }
    }

    // ===== Character References =====

    /**
     * Consumes a character reference following an ampersand that has just
     * been read. If no reference can be recognised nothing further is
     * consumed and the ampersand is returned as literal text.
     *
     * @param attribute true when scanning an attribute value
     * @return the replacement text
     */
    private String consumeCharacterReference(boolean attribute) {
        int next = input.peek(0);
        if (next == '#') {
            return consumeNumericReference();
        }
        if (!CharClass.isAsciiAlphanumeric(next)) {
            return "&";
        }
        StringBuilder name = new StringBuilder();
        int max = NamedCharacterReferences.getMaxNameLength();
        for (int i = 0; i < max && CharClass.isAsciiAlphanumeric(input.peek(i)); i++) {
            name.append((char) input.peek(i));
        }
        for (int length = name.length(); length > 0; length--) {
            String candidate = name.substring(0, length);
            String replacement = NamedCharacterReferences.get(candidate);
            if (replacement == null) {
                continue;
            }
            int after = input.peek(length);
            if (after == ';') {
                input.skip(length + 1);
                return replacement;
            }
            if (!NamedCharacterReferences.isLegacy(candidate)) {
                continue;
            }
            if (attribute && (after == '=' || CharClass.isAsciiAlphanumeric(after))) {
                // Historical: "?a=1&copy=2" in a URL keeps its ampersand
                return "&";
            }
            errors.report(ParseErrorKind.INVALID_CHARACTER_REFERENCE, "&" + candidate);
            input.skip(length);
            return replacement;
        }
        if (input.peek(name.length()) == ';') {
            errors.report(ParseErrorKind.INVALID_CHARACTER_REFERENCE, "&" + name + ";");
        }
        return "&";
    }

    private String consumeNumericReference() {
        int offset = 1;
        boolean hex = false;
        int x = input.peek(1);
        if (x == 'x' || x == 'X') {
            hex = true;
            offset = 2;
        }
        int start = offset;
        long value = 0;
        while (true) {
            int d = input.peek(offset);
            int digit;
            if (CharClass.isAsciiDigit(d)) {
                digit = d - '0';
            } else if (hex && CharClass.isAsciiHexDigit(d)) {
                digit = CharClass.toLower(d) - 'a' + 10;
            } else {
                break;
            }
            value = value * (hex ? 16 : 10) + digit;
            if (value > 0x10FFFF) {
                // Clamp so that long runs of digits cannot overflow
                value = 0x110000;
            }
            offset++;
        }
        if (offset == start) {
            errors.report(ParseErrorKind.INVALID_CHARACTER_REFERENCE, "&#");
            return "&";
        }
        input.skip(offset);
        if (input.peek(0) == ';') {
            input.skip(1);
        } else {
            errors.report(ParseErrorKind.INVALID_CHARACTER_REFERENCE, "&#" + value);
        }
        if (NamedCharacterReferences.isErroneousNumeric(value)) {
            errors.report(ParseErrorKind.INVALID_CHARACTER_REFERENCE, "&#" + value + ";");
        }
        return new String(Character.toChars(NamedCharacterReferences.numericReplacement(value)));
    }

}
