/*
 * TreeConstructor.java
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

import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the document tree from tokens.
 * <p>
 * This is the insertion-mode state machine. Each call to
 * {@link #processToken} dispatches the token on the current insertion
 * mode. A mode handler either consumes the token or asks for it to be
 * reprocessed, usually after switching to another mode; the dispatch loop
 * then runs again with the same token. Tokens are never handed back to
 * the tokenizer.
 * <p>
 * Character tokens are split into runs of whitespace, NUL and other
 * characters before dispatch, so each handler sees runs of a single kind.
 * <p>
 * When the end tag of a script element is processed, the script element
 * is returned as a {@link PendingScript} so the driver can run it before
 * the next token is requested.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class TreeConstructor {

    private static final Logger LOGGER = Logger.getLogger(TreeConstructor.class.getName());

    /** Handler result: the token must be processed again. */
    private static final boolean REPROCESS = true;

    /** Handler result: the token has been dealt with. */
    private static final boolean CONSUMED = false;

    private static final int ADOPTION_AGENCY_OUTER_LIMIT = 8;
    private static final int ADOPTION_AGENCY_INNER_LIMIT = 3;

    private final Document document;
    private final Tokenizer tokenizer;
    private final ErrorReporter errors;
    private final boolean scripting;

    private final OpenElementsStack stack = new OpenElementsStack();
    private final ActiveFormattingList formatting = new ActiveFormattingList();
    private final Deque<InsertionMode> templateModes = new ArrayDeque<>();

    private InsertionMode mode = InsertionMode.INITIAL;
    private InsertionMode originalMode;

    private Element headElement;
    private Element formElement;
    private Element contextElement;

    private boolean framesetOk = true;
    private boolean fosterParenting;
    private boolean ignoreNextLineFeed;

    // In table text
    private final StringBuilder pendingTableText = new StringBuilder();
    private boolean pendingTableTextDirty;

    private PendingScript pendingScript;

    /**
     * Location for a node about to be inserted.
     */
    private static final class InsertionPoint {

        final Node parent;
        final Node reference;

        InsertionPoint(Node parent, Node reference) {
            this.parent = parent;
            this.reference = reference;
        }

    }

    TreeConstructor(Document document, Tokenizer tokenizer, ErrorReporter errors, boolean scripting) {
        this.document = document;
        this.tokenizer = tokenizer;
        this.errors = errors;
        this.scripting = scripting;
        tokenizer.setCdataAllowed(this::isCdataAllowed);
    }

    /**
     * Prepares for parsing a fragment in the context of the given element.
     * Creates the {@code html} root that will hold the parsed nodes.
     *
     * @param context the context element
     * @return the root whose children are the fragment
     */
    Element setFragmentContext(Element context) {
        contextElement = context;
        Document contextDocument = context.getOwnerDocument();
        if (contextDocument != null) {
            document.setQuirksMode(contextDocument.getQuirksMode());
        }
        Element root = document.createElement("html");
        document.appendChild(root);
        stack.push(root);
        if (context.isHTML()) {
            String name = context.getLocalName();
            switch (name) {
                case "title":
                case "textarea":
                    tokenizer.setState(TokenizerState.RCDATA);
                    break;
                case "style":
                case "xmp":
                case "iframe":
                case "noembed":
                case "noframes":
                    tokenizer.setState(TokenizerState.RAWTEXT);
                    break;
                case "script":
                    tokenizer.setState(TokenizerState.SCRIPT_DATA);
                    break;
                case "noscript":
                    if (scripting) {
                        tokenizer.setState(TokenizerState.RAWTEXT);
                    }
                    break;
                case "plaintext":
                    tokenizer.setState(TokenizerState.PLAINTEXT);
                    break;
                case "template":
                    templateModes.push(InsertionMode.IN_TEMPLATE);
                    break;
                default:
                    break;
            }
            tokenizer.setLastStartTagName(name);
        }
        resetInsertionMode();
        for (Node node = context; node != null; node = node.getParentNode()) {
            if (node instanceof Element && ((Element) node).isHTML("form")) {
                formElement = (Element) node;
                break;
            }
        }
        return root;
    }

    Document getDocument() {
        return document;
    }

    InsertionMode getInsertionMode() {
        return mode;
    }

    OpenElementsStack getOpenElements() {
        return stack;
    }

    ActiveFormattingList getActiveFormattingElements() {
        return formatting;
    }

    // ===== Dispatch =====

    /**
     * Processes one token.
     *
     * @param token the token
     * @return a script to run before the next token, or null
     */
    PendingScript processToken(Token token) {
        pendingScript = null;
        if (ignoreNextLineFeed) {
            ignoreNextLineFeed = false;
            if (token.getType() == TokenType.CHARACTER) {
                String data = ((Token.Character) token).getData();
                if (data.charAt(0) == '\n') {
                    if (data.length() == 1) {
                        return null;
                    }
                    token = new Token.Character(data.substring(1));
                }
            }
        }
        if (token.getType() == TokenType.CHARACTER) {
            String data = ((Token.Character) token).getData();
            int start = 0;
            for (int i = 1; i <= data.length(); i++) {
                if (i == data.length() || runKind(data.charAt(i)) != runKind(data.charAt(start))) {
                    process(new Token.Character(data.substring(start, i)));
                    start = i;
                }
            }
        } else {
            process(token);
        }
        PendingScript script = pendingScript;
        pendingScript = null;
        return script;
    }

    private static int runKind(char c) {
        if (c == 0) {
            return 0;
        }
        return isWhitespace(c) ? 1 : 2;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\f' || c == '\r';
    }

    private void process(Token token) {
        boolean reprocess;
        do {
            if (useInsertionModeRules(token)) {
                reprocess = dispatch(mode, token);
            } else {
                reprocess = inForeignContent(token);
            }
        } while (reprocess);
        if (token instanceof Token.StartTag) {
            Token.StartTag tag = (Token.StartTag) token;
            if (tag.isSelfClosing() && !tag.isSelfClosingAcknowledged()) {
                errors.report(ParseErrorKind.NON_VOID_SELF_CLOSING, tag.getName());
            }
        }
    }

    private boolean dispatch(InsertionMode insertionMode, Token token) {
        switch (insertionMode) {
            case INITIAL:
                return initial(token);
            case BEFORE_HTML:
                return beforeHtml(token);
            case BEFORE_HEAD:
                return beforeHead(token);
            case IN_HEAD:
                return inHead(token);
            case IN_HEAD_NOSCRIPT:
                return inHeadNoscript(token);
            case AFTER_HEAD:
                return afterHead(token);
            case IN_BODY:
                return inBody(token);
            case TEXT:
                return text(token);
            case IN_TABLE:
                return inTable(token);
            case IN_TABLE_TEXT:
                return inTableText(token);
            case IN_CAPTION:
                return inCaption(token);
            case IN_COLUMN_GROUP:
                return inColumnGroup(token);
            case IN_TABLE_BODY:
                return inTableBody(token);
            case IN_ROW:
                return inRow(token);
            case IN_CELL:
                return inCell(token);
            case IN_SELECT:
                return inSelect(token);
            case IN_SELECT_IN_TABLE:
                return inSelectInTable(token);
            case IN_TEMPLATE:
                return inTemplate(token);
            case AFTER_BODY:
                return afterBody(token);
            case IN_FRAMESET:
                return inFrameset(token);
            case AFTER_FRAMESET:
                return afterFrameset(token);
            case AFTER_AFTER_BODY:
                return afterAfterBody(token);
            case AFTER_AFTER_FRAMESET:
                return afterAfterFrameset(token);
            default:
                throw new IllegalStateException(insertionMode.name());
        }
    }

    private void switchTo(InsertionMode newMode) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            String message = Parser.L10N.getString("debug.mode_switch");
            LOGGER.finest(MessageFormat.format(message, mode, newMode));
        }
        mode = newMode;
    }

    /**
     * Decides whether a token goes to the insertion mode or to the rules
     * for foreign content.
     */
    private boolean useInsertionModeRules(Token token) {
        Element node = adjustedCurrentNode();
        if (node == null || node.isHTML() || token.getType() == TokenType.EOF) {
            return true;
        }
        boolean startTag = token.getType() == TokenType.START_TAG;
        boolean characters = token.getType() == TokenType.CHARACTER;
        if (ElementTypes.isMathMLTextIntegrationPoint(node)) {
            if (characters) {
                return true;
            }
            if (startTag) {
                String name = ((Token.StartTag) token).getName();
                if (!"mglyph".equals(name) && !"malignmark".equals(name)) {
                    return true;
                }
            }
        }
        if (startTag && node.is(Namespaces.MATHML, "annotation-xml")
                && "svg".equals(((Token.StartTag) token).getName())) {
            return true;
        }
        return (startTag || characters) && ElementTypes.isHTMLIntegrationPoint(node);
    }

    private Element adjustedCurrentNode() {
        if (contextElement != null && stack.size() == 1) {
            return contextElement;
        }
        return stack.current();
    }

    private boolean isCdataAllowed() {
        Element node = adjustedCurrentNode();
        return node != null && !node.isHTML();
    }

    // ===== Token predicates =====

    private static boolean isStartTag(Token token, String... names) {
        if (token.getType() != TokenType.START_TAG) {
            return false;
        }
        return names.length == 0 || matches(((Token.Tag) token).getName(), names);
    }

    private static boolean isEndTag(Token token, String... names) {
        if (token.getType() != TokenType.END_TAG) {
            return false;
        }
        return names.length == 0 || matches(((Token.Tag) token).getName(), names);
    }

    private static boolean matches(String name, String[] names) {
        for (String candidate : names) {
            if (candidate.equals(name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWhitespaceRun(Token token) {
        return token.getType() == TokenType.CHARACTER
                && isWhitespace(((Token.Character) token).getData().charAt(0));
    }

    private static boolean isNullRun(Token token) {
        return token.getType() == TokenType.CHARACTER
                && ((Token.Character) token).getData().charAt(0) == 0;
    }

    private static String tagName(Token token) {
        return ((Token.Tag) token).getName();
    }

    private static String characters(Token token) {
        return ((Token.Character) token).getData();
    }

    // ===== Errors =====

    private boolean unexpected(Token token) {
        switch (token.getType()) {
            case START_TAG:
                errors.report(ParseErrorKind.UNEXPECTED_START_TAG, tagName(token));
                break;
            case END_TAG:
                errors.report(ParseErrorKind.UNEXPECTED_END_TAG, tagName(token));
                break;
            case DOCTYPE:
                errors.report(ParseErrorKind.UNEXPECTED_DOCTYPE);
                break;
            case CHARACTER:
                errors.report(ParseErrorKind.UNEXPECTED_CHARACTERS);
                break;
            default:
                errors.report(ParseErrorKind.UNEXPECTED_EOF);
                break;
        }
        return CONSUMED;
    }

    // ===== Insertion =====

    private InsertionPoint appropriatePlace(Element override) {
        Element target = (override != null) ? override : stack.current();
        InsertionPoint place;
        if (fosterParenting && target.isHTML() && ElementTypes.FOSTER_TARGETS.contains(target.getLocalName())) {
            Element lastTemplate = stack.findHTML("template");
            Element lastTable = stack.findHTML("table");
            if (lastTemplate != null && (lastTable == null || stack.indexOf(lastTemplate) > stack.indexOf(lastTable))) {
                place = new InsertionPoint(lastTemplate, null);
            } else if (lastTable == null) {
                place = new InsertionPoint(stack.get(0), null);
            } else if (lastTable.getParentNode() != null) {
                place = new InsertionPoint(lastTable.getParentNode(), lastTable);
            } else {
                place = new InsertionPoint(stack.get(stack.indexOf(lastTable) - 1), null);
            }
        } else {
            place = new InsertionPoint(target, null);
        }
        if (place.parent instanceof Element && ((Element) place.parent).isHTML("template")) {
            place = new InsertionPoint(((Element) place.parent).getContent(), null);
        }
        return place;
    }

    private void insertCharacters(String data) {
        InsertionPoint place = appropriatePlace(null);
        if (place.parent instanceof Document) {
            return;
        }
        Node previous = (place.reference == null)
                ? place.parent.getLastChild()
                : place.reference.getPreviousSibling();
        if (previous instanceof Text) {
            ((Text) previous).appendData(data);
        } else {
            place.parent.insertBefore(document.createTextNode(data), place.reference);
        }
    }

    private void insertComment(Token token) {
        InsertionPoint place = appropriatePlace(null);
        place.parent.insertBefore(document.createComment(((Token.Comment) token).getData()), place.reference);
    }

    private void appendComment(Token token, Node parent) {
        parent.appendChild(document.createComment(((Token.Comment) token).getData()));
    }

    private void insertElement(Element element) {
        InsertionPoint place = appropriatePlace(null);
        place.parent.insertBefore(element, place.reference);
        stack.push(element);
    }

    private Element insertForeignElement(Token.StartTag tag, String namespaceURI) {
        Element element = document.createElement(tag.getName(), namespaceURI, tag.getAttributes());
        insertElement(element);
        return element;
    }

    private Element insertHTMLElement(Token.StartTag tag) {
        return insertForeignElement(tag, Namespaces.HTML);
    }

    private Element insertHTMLElement(String name) {
        return insertHTMLElement(new Token.StartTag(name));
    }

    /**
     * Inserts an element that is popped straight away.
     */
    private void insertVoidElement(Token.StartTag tag) {
        insertHTMLElement(tag);
        stack.pop();
        tag.acknowledgeSelfClosing();
    }

    private void parseRawText(Token.StartTag tag, TokenizerState state) {
        insertHTMLElement(tag);
        tokenizer.setState(state);
        originalMode = mode;
        switchTo(InsertionMode.TEXT);
    }

    private void mergeAttributes(Token.StartTag tag, Element element) {
        AttributeList existing = element.getAttributes();
        for (Attribute attribute : tag.getAttributes()) {
            existing.add(new Attribute(attribute.getName(), attribute.getValue()));
        }
    }

    // ===== Common algorithms =====

    /**
     * Reopens formatting elements that were implicitly closed, so that
     * text inserted next is still inside them.
     */
    private void reconstructActiveFormattingElements() {
        if (formatting.isEmpty()) {
            return;
        }
        int i = formatting.size() - 1;
        if (formatting.isMarker(i) || stack.contains(formatting.get(i))) {
            return;
        }
        while (i > 0) {
            if (formatting.isMarker(i - 1) || stack.contains(formatting.get(i - 1))) {
                break;
            }
            i--;
        }
        for (; i < formatting.size(); i++) {
            Element clone = formatting.get(i).cloneShallow();
            insertElement(clone);
            formatting.set(i, clone);
        }
    }

    /**
     * Repairs misnested formatting elements on their end tag.
     *
     * @param subject the end tag name
     * @return true if the end tag should instead be handled as an ordinary
     *         end tag
     */
    private boolean adoptionAgency(String subject) {
        Element current = stack.current();
        if (current.isHTML(subject) && !formatting.contains(current)) {
            stack.pop();
            return false;
        }
        for (int outer = 0; outer < ADOPTION_AGENCY_OUTER_LIMIT; outer++) {
            Element formattingElement = formatting.lastElementAfterMarker(subject);
            if (formattingElement == null) {
                return true;
            }
            if (!stack.contains(formattingElement)) {
                errors.report(ParseErrorKind.MISNESTED_FORMATTING, subject);
                formatting.remove(formattingElement);
                return false;
            }
            if (!stack.hasElementInScope(formattingElement)) {
                errors.report(ParseErrorKind.MISNESTED_FORMATTING, subject);
                return false;
            }
            if (formattingElement != stack.current()) {
                errors.report(ParseErrorKind.MISNESTED_FORMATTING, subject);
            }
            int formattingIndex = stack.indexOf(formattingElement);
            Element furthestBlock = null;
            for (int i = formattingIndex + 1; i < stack.size(); i++) {
                if (ElementTypes.isSpecial(stack.get(i))) {
                    furthestBlock = stack.get(i);
                    break;
                }
            }
            if (furthestBlock == null) {
                stack.popUntil(formattingElement);
                formatting.remove(formattingElement);
                return false;
            }
            Element commonAncestor = stack.get(formattingIndex - 1);
            int bookmark = formatting.indexOf(formattingElement) + 1;
            Element lastNode = furthestBlock;
            int nodeIndex = stack.indexOf(furthestBlock);
            int inner = 0;
            while (true) {
                inner++;
                nodeIndex--;
                Element node = stack.get(nodeIndex);
                if (node == formattingElement) {
                    break;
                }
                int entry = formatting.indexOf(node);
                if (inner > ADOPTION_AGENCY_INNER_LIMIT && entry >= 0) {
                    if (entry < bookmark) {
                        bookmark--;
                    }
                    formatting.remove(node);
                    entry = -1;
                }
                if (entry < 0) {
                    stack.remove(node);
                    continue;
                }
                Element clone = node.cloneShallow();
                formatting.set(entry, clone);
                stack.replace(node, clone);
                if (lastNode == furthestBlock) {
                    bookmark = entry + 1;
                }
                clone.appendChild(lastNode);
                lastNode = clone;
            }
            InsertionPoint place = appropriatePlace(commonAncestor);
            place.parent.insertBefore(lastNode, place.reference);
            Element clone = formattingElement.cloneShallow();
            furthestBlock.moveChildrenTo(clone);
            furthestBlock.appendChild(clone);
            if (formatting.indexOf(formattingElement) < bookmark) {
                bookmark--;
            }
            formatting.remove(formattingElement);
            formatting.insert(bookmark, clone);
            stack.remove(formattingElement);
            stack.insert(stack.indexOf(furthestBlock) + 1, clone);
        }
        return false;
    }

    private void closePElement() {
        stack.generateImpliedEndTags("p");
        if (!stack.current().isHTML("p")) {
            errors.report(ParseErrorKind.UNEXPECTED_END_TAG, "p");
        }
        stack.popUntil("p");
    }

    private void closePInButtonScope() {
        if (stack.hasElementInButtonScope("p")) {
            closePElement();
        }
    }

    /**
     * Closes an element by name after generating implied end tags,
     * reporting an error if it was not the current node.
     */
    private void closeElement(String name) {
        stack.generateImpliedEndTags(null);
        if (!stack.current().isHTML(name)) {
            errors.report(ParseErrorKind.UNEXPECTED_END_TAG, name);
        }
        stack.popUntil(name);
    }

    void resetInsertionMode() {
        for (int i = stack.size() - 1; i >= 0; i--) {
            Element node = stack.get(i);
            boolean last = (i == 0);
            if (last && contextElement != null) {
                node = contextElement;
            }
            if (node.isHTML()) {
                switch (node.getLocalName()) {
                    case "select":
                        if (!last) {
                            for (int j = i - 1; j > 0; j--) {
                                Element ancestor = stack.get(j);
                                if (ancestor.isHTML("template")) {
                                    break;
                                }
                                if (ancestor.isHTML("table")) {
                                    switchTo(InsertionMode.IN_SELECT_IN_TABLE);
                                    return;
                                }
                            }
                        }
                        switchTo(InsertionMode.IN_SELECT);
                        return;
                    case "td":
                    case "th":
                        if (!last) {
                            switchTo(InsertionMode.IN_CELL);
                            return;
                        }
                        break;
                    case "tr":
                        switchTo(InsertionMode.IN_ROW);
                        return;
                    case "tbody":
                    case "thead":
                    case "tfoot":
                        switchTo(InsertionMode.IN_TABLE_BODY);
                        return;
                    case "caption":
                        switchTo(InsertionMode.IN_CAPTION);
                        return;
                    case "colgroup":
                        switchTo(InsertionMode.IN_COLUMN_GROUP);
                        return;
                    case "table":
                        switchTo(InsertionMode.IN_TABLE);
                        return;
                    case "template":
                        switchTo(templateModes.peek());
                        return;
                    case "head":
                        if (!last) {
                            switchTo(InsertionMode.IN_HEAD);
                            return;
                        }
                        break;
                    case "body":
                        switchTo(InsertionMode.IN_BODY);
                        return;
                    case "frameset":
                        switchTo(InsertionMode.IN_FRAMESET);
                        return;
                    case "html":
                        switchTo(headElement == null ? InsertionMode.BEFORE_HEAD : InsertionMode.AFTER_HEAD);
                        return;
                    default:
                        break;
                }
            }
            if (last) {
                switchTo(InsertionMode.IN_BODY);
                return;
            }
        }
    }

    // ===== Insertion modes =====

    private boolean initial(Token token) {
        switch (token.getType()) {
            case CHARACTER:
                if (isWhitespaceRun(token)) {
                    return CONSUMED;
                }
                break;
            case COMMENT:
                appendComment(token, document);
                return CONSUMED;
            case DOCTYPE:
                Token.Doctype doctype = (Token.Doctype) token;
                if (!"html".equals(doctype.getName())) {
                    errors.report(ParseErrorKind.UNEXPECTED_DOCTYPE);
                }
                String name = (doctype.getName() == null) ? "" : doctype.getName();
                document.appendChild(document.createDocumentType(name, doctype.getPublicId(), doctype.getSystemId()));
                document.setQuirksMode(QuirksMode.forDoctype(doctype));
                switchTo(InsertionMode.BEFORE_HTML);
                return CONSUMED;
            default:
                break;
        }
        errors.report(ParseErrorKind.MISSING_DOCTYPE);
        document.setQuirksMode(QuirksMode.QUIRKS);
        switchTo(InsertionMode.BEFORE_HTML);
        return REPROCESS;
    }

    private boolean beforeHtml(Token token) {
        if (token.getType() == TokenType.DOCTYPE) {
            return unexpected(token);
        } else if (token.getType() == TokenType.COMMENT) {
            appendComment(token, document);
            return CONSUMED;
        } else if (isWhitespaceRun(token)) {
            return CONSUMED;
        } else if (isStartTag(token, "html")) {
            Element html = document.createElement("html", Namespaces.HTML, ((Token.StartTag) token).getAttributes());
            document.appendChild(html);
            stack.push(html);
            switchTo(InsertionMode.BEFORE_HEAD);
            return CONSUMED;
        } else if (isEndTag(token) && !isEndTag(token, "head", "body", "html", "br")) {
            return unexpected(token);
        }
        Element html = document.createElement("html");
        document.appendChild(html);
        stack.push(html);
        switchTo(InsertionMode.BEFORE_HEAD);
        return REPROCESS;
    }

    private boolean beforeHead(Token token) {
        if (isWhitespaceRun(token)) {
            return CONSUMED;
        } else if (token.getType() == TokenType.COMMENT) {
            insertComment(token);
            return CONSUMED;
        } else if (token.getType() == TokenType.DOCTYPE) {
            return unexpected(token);
        } else if (isStartTag(token, "html")) {
            return inBody(token);
        } else if (isStartTag(token, "head")) {
            headElement = insertHTMLElement((Token.StartTag) token);
            switchTo(InsertionMode.IN_HEAD);
            return CONSUMED;
        } else if (isEndTag(token) && !isEndTag(token, "head", "body", "html", "br")) {
            return unexpected(token);
        }
        headElement = insertHTMLElement("head");
        switchTo(InsertionMode.IN_HEAD);
        return REPROCESS;
    }

    private boolean inHead(Token token) {
        switch (token.getType()) {
            case CHARACTER:
                if (isWhitespaceRun(token)) {
                    insertCharacters(characters(token));
                    return CONSUMED;
                }
                break;
            case COMMENT:
                insertComment(token);
                return CONSUMED;
            case DOCTYPE:
                return unexpected(token);
            case START_TAG:
                Token.StartTag tag = (Token.StartTag) token;
                switch (tag.getName()) {
                    case "html":
                        return inBody(token);
                    case "base":
                    case "basefont":
                    case "bgsound":
                    case "link":
                    case "meta":
                        insertVoidElement(tag);
                        return CONSUMED;
                    case "title":
                        parseRawText(tag, TokenizerState.RCDATA);
                        return CONSUMED;
                    case "noscript":
                        if (!scripting) {
                            insertHTMLElement(tag);
                            switchTo(InsertionMode.IN_HEAD_NOSCRIPT);
                            return CONSUMED;
                        }
                        parseRawText(tag, TokenizerState.RAWTEXT);
                        return CONSUMED;
                    case "noframes":
                    case "style":
                        parseRawText(tag, TokenizerState.RAWTEXT);
                        return CONSUMED;
                    case "script":
                        parseRawText(tag, TokenizerState.SCRIPT_DATA);
                        return CONSUMED;
                    case "template":
                        insertHTMLElement(tag);
                        formatting.pushMarker();
                        framesetOk = false;
                        switchTo(InsertionMode.IN_TEMPLATE);
                        templateModes.push(InsertionMode.IN_TEMPLATE);
                        return CONSUMED;
                    case "head":
                        return unexpected(token);
                    default:
                        break;
                }
                break;
            case END_TAG:
                switch (tagName(token)) {
                    case "head":
                        stack.pop();
                        switchTo(InsertionMode.AFTER_HEAD);
                        return CONSUMED;
                    case "body":
                    case "html":
                    case "br":
                        break;
                    case "template":
                        endTemplate(token);
                        return CONSUMED;
                    default:
                        return unexpected(token);
                }
                break;
            default:
                break;
        }
        stack.pop();
        switchTo(InsertionMode.AFTER_HEAD);
        return REPROCESS;
    }

    private void endTemplate(Token token) {
        if (!stack.containsHTML("template")) {
            unexpected(token);
            return;
        }
        stack.generateImpliedEndTagsThoroughly();
        if (!stack.current().isHTML("template")) {
            errors.report(ParseErrorKind.UNEXPECTED_END_TAG, "template");
        }
        stack.popUntil("template");
        formatting.clearToLastMarker();
        templateModes.pop();
        resetInsertionMode();
    }

    private boolean inHeadNoscript(Token token) {
        if (token.getType() == TokenType.DOCTYPE) {
            return unexpected(token);
        } else if (isStartTag(token, "html")) {
            return inBody(token);
        } else if (isEndTag(token, "noscript")) {
            stack.pop();
            switchTo(InsertionMode.IN_HEAD);
            return CONSUMED;
        } else if (isWhitespaceRun(token) || token.getType() == TokenType.COMMENT
                || isStartTag(token, "basefont", "bgsound", "link", "meta", "noframes", "style")) {
            return inHead(token);
        } else if (isStartTag(token, "head", "noscript")
                || (isEndTag(token) && !isEndTag(token, "br"))) {
            return unexpected(token);
        }
        unexpected(token);
        stack.pop();
        switchTo(InsertionMode.IN_HEAD);
        return REPROCESS;
    }

    private boolean afterHead(Token token) {
        if (isWhitespaceRun(token)) {
            insertCharacters(characters(token));
            return CONSUMED;
        } else if (token.getType() == TokenType.COMMENT) {
            insertComment(token);
            return CONSUMED;
        } else if (token.getType() == TokenType.DOCTYPE) {
            return unexpected(token);
        } else if (isStartTag(token, "html")) {
            return inBody(token);
        } else if (isStartTag(token, "body")) {
            insertHTMLElement((Token.StartTag) token);
            framesetOk = false;
            switchTo(InsertionMode.IN_BODY);
            return CONSUMED;
        } else if (isStartTag(token, "frameset")) {
            insertHTMLElement((Token.StartTag) token);
            switchTo(InsertionMode.IN_FRAMESET);
            return CONSUMED;
        } else if (isStartTag(token, "base", "basefont", "bgsound", "link", "meta", "noframes",
                "script", "style", "template", "title")) {
            errors.report(ParseErrorKind.UNEXPECTED_START_TAG, tagName(token));
            stack.push(headElement);
            boolean result = inHead(token);
            stack.remove(headElement);
            return result;
        } else if (isEndTag(token, "template")) {
            return inHead(token);
        } else if (isStartTag(token, "head")
                || (isEndTag(token) && !isEndTag(token, "body", "html", "br"))) {
            return unexpected(token);
        }
        insertHTMLElement("body");
        switchTo(InsertionMode.IN_BODY);
        return REPROCESS;
    }

    private boolean inBody(Token token) {
        switch (token.getType()) {
            case CHARACTER:
                if (isNullRun(token)) {
                    // Already reported by the tokenizer
                    return CONSUMED;
                }
                reconstructActiveFormattingElements();
                insertCharacters(characters(token));
                if (!isWhitespaceRun(token)) {
                    framesetOk = false;
                }
                return CONSUMED;
            case COMMENT:
                insertComment(token);
                return CONSUMED;
            case DOCTYPE:
                return unexpected(token);
            case START_TAG:
                return inBodyStartTag((Token.StartTag) token);
            case END_TAG:
                return inBodyEndTag(token);
            default:
                if (!templateModes.isEmpty()) {
                    return inTemplate(token);
                }
                checkUnclosedElements();
                return CONSUMED;
        }
    }

    private void checkUnclosedElements() {
        for (int i = 0; i < stack.size(); i++) {
            Element element = stack.get(i);
            if (!element.isHTML()
                    || !(ElementTypes.IMPLIED_END_TAGS_THOROUGH.contains(element.getLocalName())
                        || element.isHTML("body") || element.isHTML("html"))) {
                errors.report(ParseErrorKind.UNCLOSED_ELEMENTS);
                return;
            }
        }
    }

    private boolean inBodyStartTag(Token.StartTag tag) {
        String name = tag.getName();
        switch (name) {
            case "html":
                errors.report(ParseErrorKind.STRAY_STRUCTURAL_TAG, name);
                if (!stack.containsHTML("template")) {
                    mergeAttributes(tag, stack.get(0));
                }
                return CONSUMED;
            case "base":
            case "basefont":
            case "bgsound":
            case "link":
            case "meta":
            case "noframes":
            case "script":
            case "style":
            case "template":
            case "title":
                return inHead(tag);
            case "body":
                errors.report(ParseErrorKind.STRAY_STRUCTURAL_TAG, name);
                if (stack.size() > 1 && stack.get(1).isHTML("body") && !stack.containsHTML("template")) {
                    framesetOk = false;
                    mergeAttributes(tag, stack.get(1));
                }
                return CONSUMED;
            case "frameset":
                errors.report(ParseErrorKind.STRAY_STRUCTURAL_TAG, name);
                if (stack.size() > 1 && stack.get(1).isHTML("body") && framesetOk) {
                    Element body = stack.get(1);
                    if (body.getParentNode() != null) {
                        body.getParentNode().removeChild(body);
                    }
                    while (stack.size() > 1) {
                        stack.pop();
                    }
                    insertHTMLElement(tag);
                    switchTo(InsertionMode.IN_FRAMESET);
                }
                return CONSUMED;
            case "h1":
            case "h2":
            case "h3":
            case "h4":
            case "h5":
            case "h6":
                closePInButtonScope();
                if (stack.current().isHTML() && ElementTypes.HEADINGS.contains(stack.current().getLocalName())) {
                    errors.report(ParseErrorKind.UNEXPECTED_START_TAG, name);
                    stack.pop();
                }
                insertHTMLElement(tag);
                return CONSUMED;
            case "pre":
            case "listing":
                closePInButtonScope();
                insertHTMLElement(tag);
                ignoreNextLineFeed = true;
                framesetOk = false;
                return CONSUMED;
            case "form":
                if (formElement != null && !stack.containsHTML("template")) {
                    errors.report(ParseErrorKind.NESTED_FORM);
                    return CONSUMED;
                }
                closePInButtonScope();
                Element form = insertHTMLElement(tag);
                if (!stack.containsHTML("template")) {
                    formElement = form;
                }
                return CONSUMED;
            case "li":
                framesetOk = false;
                closeListItem("li");
                closePInButtonScope();
                insertHTMLElement(tag);
                return CONSUMED;
            case "dd":
            case "dt":
                framesetOk = false;
                closeListItem("dd", "dt");
                closePInButtonScope();
                insertHTMLElement(tag);
                return CONSUMED;
            case "plaintext":
                closePInButtonScope();
                insertHTMLElement(tag);
                tokenizer.setState(TokenizerState.PLAINTEXT);
                return CONSUMED;
            case "button":
                if (stack.hasElementInScope("button")) {
                    errors.report(ParseErrorKind.UNEXPECTED_START_TAG, name);
                    stack.generateImpliedEndTags(null);
                    stack.popUntil("button");
                }
                reconstructActiveFormattingElements();
                insertHTMLElement(tag);
                framesetOk = false;
                return CONSUMED;
            case "a":
                Element a = formatting.lastElementAfterMarker("a");
                if (a != null) {
                    errors.report(ParseErrorKind.MISNESTED_FORMATTING, name);
                    adoptionAgency("a");
                    formatting.remove(a);
                    stack.remove(a);
                }
                reconstructActiveFormattingElements();
                formatting.push(insertHTMLElement(tag));
                return CONSUMED;
            case "b":
            case "big":
            case "code":
            case "em":
            case "font":
            case "i":
            case "s":
            case "small":
            case "strike":
            case "strong":
            case "tt":
            case "u":
                reconstructActiveFormattingElements();
                formatting.push(insertHTMLElement(tag));
                return CONSUMED;
            case "nobr":
                reconstructActiveFormattingElements();
                if (stack.hasElementInScope("nobr")) {
                    errors.report(ParseErrorKind.MISNESTED_FORMATTING, name);
                    adoptionAgency("nobr");
                    reconstructActiveFormattingElements();
                }
                formatting.push(insertHTMLElement(tag));
                return CONSUMED;
            case "applet":
            case "marquee":
            case "object":
                reconstructActiveFormattingElements();
                insertHTMLElement(tag);
                formatting.pushMarker();
                framesetOk = false;
                return CONSUMED;
            case "table":
                if (document.getQuirksMode() != QuirksMode.QUIRKS) {
                    closePInButtonScope();
                }
                insertHTMLElement(tag);
                framesetOk = false;
                switchTo(InsertionMode.IN_TABLE);
                return CONSUMED;
            case "area":
            case "br":
            case "embed":
            case "img":
            case "keygen":
            case "wbr":
                reconstructActiveFormattingElements();
                insertVoidElement(tag);
                framesetOk = false;
                return CONSUMED;
            case "input":
                reconstructActiveFormattingElements();
                insertVoidElement(tag);
                String type = tag.getAttributes().getValue("type");
                if (type == null || !"hidden".equalsIgnoreCase(type)) {
                    framesetOk = false;
                }
                return CONSUMED;
            case "param":
            case "source":
            case "track":
                insertVoidElement(tag);
                return CONSUMED;
            case "hr":
                closePInButtonScope();
                insertVoidElement(tag);
                framesetOk = false;
                return CONSUMED;
            case "image":
                errors.report(ParseErrorKind.UNEXPECTED_START_TAG, name);
                Token.StartTag img = new Token.StartTag("img", tag.getAttributes(), tag.isSelfClosing());
                inBodyStartTag(img);
                if (img.isSelfClosingAcknowledged()) {
                    tag.acknowledgeSelfClosing();
                }
                return CONSUMED;
            case "textarea":
                insertHTMLElement(tag);
                ignoreNextLineFeed = true;
                tokenizer.setState(TokenizerState.RCDATA);
                originalMode = mode;
                framesetOk = false;
                switchTo(InsertionMode.TEXT);
                return CONSUMED;
            case "xmp":
                closePInButtonScope();
                reconstructActiveFormattingElements();
                framesetOk = false;
                parseRawText(tag, TokenizerState.RAWTEXT);
                return CONSUMED;
            case "iframe":
                framesetOk = false;
                parseRawText(tag, TokenizerState.RAWTEXT);
                return CONSUMED;
            case "noembed":
                parseRawText(tag, TokenizerState.RAWTEXT);
                return CONSUMED;
            case "select":
                reconstructActiveFormattingElements();
                insertHTMLElement(tag);
                framesetOk = false;
                switch (mode) {
                    case IN_TABLE:
                    case IN_CAPTION:
                    case IN_TABLE_BODY:
                    case IN_ROW:
                    case IN_CELL:
                        switchTo(InsertionMode.IN_SELECT_IN_TABLE);
                        break;
                    default:
                        switchTo(InsertionMode.IN_SELECT);
                }
                return CONSUMED;
            case "optgroup":
            case "option":
                if (stack.current().isHTML("option")) {
                    stack.pop();
                }
                reconstructActiveFormattingElements();
                insertHTMLElement(tag);
                return CONSUMED;
            case "rb":
            case "rtc":
                if (stack.hasElementInScope("ruby")) {
                    stack.generateImpliedEndTags(null);
                    if (!stack.current().isHTML("ruby")) {
                        errors.report(ParseErrorKind.UNEXPECTED_START_TAG, name);
                    }
                }
                insertHTMLElement(tag);
                return CONSUMED;
            case "rp":
            case "rt":
                if (stack.hasElementInScope("ruby")) {
                    stack.generateImpliedEndTags("rtc");
                    if (!stack.current().isHTML("rtc") && !stack.current().isHTML("ruby")) {
                        errors.report(ParseErrorKind.UNEXPECTED_START_TAG, name);
                    }
                }
                insertHTMLElement(tag);
                return CONSUMED;
            case "math":
                reconstructActiveFormattingElements();
                ElementTypes.adjustMathMLAttributes(tag.getAttributes());
                ElementTypes.adjustForeignAttributes(tag.getAttributes());
                insertForeignElement(tag, Namespaces.MATHML);
                if (tag.isSelfClosing()) {
                    stack.pop();
                    tag.acknowledgeSelfClosing();
                }
                return CONSUMED;
            case "svg":
                reconstructActiveFormattingElements();
                ElementTypes.adjustSVGAttributes(tag.getAttributes());
                ElementTypes.adjustForeignAttributes(tag.getAttributes());
                insertForeignElement(tag, Namespaces.SVG);
                if (tag.isSelfClosing()) {
                    stack.pop();
                    tag.acknowledgeSelfClosing();
                }
                return CONSUMED;
            case "caption":
            case "col":
            case "colgroup":
            case "frame":
            case "head":
            case "tbody":
            case "td":
            case "tfoot":
            case "th":
            case "thead":
            case "tr":
                return unexpected(tag);
            case "noscript":
                if (scripting) {
                    parseRawText(tag, TokenizerState.RAWTEXT);
                    return CONSUMED;
                }
                break;
            default:
                break;
        }
        if (ElementTypes.CLOSES_P.contains(name)) {
            closePInButtonScope();
            insertHTMLElement(tag);
            return CONSUMED;
        }
        reconstructActiveFormattingElements();
        insertHTMLElement(tag);
        return CONSUMED;
    }

    /**
     * Closes an open list item before a new one starts.
     */
    private void closeListItem(String... names) {
        for (int i = stack.size() - 1; i >= 0; i--) {
            Element node = stack.get(i);
            for (String name : names) {
                if (node.isHTML(name)) {
                    stack.generateImpliedEndTags(name);
                    if (!stack.current().isHTML(name)) {
                        errors.report(ParseErrorKind.UNEXPECTED_START_TAG, name);
                    }
                    stack.popUntil(name);
                    return;
                }
            }
            if (ElementTypes.isSpecial(node)
                    && !node.isHTML("address") && !node.isHTML("div") && !node.isHTML("p")) {
                return;
            }
        }
    }

    private boolean inBodyEndTag(Token token) {
        String name = tagName(token);
        switch (name) {
            case "template":
                return inHead(token);
            case "body":
            case "html":
                if (!stack.hasElementInScope("body")) {
                    return unexpected(token);
                }
                checkUnclosedElements();
                switchTo(InsertionMode.AFTER_BODY);
                return "html".equals(name) ? REPROCESS : CONSUMED;
            case "form":
                if (!stack.containsHTML("template")) {
                    Element node = formElement;
                    formElement = null;
                    if (node == null || !stack.hasElementInScope(node)) {
                        return unexpected(token);
                    }
                    stack.generateImpliedEndTags(null);
                    if (stack.current() != node) {
                        errors.report(ParseErrorKind.UNEXPECTED_END_TAG, name);
                    }
                    stack.remove(node);
                } else {
                    if (!stack.hasElementInScope("form")) {
                        return unexpected(token);
                    }
                    closeElement("form");
                }
                return CONSUMED;
            case "p":
                if (!stack.hasElementInButtonScope("p")) {
                    errors.report(ParseErrorKind.UNEXPECTED_END_TAG, name);
                    insertHTMLElement("p");
                }
                closePElement();
                return CONSUMED;
            case "li":
                if (!stack.hasElementInListItemScope("li")) {
                    return unexpected(token);
                }
                stack.generateImpliedEndTags("li");
                if (!stack.current().isHTML("li")) {
                    errors.report(ParseErrorKind.UNEXPECTED_END_TAG, name);
                }
                stack.popUntil("li");
                return CONSUMED;
            case "dd":
            case "dt":
                if (!stack.hasElementInScope(name)) {
                    return unexpected(token);
                }
                stack.generateImpliedEndTags(name);
                if (!stack.current().isHTML(name)) {
                    errors.report(ParseErrorKind.UNEXPECTED_END_TAG, name);
                }
                stack.popUntil(name);
                return CONSUMED;
            case "h1":
            case "h2":
            case "h3":
            case "h4":
            case "h5":
            case "h6":
                if (!stack.hasAnyInScope(ElementTypes.HEADINGS, OpenElementsStack.Scope.DEFAULT)) {
                    return unexpected(token);
                }
                stack.generateImpliedEndTags(null);
                if (!stack.current().isHTML(name)) {
                    errors.report(ParseErrorKind.UNEXPECTED_END_TAG, name);
                }
                stack.popUntil(ElementTypes.HEADINGS);
                return CONSUMED;
            case "applet":
            case "marquee":
            case "object":
                if (!stack.hasElementInScope(name)) {
                    return unexpected(token);
                }
                closeElement(name);
                formatting.clearToLastMarker();
                return CONSUMED;
            case "br":
                errors.report(ParseErrorKind.UNEXPECTED_END_TAG, name);
                reconstructActiveFormattingElements();
                insertVoidElement(new Token.StartTag("br"));
                framesetOk = false;
                return CONSUMED;
            default:
                break;
        }
        if (ElementTypes.BLOCK_END.contains(name)) {
            if (!stack.hasElementInScope(name)) {
                return unexpected(token);
            }
            closeElement(name);
            return CONSUMED;
        }
        if (ElementTypes.FORMATTING.contains(name)) {
            if (!adoptionAgency(name)) {
                return CONSUMED;
            }
        }
        anyOtherEndTag(name);
        return CONSUMED;
    }

    private void anyOtherEndTag(String name) {
        for (int i = stack.size() - 1; i >= 0; i--) {
            Element node = stack.get(i);
            if (node.isHTML(name)) {
                stack.generateImpliedEndTags(name);
                if (stack.current() != node) {
                    errors.report(ParseErrorKind.UNEXPECTED_END_TAG, name);
                }
                stack.popUntil(node);
                return;
            }
            if (ElementTypes.isSpecial(node)) {
                errors.report(ParseErrorKind.UNEXPECTED_END_TAG, name);
                return;
            }
        }
    }

    private boolean text(Token token) {
        switch (token.getType()) {
            case CHARACTER:
                insertCharacters(characters(token));
                return CONSUMED;
            case EOF:
                errors.report(ParseErrorKind.UNEXPECTED_EOF);
                stack.pop();
                switchTo(originalMode);
                return REPROCESS;
            case END_TAG:
                Element element = stack.pop();
                switchTo(originalMode);
                if (element.isHTML("script")) {
                    pendingScript = new PendingScript(element);
                }
                return CONSUMED;
            default:
                return CONSUMED;
        }
    }

    // -- Tables --

    private boolean inTable(Token token) {
        switch (token.getType()) {
            case CHARACTER:
                Element current = stack.current();
                if (current.isHTML() && (ElementTypes.FOSTER_TARGETS.contains(current.getLocalName())
                        || current.isHTML("template"))) {
                    pendingTableText.setLength(0);
                    pendingTableTextDirty = false;
                    originalMode = mode;
                    switchTo(InsertionMode.IN_TABLE_TEXT);
                    return REPROCESS;
                }
                break;
            case COMMENT:
                insertComment(token);
                return CONSUMED;
            case DOCTYPE:
                return unexpected(token);
            case START_TAG:
                Token.StartTag tag = (Token.StartTag) token;
                switch (tag.getName()) {
                    case "caption":
                        stack.clearToTableContext();
                        formatting.pushMarker();
                        insertHTMLElement(tag);
                        switchTo(InsertionMode.IN_CAPTION);
                        return CONSUMED;
                    case "colgroup":
                        stack.clearToTableContext();
                        insertHTMLElement(tag);
                        switchTo(InsertionMode.IN_COLUMN_GROUP);
                        return CONSUMED;
                    case "col":
                        stack.clearToTableContext();
                        insertHTMLElement("colgroup");
                        switchTo(InsertionMode.IN_COLUMN_GROUP);
                        return REPROCESS;
                    case "tbody":
                    case "tfoot":
                    case "thead":
                        stack.clearToTableContext();
                        insertHTMLElement(tag);
                        switchTo(InsertionMode.IN_TABLE_BODY);
                        return CONSUMED;
                    case "td":
                    case "th":
                    case "tr":
                        stack.clearToTableContext();
                        insertHTMLElement("tbody");
                        switchTo(InsertionMode.IN_TABLE_BODY);
                        return REPROCESS;
                    case "table":
                        errors.report(ParseErrorKind.UNEXPECTED_START_TAG, "table");
                        if (!stack.hasElementInTableScope("table")) {
                            return CONSUMED;
                        }
                        stack.popUntil("table");
                        resetInsertionMode();
                        return REPROCESS;
                    case "style":
                    case "script":
                    case "template":
                        return inHead(token);
                    case "input":
                        String type = tag.getAttributes().getValue("type");
                        if (type != null && "hidden".equalsIgnoreCase(type)) {
                            errors.report(ParseErrorKind.UNEXPECTED_START_TAG, "input");
                            insertVoidElement(tag);
                            return CONSUMED;
                        }
                        break;
                    case "form":
                        errors.report(ParseErrorKind.UNEXPECTED_START_TAG, "form");
                        if (stack.containsHTML("template") || formElement != null) {
                            return CONSUMED;
                        }
                        formElement = insertHTMLElement(tag);
                        stack.pop();
                        return CONSUMED;
                    default:
                        break;
                }
                break;
            case END_TAG:
                switch (tagName(token)) {
                    case "table":
                        if (!stack.hasElementInTableScope("table")) {
                            return unexpected(token);
                        }
                        stack.popUntil("table");
                        resetInsertionMode();
                        return CONSUMED;
                    case "body":
                    case "caption":
                    case "col":
                    case "colgroup":
                    case "html":
                    case "tbody":
                    case "td":
                    case "tfoot":
                    case "th":
                    case "thead":
                    case "tr":
                        return unexpected(token);
                    case "template":
                        return inHead(token);
                    default:
                        break;
                }
                break;
            default:
                return inBody(token);
        }
        errors.report(ParseErrorKind.FOSTER_PARENTED);
        return fosterParent(token);
    }

    /**
     * Processes a token with in-body rules while redirecting insertions
     * out of the table.
     */
    private boolean fosterParent(Token token) {
        fosterParenting = true;
        try {
            return inBody(token);
        } finally {
            fosterParenting = false;
        }
    }

    private boolean inTableText(Token token) {
        if (token.getType() == TokenType.CHARACTER) {
            if (isNullRun(token)) {
                return CONSUMED;
            }
            pendingTableText.append(characters(token));
            if (!isWhitespaceRun(token)) {
                pendingTableTextDirty = true;
            }
            return CONSUMED;
        }
        if (pendingTableText.length() > 0) {
            Token.Character pending = new Token.Character(pendingTableText.toString());
            if (pendingTableTextDirty) {
                errors.report(ParseErrorKind.FOSTER_PARENTED);
                fosterParent(pending);
            } else {
                insertCharacters(pending.getData());
            }
            pendingTableText.setLength(0);
        }
        switchTo(originalMode);
        return REPROCESS;
    }

    private void closeCaption() {
        stack.generateImpliedEndTags(null);
        if (!stack.current().isHTML("caption")) {
            errors.report(ParseErrorKind.UNEXPECTED_END_TAG, "caption");
        }
        stack.popUntil("caption");
        formatting.clearToLastMarker();
        switchTo(InsertionMode.IN_TABLE);
    }

    private boolean inCaption(Token token) {
        if (isEndTag(token, "caption")) {
            if (!stack.hasElementInTableScope("caption")) {
                return unexpected(token);
            }
            closeCaption();
            return CONSUMED;
        } else if (isStartTag(token, "caption", "col", "colgroup", "tbody", "td", "tfoot", "th", "thead", "tr")
                || isEndTag(token, "table")) {
            if (!stack.hasElementInTableScope("caption")) {
                return unexpected(token);
            }
            closeCaption();
            return REPROCESS;
        } else if (isEndTag(token, "body", "col", "colgroup", "html", "tbody", "td", "tfoot", "th", "thead", "tr")) {
            return unexpected(token);
        }
        return inBody(token);
    }

    private boolean inColumnGroup(Token token) {
        if (isWhitespaceRun(token)) {
            insertCharacters(characters(token));
            return CONSUMED;
        } else if (token.getType() == TokenType.COMMENT) {
            insertComment(token);
            return CONSUMED;
        } else if (token.getType() == TokenType.DOCTYPE) {
            return unexpected(token);
        } else if (isStartTag(token, "html")) {
            return inBody(token);
        } else if (isStartTag(token, "col")) {
            insertVoidElement((Token.StartTag) token);
            return CONSUMED;
        } else if (isEndTag(token, "colgroup")) {
            if (!stack.current().isHTML("colgroup")) {
                return unexpected(token);
            }
            stack.pop();
            switchTo(InsertionMode.IN_TABLE);
            return CONSUMED;
        } else if (isEndTag(token, "col")) {
            return unexpected(token);
        } else if (isStartTag(token, "template") || isEndTag(token, "template")) {
            return inHead(token);
        } else if (token.getType() == TokenType.EOF) {
            return inBody(token);
        }
        if (!stack.current().isHTML("colgroup")) {
            return unexpected(token);
        }
        stack.pop();
        switchTo(InsertionMode.IN_TABLE);
        return REPROCESS;
    }

    private boolean inTableBody(Token token) {
        if (isStartTag(token, "tr")) {
            stack.clearToTableBodyContext();
            insertHTMLElement((Token.StartTag) token);
            switchTo(InsertionMode.IN_ROW);
            return CONSUMED;
        } else if (isStartTag(token, "th", "td")) {
            errors.report(ParseErrorKind.UNEXPECTED_START_TAG, tagName(token));
            stack.clearToTableBodyContext();
            insertHTMLElement("tr");
            switchTo(InsertionMode.IN_ROW);
            return REPROCESS;
        } else if (isEndTag(token, "tbody", "tfoot", "thead")) {
            if (!stack.hasElementInTableScope(tagName(token))) {
                return unexpected(token);
            }
            stack.clearToTableBodyContext();
            stack.pop();
            switchTo(InsertionMode.IN_TABLE);
            return CONSUMED;
        } else if (isStartTag(token, "caption", "col", "colgroup", "tbody", "tfoot", "thead")
                || isEndTag(token, "table")) {
            if (!stack.hasAnyInScope(ElementTypes.TABLE_SECTIONS, OpenElementsStack.Scope.TABLE)) {
                return unexpected(token);
            }
            stack.clearToTableBodyContext();
            stack.pop();
            switchTo(InsertionMode.IN_TABLE);
            return REPROCESS;
        } else if (isEndTag(token, "body", "caption", "col", "colgroup", "html", "td", "th", "tr")) {
            return unexpected(token);
        }
        return inTable(token);
    }

    private boolean closeRow(Token token) {
        if (!stack.hasElementInTableScope("tr")) {
            return unexpected(token);
        }
        stack.clearToTableRowContext();
        stack.pop();
        switchTo(InsertionMode.IN_TABLE_BODY);
        return REPROCESS;
    }

    private boolean inRow(Token token) {
        if (isStartTag(token, "th", "td")) {
            stack.clearToTableRowContext();
            insertHTMLElement((Token.StartTag) token);
            switchTo(InsertionMode.IN_CELL);
            formatting.pushMarker();
            return CONSUMED;
        } else if (isEndTag(token, "tr")) {
            closeRow(token);
            return CONSUMED;
        } else if (isStartTag(token, "caption", "col", "colgroup", "tbody", "tfoot", "thead", "tr")
                || isEndTag(token, "table")) {
            return closeRow(token);
        } else if (isEndTag(token, "tbody", "tfoot", "thead")) {
            if (!stack.hasElementInTableScope(tagName(token))) {
                return unexpected(token);
            }
            if (!stack.hasElementInTableScope("tr")) {
                return CONSUMED;
            }
            return closeRow(token);
        } else if (isEndTag(token, "body", "caption", "col", "colgroup", "html", "td", "th")) {
            return unexpected(token);
        }
        return inTable(token);
    }

    private void closeCell() {
        stack.generateImpliedEndTags(null);
        Element current = stack.current();
        if (!current.isHTML("td") && !current.isHTML("th")) {
            errors.report(ParseErrorKind.UNEXPECTED_END_TAG, current.getLocalName());
        }
        stack.popUntil(ElementTypes.TABLE_CELLS);
        formatting.clearToLastMarker();
        switchTo(InsertionMode.IN_ROW);
    }

    private boolean inCell(Token token) {
        if (isEndTag(token, "td", "th")) {
            String name = tagName(token);
            if (!stack.hasElementInTableScope(name)) {
                return unexpected(token);
            }
            stack.generateImpliedEndTags(null);
            if (!stack.current().isHTML(name)) {
                errors.report(ParseErrorKind.UNEXPECTED_END_TAG, name);
            }
            stack.popUntil(name);
            formatting.clearToLastMarker();
            switchTo(InsertionMode.IN_ROW);
            return CONSUMED;
        } else if (isStartTag(token, "caption", "col", "colgroup", "tbody", "td", "tfoot", "th", "thead", "tr")) {
            if (!stack.hasAnyInScope(ElementTypes.TABLE_CELLS, OpenElementsStack.Scope.TABLE)) {
                return unexpected(token);
            }
            closeCell();
            return REPROCESS;
        } else if (isEndTag(token, "body", "caption", "col", "colgroup", "html")) {
            return unexpected(token);
        } else if (isEndTag(token, "table", "tbody", "tfoot", "thead", "tr")) {
            if (!stack.hasElementInTableScope(tagName(token))) {
                return unexpected(token);
            }
            closeCell();
            return REPROCESS;
        }
        return inBody(token);
    }

    // -- Select --

    private boolean inSelect(Token token) {
        switch (token.getType()) {
            case CHARACTER:
                if (!isNullRun(token)) {
                    insertCharacters(characters(token));
                }
                return CONSUMED;
            case COMMENT:
                insertComment(token);
                return CONSUMED;
            case DOCTYPE:
                return unexpected(token);
            case EOF:
                return inBody(token);
            case START_TAG:
                Token.StartTag tag = (Token.StartTag) token;
                switch (tag.getName()) {
                    case "html":
                        return inBody(token);
                    case "option":
                        if (stack.current().isHTML("option")) {
                            stack.pop();
                        }
                        insertHTMLElement(tag);
                        return CONSUMED;
                    case "optgroup":
                        if (stack.current().isHTML("option")) {
                            stack.pop();
                        }
                        if (stack.current().isHTML("optgroup")) {
                            stack.pop();
                        }
                        insertHTMLElement(tag);
                        return CONSUMED;
                    case "hr":
                        if (stack.current().isHTML("option")) {
                            stack.pop();
                        }
                        if (stack.current().isHTML("optgroup")) {
                            stack.pop();
                        }
                        insertVoidElement(tag);
                        return CONSUMED;
                    case "select":
                        errors.report(ParseErrorKind.UNEXPECTED_START_TAG, "select");
                        if (stack.hasElementInSelectScope("select")) {
                            stack.popUntil("select");
                            resetInsertionMode();
                        }
                        return CONSUMED;
                    case "input":
                    case "keygen":
                    case "textarea":
                        errors.report(ParseErrorKind.UNEXPECTED_START_TAG, tag.getName());
                        if (!stack.hasElementInSelectScope("select")) {
                            return CONSUMED;
                        }
                        stack.popUntil("select");
                        resetInsertionMode();
                        return REPROCESS;
                    case "script":
                    case "template":
                        return inHead(token);
                    default:
                        return unexpected(token);
                }
            default:
                switch (tagName(token)) {
                    case "optgroup":
                        if (stack.current().isHTML("option") && stack.size() > 1
                                && stack.get(stack.size() - 2).isHTML("optgroup")) {
                            stack.pop();
                        }
                        if (!stack.current().isHTML("optgroup")) {
                            return unexpected(token);
                        }
                        stack.pop();
                        return CONSUMED;
                    case "option":
                        if (!stack.current().isHTML("option")) {
                            return unexpected(token);
                        }
                        stack.pop();
                        return CONSUMED;
                    case "select":
                        if (!stack.hasElementInSelectScope("select")) {
                            return unexpected(token);
                        }
                        stack.popUntil("select");
                        resetInsertionMode();
                        return CONSUMED;
                    case "template":
                        return inHead(token);
                    default:
                        return unexpected(token);
                }
        }
    }

    private boolean inSelectInTable(Token token) {
        String[] tableTags = { "caption", "table", "tbody", "tfoot", "thead", "tr", "td", "th" };
        if (isStartTag(token, tableTags)) {
            errors.report(ParseErrorKind.UNEXPECTED_START_TAG, tagName(token));
            stack.popUntil("select");
            resetInsertionMode();
            return REPROCESS;
        } else if (isEndTag(token, tableTags)) {
            errors.report(ParseErrorKind.UNEXPECTED_END_TAG, tagName(token));
            if (!stack.hasElementInTableScope(tagName(token))) {
                return CONSUMED;
            }
            stack.popUntil("select");
            resetInsertionMode();
            return REPROCESS;
        }
        return inSelect(token);
    }

    // -- Templates --

    private boolean inTemplate(Token token) {
        switch (token.getType()) {
            case CHARACTER:
            case COMMENT:
            case DOCTYPE:
                return inBody(token);
            case START_TAG:
                switch (tagName(token)) {
                    case "base":
                    case "basefont":
                    case "bgsound":
                    case "link":
                    case "meta":
                    case "noframes":
                    case "script":
                    case "style":
                    case "template":
                    case "title":
                        return inHead(token);
                    case "caption":
                    case "colgroup":
                    case "tbody":
                    case "tfoot":
                    case "thead":
                        return switchTemplateMode(InsertionMode.IN_TABLE);
                    case "col":
                        return switchTemplateMode(InsertionMode.IN_COLUMN_GROUP);
                    case "tr":
                        return switchTemplateMode(InsertionMode.IN_TABLE_BODY);
                    case "td":
                    case "th":
                        return switchTemplateMode(InsertionMode.IN_ROW);
                    default:
                        return switchTemplateMode(InsertionMode.IN_BODY);
                }
            case END_TAG:
                if (isEndTag(token, "template")) {
                    return inHead(token);
                }
                return unexpected(token);
            default:
                if (!stack.containsHTML("template")) {
                    return CONSUMED;
                }
                errors.report(ParseErrorKind.UNEXPECTED_EOF);
                stack.popUntil("template");
                formatting.clearToLastMarker();
                templateModes.pop();
                resetInsertionMode();
                return REPROCESS;
        }
    }

    private boolean switchTemplateMode(InsertionMode newMode) {
        templateModes.pop();
        templateModes.push(newMode);
        switchTo(newMode);
        return REPROCESS;
    }

    // -- After body and framesets --

    private boolean afterBody(Token token) {
        if (isWhitespaceRun(token) || isStartTag(token, "html")) {
            return inBody(token);
        } else if (token.getType() == TokenType.COMMENT) {
            appendComment(token, stack.get(0));
            return CONSUMED;
        } else if (token.getType() == TokenType.DOCTYPE) {
            return unexpected(token);
        } else if (isEndTag(token, "html")) {
            if (contextElement != null) {
                return unexpected(token);
            }
            switchTo(InsertionMode.AFTER_AFTER_BODY);
            return CONSUMED;
        } else if (token.getType() == TokenType.EOF) {
            return CONSUMED;
        }
        unexpected(token);
        switchTo(InsertionMode.IN_BODY);
        return REPROCESS;
    }

    private boolean inFrameset(Token token) {
        if (isWhitespaceRun(token)) {
            insertCharacters(characters(token));
            return CONSUMED;
        } else if (token.getType() == TokenType.COMMENT) {
            insertComment(token);
            return CONSUMED;
        } else if (isStartTag(token, "html")) {
            return inBody(token);
        } else if (isStartTag(token, "frameset")) {
            insertHTMLElement((Token.StartTag) token);
            return CONSUMED;
        } else if (isEndTag(token, "frameset")) {
            if (stack.size() == 1) {
                return unexpected(token);
            }
            stack.pop();
            if (contextElement == null && !stack.current().isHTML("frameset")) {
                switchTo(InsertionMode.AFTER_FRAMESET);
            }
            return CONSUMED;
        } else if (isStartTag(token, "frame")) {
            insertVoidElement((Token.StartTag) token);
            return CONSUMED;
        } else if (isStartTag(token, "noframes")) {
            return inHead(token);
        } else if (token.getType() == TokenType.EOF) {
            if (stack.size() > 1) {
                errors.report(ParseErrorKind.UNCLOSED_ELEMENTS);
            }
            return CONSUMED;
        }
        return unexpected(token);
    }

    private boolean afterFrameset(Token token) {
        if (isWhitespaceRun(token)) {
            insertCharacters(characters(token));
            return CONSUMED;
        } else if (token.getType() == TokenType.COMMENT) {
            insertComment(token);
            return CONSUMED;
        } else if (isStartTag(token, "html")) {
            return inBody(token);
        } else if (isEndTag(token, "html")) {
            switchTo(InsertionMode.AFTER_AFTER_FRAMESET);
            return CONSUMED;
        } else if (isStartTag(token, "noframes")) {
            return inHead(token);
        } else if (token.getType() == TokenType.EOF) {
            return CONSUMED;
        }
        return unexpected(token);
    }

    private boolean afterAfterBody(Token token) {
        if (token.getType() == TokenType.COMMENT) {
            appendComment(token, document);
            return CONSUMED;
        } else if (token.getType() == TokenType.DOCTYPE || isWhitespaceRun(token) || isStartTag(token, "html")) {
            return inBody(token);
        } else if (token.getType() == TokenType.EOF) {
            return CONSUMED;
        }
        unexpected(token);
        switchTo(InsertionMode.IN_BODY);
        return REPROCESS;
    }

    private boolean afterAfterFrameset(Token token) {
        if (token.getType() == TokenType.COMMENT) {
            appendComment(token, document);
            return CONSUMED;
        } else if (token.getType() == TokenType.DOCTYPE || isWhitespaceRun(token) || isStartTag(token, "html")) {
            return inBody(token);
        } else if (isStartTag(token, "noframes")) {
            return inHead(token);
        } else if (token.getType() == TokenType.EOF) {
            return CONSUMED;
        }
        return unexpected(token);
    }

    // -- Foreign content --

    private boolean inForeignContent(Token token) {
        switch (token.getType()) {
            case CHARACTER:
                if (isNullRun(token)) {
                    insertCharacters(characters(token).replace('\0', '\uFFFD'));
                    return CONSUMED;
                }
                insertCharacters(characters(token));
                if (!isWhitespaceRun(token)) {
                    framesetOk = false;
                }
                return CONSUMED;
            case COMMENT:
                insertComment(token);
                return CONSUMED;
            case DOCTYPE:
                return unexpected(token);
            case START_TAG:
                Token.StartTag tag = (Token.StartTag) token;
                if (isBreakout(tag)) {
                    errors.report(ParseErrorKind.UNEXPECTED_START_TAG, tag.getName());
                    while (true) {
                        Element current = stack.current();
                        if (current.isHTML() || ElementTypes.isMathMLTextIntegrationPoint(current)
                                || ElementTypes.isHTMLIntegrationPoint(current)) {
                            break;
                        }
                        stack.pop();
                    }
                    return REPROCESS;
                }
                String namespaceURI = adjustedCurrentNode().getNamespaceURI();
                Token.StartTag adjusted = tag;
                if (Namespaces.MATHML.equals(namespaceURI)) {
                    ElementTypes.adjustMathMLAttributes(tag.getAttributes());
                } else if (Namespaces.SVG.equals(namespaceURI)) {
                    String name = ElementTypes.adjustSVGTagName(tag.getName());
                    if (!name.equals(tag.getName())) {
                        adjusted = new Token.StartTag(name, tag.getAttributes(), tag.isSelfClosing());
                    }
                    ElementTypes.adjustSVGAttributes(tag.getAttributes());
                }
                ElementTypes.adjustForeignAttributes(tag.getAttributes());
                insertForeignElement(adjusted, namespaceURI);
                if (tag.isSelfClosing()) {
                    stack.pop();
                    tag.acknowledgeSelfClosing();
                }
                return CONSUMED;
            case END_TAG:
                return foreignEndTag(token);
            default:
                return inBody(token);
        }
    }

    private static boolean isBreakout(Token.StartTag tag) {
        if (ElementTypes.FOREIGN_BREAKOUT.contains(tag.getName())) {
            return true;
        }
        if ("font".equals(tag.getName())) {
            AttributeList attributes = tag.getAttributes();
            return attributes.contains("color") || attributes.contains("face") || attributes.contains("size");
        }
        return false;
    }

    private boolean foreignEndTag(Token token) {
        String name = tagName(token);
        int i = stack.size() - 1;
        Element node = stack.get(i);
        if (!node.getLocalName().toLowerCase(Locale.ROOT).equals(name)) {
            errors.report(ParseErrorKind.UNEXPECTED_END_TAG, name);
        }
        while (i > 0) {
            if (node.getLocalName().toLowerCase(Locale.ROOT).equals(name)) {
                stack.popUntil(node);
                return CONSUMED;
            }
            i--;
            node = stack.get(i);
            if (node.isHTML()) {
                return dispatch(mode, token);
            }
        }
        return CONSUMED;
    }

}
