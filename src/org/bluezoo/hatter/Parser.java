/*
 * Parser.java
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

import java.io.IOException;
import java.io.Reader;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTML5 parser.
 * <p>
 * This class is the public entry point. It drives a {@link Tokenizer} and
 * a tree constructor over the input, pulling one token at a time, and
 * returns the resulting {@link Document}. Malformed markup never causes
 * an exception: every deviation from the HTML syntax is reported to the
 * {@link ParseErrorHandler}, if one is set, and recovered from.
 * <p>
 * When a {@code script} element is closed the parser pauses and hands the
 * element to the {@link ScriptHandler}. Text returned by the handler is
 * tokenized next, ahead of the remaining input.
 * <p>
 * A parser may be reused for several documents in turn. It is not
 * thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Parser {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.hatter.L10N");

    private static final Logger LOGGER = Logger.getLogger(Parser.class.getName());

    /**
     * System property giving the default for the scripting flag.
     */
    public static final String SCRIPTING_PROPERTY = "org.bluezoo.hatter.scripting";

    private ParseErrorHandler errorHandler;
    private ScriptHandler scriptHandler;
    private boolean scripting;
    private String systemId;

    private volatile boolean aborted;
    private boolean parsing;

    /**
     * Creates a parser with default configuration.
     */
    public Parser() {
        scripting = Boolean.getBoolean(SCRIPTING_PROPERTY);
    }

    /**
     * Creates a standalone tokenizer over the given input.
     *
     * @param input the characters to tokenize
     * @return a new tokenizer in the data state
     * @throws IllegalArgumentException if input is null
     */
    public static Tokenizer createTokenizer(CharSequence input) {
        return new Tokenizer(input);
    }

    // -- Configuration --

    public ParseErrorHandler getErrorHandler() {
        return errorHandler;
    }

    /**
     * Sets the handler that receives parse errors. If none is set, errors
     * are logged at FINE.
     *
     * @param handler the error handler, or null
     */
    public void setErrorHandler(ParseErrorHandler handler) {
        errorHandler = handler;
    }

    public ScriptHandler getScriptHandler() {
        return scriptHandler;
    }

    /**
     * Sets the handler that runs scripts when the parser pauses. Without
     * a handler, scripts are inserted into the tree but not run.
     *
     * @param handler the script handler, or null
     */
    public void setScriptHandler(ScriptHandler handler) {
        scriptHandler = handler;
    }

    public boolean isScriptingEnabled() {
        return scripting;
    }

    /**
     * Sets the scripting flag. This changes how {@code noscript} is
     * parsed: with scripting enabled its content is raw text.
     *
     * @param scripting whether scripting is enabled
     */
    public void setScriptingEnabled(boolean scripting) {
        this.scripting = scripting;
    }

    /**
     * Sets the system identifier reported by the locator of subsequent
     * parses.
     *
     * @param systemId the system identifier, or null
     */
    public void setSystemId(String systemId) {
        this.systemId = systemId;
    }

    /**
     * Stops the current parse before the next token. The document built
     * so far is returned from {@code parse}. May be called from a script
     * handler or error handler.
     */
    public void abort() {
        aborted = true;
    }

    // -- Parsing --

    /**
     * Parses a complete document.
     *
     * @param input the document text
     * @return the document
     * @throws IllegalArgumentException if input is null
     * @throws IllegalStateException if called from within a parse
     */
    public Document parse(CharSequence input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = L10N.getString("info.parse_start");
            LOGGER.fine(MessageFormat.format(message, input.length()));
        }
        Document document = new Document();
        run(input, document, null);
        return document;
    }

    /**
     * Reads a character stream to its end and parses it as a document.
     * The reader is not closed.
     *
     * @param in the character stream
     * @return the document
     * @throws IOException if an I/O error occurs reading the stream
     * @throws IllegalArgumentException if in is null
     */
    public Document parse(Reader in) throws IOException {
        if (in == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        StringBuilder buf = new StringBuilder();
        char[] chars = new char[4096];
        for (int len = in.read(chars); len != -1; len = in.read(chars)) {
            buf.append(chars, 0, len);
        }
        return parse(buf);
    }

    /**
     * Parses a fragment of markup in the context of an element, as when
     * setting {@code innerHTML}. The context element is not modified.
     *
     * @param input the fragment text
     * @param context the element the fragment would be the content of
     * @return the parsed top-level nodes, in order
     * @throws IllegalArgumentException if input or context is null
     * @throws IllegalStateException if called from within a parse
     */
    public List<Node> parseFragment(CharSequence input, Element context) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = L10N.getString("info.parse_fragment");
            LOGGER.fine(MessageFormat.format(message, context.getLocalName()));
        }
        Document document = new Document();
        Element root = run(input, document, context);
        List<Node> nodes = new ArrayList<>(root.getChildNodes());
        for (Node node : nodes) {
            root.removeChild(node);
        }
        return nodes;
    }

    /**
     * Runs the tokenizer and tree constructor to completion.
     *
     * @return the fragment root, or null for a document parse
     */
    private Element run(CharSequence input, Document document, Element context) {
        if (parsing) {
            throw new IllegalStateException("Parser is already parsing");
        }
        parsing = true;
        aborted = false;
        try {
            Tokenizer tokenizer = new Tokenizer(input);
            tokenizer.setSystemId(systemId);
            ErrorReporter errors = new ErrorReporter(errorHandler);
            tokenizer.setErrorReporter(errors);
            TreeConstructor treeConstructor = new TreeConstructor(document, tokenizer, errors, scripting);
            Element root = null;
            if (context != null) {
                root = treeConstructor.setFragmentContext(context);
            }
            while (!aborted) {
                Token token = tokenizer.nextToken();
                PendingScript script = treeConstructor.processToken(token);
                if (script != null) {
                    runScript(script, tokenizer);
                }
                if (token.getType() == TokenType.EOF) {
                    break;
                }
            }
            if (aborted) {
                LOGGER.fine(L10N.getString("info.aborted"));
            } else if (LOGGER.isLoggable(Level.FINE)) {
                String message = L10N.getString("info.parse_end");
                LOGGER.fine(MessageFormat.format(message, errors.getErrorCount()));
            }
            return root;
        } finally {
            parsing = false;
        }
    }

    private void runScript(PendingScript script, Tokenizer tokenizer) {
        if (scriptHandler == null) {
            return;
        }
        String source = script.getSource();
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = L10N.getString("info.script_pause");
            LOGGER.fine(MessageFormat.format(message, source.length()));
        }
        String inserted = scriptHandler.executeScript(script.getElement(), source);
        if (inserted != null && !inserted.isEmpty()) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = L10N.getString("info.script_inserted");
                LOGGER.fine(MessageFormat.format(message, inserted.length()));
            }
            tokenizer.insert(inserted);
        }
    }

}
