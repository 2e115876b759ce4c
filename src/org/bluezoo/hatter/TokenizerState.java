/*
 * TokenizerState.java
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
 * Tokenizer state, indicating what kind of construct is being scanned.
 * <p>
 * The content states (DATA, RCDATA, RAWTEXT, SCRIPT_DATA, PLAINTEXT) are
 * selected by the tree constructor according to the element just opened;
 * all other states are entered by the tokenizer itself.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
enum TokenizerState {

    /**
     * Ordinary content: text, character references and markup.
     */
    DATA,

    /**
     * Escapable raw text ({@code title}, {@code textarea}): character
     * references are decoded but no markup is recognised except the
     * matching end tag.
     */
    RCDATA,

    /**
     * Raw text ({@code style}, {@code xmp}, {@code iframe} and friends):
     * only the matching end tag is recognised.
     */
    RAWTEXT,

    /**
     * Script content, scanned like raw text.
     */
    SCRIPT_DATA,

    /**
     * After {@code <plaintext>}: everything to end of input is text.
     */
    PLAINTEXT,

    TAG_OPEN,
    END_TAG_OPEN,
    TAG_NAME,

    /**
     * Seen '&lt;' in RCDATA, RAWTEXT or script data.
     */
    RAW_LESS_THAN_SIGN,

    /**
     * Seen '&lt;/' in RCDATA, RAWTEXT or script data.
     */
    RAW_END_TAG_OPEN,

    /**
     * Accumulating a candidate end tag name in RCDATA, RAWTEXT or script
     * data.
     */
    RAW_END_TAG_NAME,

    BEFORE_ATTRIBUTE_NAME,
    ATTRIBUTE_NAME,
    AFTER_ATTRIBUTE_NAME,
    BEFORE_ATTRIBUTE_VALUE,
    ATTRIBUTE_VALUE_DOUBLE_QUOTED,
    ATTRIBUTE_VALUE_SINGLE_QUOTED,
    ATTRIBUTE_VALUE_UNQUOTED,
    AFTER_ATTRIBUTE_VALUE_QUOTED,
    SELF_CLOSING_START_TAG,

    /**
     * Anything that looks like a declaration but is not one, kept as a
     * comment up to the next '&gt;'.
     */
    BOGUS_COMMENT,

    /**
     * Seen '&lt;!'.
     */
    MARKUP_DECLARATION_OPEN,

    COMMENT_START,
    COMMENT_START_DASH,
    COMMENT,
    COMMENT_END_DASH,
    COMMENT_END,
    COMMENT_END_BANG,

    DOCTYPE,
    BEFORE_DOCTYPE_NAME,
    DOCTYPE_NAME,
    AFTER_DOCTYPE_NAME,
    AFTER_DOCTYPE_PUBLIC_KEYWORD,
    BEFORE_DOCTYPE_PUBLIC_IDENTIFIER,
    DOCTYPE_PUBLIC_IDENTIFIER_DOUBLE_QUOTED,
    DOCTYPE_PUBLIC_IDENTIFIER_SINGLE_QUOTED,
    AFTER_DOCTYPE_PUBLIC_IDENTIFIER,
    BETWEEN_DOCTYPE_PUBLIC_AND_SYSTEM_IDENTIFIERS,
    AFTER_DOCTYPE_SYSTEM_KEYWORD,
    BEFORE_DOCTYPE_SYSTEM_IDENTIFIER,
    DOCTYPE_SYSTEM_IDENTIFIER_DOUBLE_QUOTED,
    DOCTYPE_SYSTEM_IDENTIFIER_SINGLE_QUOTED,
    AFTER_DOCTYPE_SYSTEM_IDENTIFIER,
    BOGUS_DOCTYPE,

    /**
     * Inside {@code <![CDATA[ ... ]]>}, only recognised in foreign content.
     */
    CDATA_SECTION,
    CDATA_SECTION_BRACKET,
    CDATA_SECTION_END

}
