/*
 * QuirksMode.java
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

import java.util.Locale;

/**
 * The rendering mode a document is put in by its DOCTYPE.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum QuirksMode {

    /** Standards mode */
    NO_QUIRKS,

    /** Almost-standards mode */
    LIMITED_QUIRKS,

    /** Quirks mode: legacy DOCTYPE or none at all */
    QUIRKS;

    private static final String[] QUIRKS_PUBLIC_PREFIXES = {
        "+//silmaril//dtd html pro v0r11 19970101//",
        "-//as//dtd html 3.0 aswedit + extensions//",
        "-//advasoft ltd//dtd html 3.0 aswedit + extensions//",
        "-//ietf//dtd html 2.0 level 1//",
        "-//ietf//dtd html 2.0 level 2//",
        "-//ietf//dtd html 2.0 strict level 1//",
        "-//ietf//dtd html 2.0 strict level 2//",
        "-//ietf//dtd html 2.0 strict//",
        "-//ietf//dtd html 2.0//",
        "-//ietf//dtd html 2.1e//",
        "-//ietf//dtd html 3.0//",
        "-//ietf//dtd html 3.2 final//",
        "-//ietf//dtd html 3.2//",
        "-//ietf//dtd html 3//",
        "-//ietf//dtd html level 0//",
        "-//ietf//dtd html level 1//",
        "-//ietf//dtd html level 2//",
        "-//ietf//dtd html level 3//",
        "-//ietf//dtd html strict level 0//",
        "-//ietf//dtd html strict level 1//",
        "-//ietf//dtd html strict level 2//",
        "-//ietf//dtd html strict level 3//",
        "-//ietf//dtd html strict//",
        "-//ietf//dtd html//",
        "-//metrius//dtd metrius presentational//",
        "-//microsoft//dtd internet explorer 2.0 html strict//",
        "-//microsoft//dtd internet explorer 2.0 html//",
        "-//microsoft//dtd internet explorer 2.0 tables//",
        "-//microsoft//dtd internet explorer 3.0 html strict//",
        "-//microsoft//dtd internet explorer 3.0 html//",
        "-//microsoft//dtd internet explorer 3.0 tables//",
        "-//netscape comm. corp.//dtd html//",
        "-//netscape comm. corp.//dtd strict html//",
        "-//o'reilly and associates//dtd html 2.0//",
        "-//o'reilly and associates//dtd html extended 1.0//",
        "-//o'reilly and associates//dtd html extended relaxed 1.0//",
        "-//sq//dtd html 2.0 hotmetal + extensions//",
        "-//softquad software//dtd hotmetal pro 6.0::19990601::extensions to html 4.0//",
        "-//softquad//dtd hotmetal pro 4.0::19971010::extensions to html 4.0//",
        "-//spyglass//dtd html 2.0 extended//",
        "-//sun microsystems corp.//dtd hotjava html//",
        "-//sun microsystems corp.//dtd hotjava strict html//",
        "-//w3c//dtd html 3 1995-03-24//",
        "-//w3c//dtd html 3.2 draft//",
        "-//w3c//dtd html 3.2 final//",
        "-//w3c//dtd html 3.2//",
        "-//w3c//dtd html 3.2s draft//",
        "-//w3c//dtd html 4.0 frameset//",
        "-//w3c//dtd html 4.0 transitional//",
        "-//w3c//dtd html experimental 19960712//",
        "-//w3c//dtd html experimental 970421//",
        "-//w3c//dtd w3 html//",
        "-//w3o//dtd w3 html 3.0//",
        "-//webtechs//dtd mozilla html 2.0//",
        "-//webtechs//dtd mozilla html//"
    };

    private static final String HTML401_FRAMESET = "-//w3c//dtd html 4.01 frameset//";
    private static final String HTML401_TRANSITIONAL = "-//w3c//dtd html 4.01 transitional//";

    /**
     * Determines the mode a DOCTYPE puts the document in.
     * Identifiers are compared ignoring ASCII case.
     *
     * @param doctype the DOCTYPE token
     * @return the quirks mode
     */
    static QuirksMode forDoctype(Token.Doctype doctype) {
        if (doctype.isForceQuirks() || !"html".equals(doctype.getName())) {
            return QUIRKS;
        }
        String publicId = (doctype.getPublicId() == null) ? null : doctype.getPublicId().toLowerCase(Locale.ROOT);
        String systemId = (doctype.getSystemId() == null) ? null : doctype.getSystemId().toLowerCase(Locale.ROOT);
        if (publicId != null) {
            if (publicId.equals("-//w3o//dtd w3 html strict 3.0//en//")
                    || publicId.equals("-/w3c/dtd html 4.0 transitional/en")
                    || publicId.equals("html")) {
                return QUIRKS;
            }
            for (String prefix : QUIRKS_PUBLIC_PREFIXES) {
                if (publicId.startsWith(prefix)) {
                    return QUIRKS;
                }
            }
            boolean html401 = publicId.startsWith(HTML401_FRAMESET) || publicId.startsWith(HTML401_TRANSITIONAL);
            if (html401 && systemId == null) {
                return QUIRKS;
            }
            if (html401
                    || publicId.startsWith("-//w3c//dtd xhtml 1.0 frameset//")
                    || publicId.startsWith("-//w3c//dtd xhtml 1.0 transitional//")) {
                return LIMITED_QUIRKS;
            }
        }
        if ("http://www.ibm.com/data/dtd/v11/ibmxhtml1-transitional.dtd".equals(systemId)) {
            return QUIRKS;
        }
        return NO_QUIRKS;
    }

}
