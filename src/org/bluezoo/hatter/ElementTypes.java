/*
 * ElementTypes.java
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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tag-name tables used by tree construction.
 * <p>
 * Membership in these sets is what drives implicit closing, scope
 * queries and the adoption agency. Unless noted otherwise the names are
 * HTML-namespace local names.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ElementTypes {

    static final Set<String> VOID = set(
            "area", "base", "basefont", "bgsound", "br", "col", "embed", "frame",
            "hr", "img", "input", "keygen", "link", "meta", "param", "source",
            "track", "wbr");

    static final Set<String> FORMATTING = set(
            "a", "b", "big", "code", "em", "font", "i", "nobr", "s", "small",
            "strike", "strong", "tt", "u");

    static final Set<String> SPECIAL = set(
            "address", "applet", "area", "article", "aside", "base", "basefont",
            "bgsound", "blockquote", "body", "br", "button", "caption", "center",
            "col", "colgroup", "dd", "details", "dir", "div", "dl", "dt", "embed",
            "fieldset", "figcaption", "figure", "footer", "form", "frame",
            "frameset", "h1", "h2", "h3", "h4", "h5", "h6", "head", "header",
            "hgroup", "hr", "html", "iframe", "img", "input", "keygen", "li",
            "link", "listing", "main", "marquee", "menu", "meta", "nav",
            "noembed", "noframes", "noscript", "object", "ol", "p", "param",
            "plaintext", "pre", "script", "search", "section", "select",
            "source", "style", "summary", "table", "tbody", "td", "template",
            "textarea", "tfoot", "th", "thead", "title", "tr", "track", "ul",
            "wbr", "xmp");

    static final Set<String> SPECIAL_MATHML = set(
            "mi", "mo", "mn", "ms", "mtext", "annotation-xml");

    static final Set<String> SPECIAL_SVG = set(
            "foreignObject", "desc", "title");

    /**
     * Boundaries of the default scope in the HTML namespace.
     */
    static final Set<String> SCOPE = set(
            "applet", "caption", "html", "table", "td", "th", "marquee",
            "object", "template");

    static final Set<String> MATHML_TEXT_INTEGRATION = set(
            "mi", "mo", "mn", "ms", "mtext");

    static final Set<String> SVG_HTML_INTEGRATION = set(
            "foreignObject", "desc", "title");

    static final Set<String> IMPLIED_END_TAGS = set(
            "dd", "dt", "li", "optgroup", "option", "p", "rb", "rp", "rt", "rtc");

    static final Set<String> IMPLIED_END_TAGS_THOROUGH = set(
            "caption", "colgroup", "dd", "dt", "li", "optgroup", "option", "p",
            "rb", "rp", "rt", "rtc", "tbody", "td", "tfoot", "th", "thead", "tr");

    static final Set<String> HEADINGS = set("h1", "h2", "h3", "h4", "h5", "h6");

    /**
     * Elements whose start tag closes an open {@code p} in body.
     */
    static final Set<String> CLOSES_P = set(
            "address", "article", "aside", "blockquote", "center", "details",
            "dialog", "dir", "div", "dl", "fieldset", "figcaption", "figure",
            "footer", "header", "hgroup", "main", "menu", "nav", "ol", "p",
            "search", "section", "summary", "ul");

    /**
     * Block elements closed by a matching end tag in body.
     */
    static final Set<String> BLOCK_END = set(
            "address", "article", "aside", "blockquote", "button", "center",
            "details", "dialog", "dir", "div", "dl", "fieldset", "figcaption",
            "figure", "footer", "header", "hgroup", "listing", "main", "menu",
            "nav", "ol", "pre", "search", "section", "summary", "ul");

    static final Set<String> TABLE_SECTIONS = set("tbody", "tfoot", "thead");

    static final Set<String> TABLE_CELLS = set("td", "th");

    /**
     * Targets that trigger foster parenting.
     */
    static final Set<String> FOSTER_TARGETS = set("table", "tbody", "tfoot", "thead", "tr");

    /**
     * Start tags that break out of foreign content.
     */
    static final Set<String> FOREIGN_BREAKOUT = set(
            "b", "big", "blockquote", "body", "br", "center", "code", "dd",
            "div", "dl", "dt", "em", "embed", "h1", "h2", "h3", "h4", "h5",
            "h6", "head", "hr", "i", "img", "li", "listing", "menu", "meta",
            "nobr", "ol", "p", "pre", "ruby", "s", "small", "span", "strong",
            "strike", "sub", "sup", "table", "tt", "u", "ul", "var");

    /**
     * Elements whose text content is not escaped when serialized.
     */
    static final Set<String> RAW_TEXT = set(
            "style", "script", "xmp", "iframe", "noembed", "noframes", "plaintext");

    private static final Map<String, String> SVG_TAG_NAMES = new HashMap<>();
    private static final Map<String, String> SVG_ATTRIBUTE_NAMES = new HashMap<>();
    private static final Map<String, String[]> FOREIGN_ATTRIBUTES = new HashMap<>();

    static {
        String[] svgTags = {
            "altGlyph", "altGlyphDef", "altGlyphItem", "animateColor",
            "animateMotion", "animateTransform", "clipPath", "feBlend",
            "feColorMatrix", "feComponentTransfer", "feComposite",
            "feConvolveMatrix", "feDiffuseLighting", "feDisplacementMap",
            "feDistantLight", "feDropShadow", "feFlood", "feFuncA", "feFuncB",
            "feFuncG", "feFuncR", "feGaussianBlur", "feImage", "feMerge",
            "feMergeNode", "feMorphology", "feOffset", "fePointLight",
            "feSpecularLighting", "feSpotLight", "feTile", "feTurbulence",
            "foreignObject", "glyphRef", "linearGradient", "radialGradient",
            "textPath"
        };
        for (String name : svgTags) {
            SVG_TAG_NAMES.put(name.toLowerCase(Locale.ROOT), name);
        }
        String[] svgAttributes = {
            "attributeName", "attributeType", "baseFrequency", "baseProfile",
            "calcMode", "clipPathUnits", "diffuseConstant", "edgeMode",
            "filterUnits", "glyphRef", "gradientTransform", "gradientUnits",
            "kernelMatrix", "kernelUnitLength", "keyPoints", "keySplines",
            "keyTimes", "lengthAdjust", "limitingConeAngle", "markerHeight",
            "markerUnits", "markerWidth", "maskContentUnits", "maskUnits",
            "numOctaves", "pathLength", "patternContentUnits",
            "patternTransform", "patternUnits", "pointsAtX", "pointsAtY",
            "pointsAtZ", "preserveAlpha", "preserveAspectRatio",
            "primitiveUnits", "refX", "refY", "repeatCount", "repeatDur",
            "requiredExtensions", "requiredFeatures", "specularConstant",
            "specularExponent", "spreadMethod", "startOffset", "stdDeviation",
            "stitchTiles", "surfaceScale", "systemLanguage", "tableValues",
            "targetX", "targetY", "textLength", "viewBox", "viewTarget",
            "xChannelSelector", "yChannelSelector", "zoomAndPan"
        };
        for (String name : svgAttributes) {
            SVG_ATTRIBUTE_NAMES.put(name.toLowerCase(Locale.ROOT), name);
        }
        String[] xlink = { "actuate", "arcrole", "href", "role", "show", "title", "type" };
        for (String local : xlink) {
            FOREIGN_ATTRIBUTES.put("xlink:" + local, new String[] { "xlink", local, Namespaces.XLINK });
        }
        FOREIGN_ATTRIBUTES.put("xml:lang", new String[] { "xml", "lang", Namespaces.XML });
        FOREIGN_ATTRIBUTES.put("xml:space", new String[] { "xml", "space", Namespaces.XML });
        FOREIGN_ATTRIBUTES.put("xmlns", new String[] { null, "xmlns", Namespaces.XMLNS });
        FOREIGN_ATTRIBUTES.put("xmlns:xlink", new String[] { "xmlns", "xlink", Namespaces.XMLNS });
    }

    private ElementTypes() {
    }

    private static Set<String> set(String... names) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(names)));
    }

    /**
     * Returns true if the element is in the special category, in any
     * namespace.
     */
    static boolean isSpecial(Element element) {
        String ns = element.getNamespaceURI();
        String name = element.getLocalName();
        if (Namespaces.HTML.equals(ns)) {
            return SPECIAL.contains(name);
        } else if (Namespaces.MATHML.equals(ns)) {
            return SPECIAL_MATHML.contains(name);
        } else if (Namespaces.SVG.equals(ns)) {
            return SPECIAL_SVG.contains(name);
        }
        return false;
    }

    static boolean isFormatting(Element element) {
        return element.isHTML() && FORMATTING.contains(element.getLocalName());
    }

    static boolean isMathMLTextIntegrationPoint(Element element) {
        return Namespaces.MATHML.equals(element.getNamespaceURI())
                && MATHML_TEXT_INTEGRATION.contains(element.getLocalName());
    }

    /**
     * Returns true if the element is an HTML integration point: an SVG
     * {@code foreignObject}, {@code desc} or {@code title}, or a MathML
     * {@code annotation-xml} whose encoding is HTML.
     */
    static boolean isHTMLIntegrationPoint(Element element) {
        String ns = element.getNamespaceURI();
        if (Namespaces.SVG.equals(ns)) {
            return SVG_HTML_INTEGRATION.contains(element.getLocalName());
        }
        if (Namespaces.MATHML.equals(ns) && "annotation-xml".equals(element.getLocalName())) {
            String encoding = element.getAttribute("encoding");
            return encoding != null
                    && ("text/html".equalsIgnoreCase(encoding)
                        || "application/xhtml+xml".equalsIgnoreCase(encoding));
        }
        return false;
    }

    /**
     * Returns true if the element bounds the default scope. The list
     * item and button scopes extend this set.
     */
    static boolean isScopeBoundary(Element element) {
        String ns = element.getNamespaceURI();
        String name = element.getLocalName();
        if (Namespaces.HTML.equals(ns)) {
            return SCOPE.contains(name);
        } else if (Namespaces.MATHML.equals(ns)) {
            return SPECIAL_MATHML.contains(name);
        } else if (Namespaces.SVG.equals(ns)) {
            return SPECIAL_SVG.contains(name);
        }
        return false;
    }

    /**
     * Returns the SVG tag name with its canonical mixed case.
     */
    static String adjustSVGTagName(String name) {
        String adjusted = SVG_TAG_NAMES.get(name);
        return (adjusted == null) ? name : adjusted;
    }

    /**
     * Restores the case of SVG attribute names in place.
     */
    static void adjustSVGAttributes(AttributeList attributes) {
        for (int i = 0; i < attributes.size(); i++) {
            Attribute attribute = attributes.get(i);
            String adjusted = SVG_ATTRIBUTE_NAMES.get(attribute.getName());
            if (adjusted != null) {
                attributes.replace(i, new Attribute(adjusted, attribute.getValue()));
            }
        }
    }

    static void adjustMathMLAttributes(AttributeList attributes) {
        int index = attributes.indexOf("definitionurl");
        if (index >= 0) {
            attributes.replace(index, new Attribute("definitionURL", attributes.get(index).getValue()));
        }
    }

    /**
     * Places the xlink, xml and xmlns attributes of a foreign element in
     * their namespaces.
     */
    static void adjustForeignAttributes(AttributeList attributes) {
        for (int i = 0; i < attributes.size(); i++) {
            Attribute attribute = attributes.get(i);
            String[] adjustment = FOREIGN_ATTRIBUTES.get(attribute.getName());
            if (adjustment != null) {
                attributes.replace(i, new Attribute(adjustment[0], adjustment[1], adjustment[2], attribute.getValue()));
            }
        }
    }

}
