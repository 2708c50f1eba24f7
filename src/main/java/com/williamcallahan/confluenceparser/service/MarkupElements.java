package com.williamcallahan.confluenceparser.service;

import com.williamcallahan.confluenceparser.support.AsciiTextNormalizer;
import com.williamcallahan.confluenceparser.support.AttributeValues;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;

/**
 * Prefix-agnostic element and attribute lookups over jsoup trees.
 *
 * <p>Storage format prefixes ({@code ac:}, {@code ri:}, {@code at:}) carry fixed meaning
 * whether or not the fragment declares them, so elements are matched by local name and
 * attributes by either their prefixed or their bare name.</p>
 */
final class MarkupElements {

    private MarkupElements() {
        // Utility class - no instantiation
    }

    static String localName(Element element) {
        return AsciiTextNormalizer.localName(element.tagName());
    }

    /**
     * Reads an attribute by prefixed name first, then by bare name, ignoring case.
     *
     * @param element element to read
     * @param prefix namespace prefix such as {@code ac}, or null for bare names only
     * @param name local attribute name
     * @return trimmed value, or null when absent or blank
     */
    static String attribute(Element element, String prefix, String name) {
        if (prefix != null) {
            String qualified = prefix + ":" + name;
            if (element.attributes().hasKeyIgnoreCase(qualified)) {
                return AttributeValues.blankToNull(element.attributes().getIgnoreCase(qualified));
            }
        }
        if (element.attributes().hasKeyIgnoreCase(name)) {
            return AttributeValues.blankToNull(element.attributes().getIgnoreCase(name));
        }
        return null;
    }

    static List<Element> childElements(Element parent, String localName) {
        List<Element> matches = new ArrayList<>();
        for (Element child : parent.children()) {
            if (localName.equals(localName(child))) {
                matches.add(child);
            }
        }
        return matches;
    }

    static Element firstChildElement(Element parent, String localName) {
        for (Element child : parent.children()) {
            if (localName.equals(localName(child))) {
                return child;
            }
        }
        return null;
    }

    /**
     * Reads the trimmed text of the first child element with the given local name.
     *
     * @param parent element to search
     * @param localName child local name such as {@code task-status}
     * @return trimmed text, or null when the child is absent or empty
     */
    static String childText(Element parent, String localName) {
        Element child = firstChildElement(parent, localName);
        return child == null ? null : AttributeValues.blankToNull(child.text());
    }
}
