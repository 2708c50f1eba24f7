package com.williamcallahan.confluenceparser.service;

import com.williamcallahan.confluenceparser.domain.link.AttachmentReference;
import com.williamcallahan.confluenceparser.domain.link.BlogPostReference;
import com.williamcallahan.confluenceparser.domain.link.PageReference;
import com.williamcallahan.confluenceparser.domain.link.ResourceReference;
import com.williamcallahan.confluenceparser.domain.link.UserReference;
import com.williamcallahan.confluenceparser.domain.node.MacroDescriptor;
import com.williamcallahan.confluenceparser.support.AsciiTextNormalizer;
import com.williamcallahan.confluenceparser.support.AttributeValues;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jsoup.nodes.Element;

/**
 * Typed view over one structured macro element: its name, ids, {@code ac:parameter}
 * children and bodies.
 */
final class MacroParameters {

    private static final String PREFIX = "ac";

    private final Element macroElement;
    private final String name;
    private final String key;
    private final Map<String, Element> parameterElements = new LinkedHashMap<>();

    MacroParameters(Element macroElement) {
        this.macroElement = macroElement;
        String rawName = MarkupElements.attribute(macroElement, PREFIX, "name");
        this.name = rawName == null ? "" : rawName;
        this.key = AsciiTextNormalizer.toLowerAscii(name);
        for (Element parameter : MarkupElements.childElements(macroElement, "parameter")) {
            String parameterName = MarkupElements.attribute(parameter, PREFIX, "name");
            parameterElements.putIfAbsent(parameterName == null ? "" : parameterName, parameter);
        }
    }

    /** Macro name as written. */
    String name() {
        return name;
    }

    /** Lower-cased macro name used for registry lookups. */
    String key() {
        return key;
    }

    MacroDescriptor descriptor() {
        return new MacroDescriptor(
            name,
            MarkupElements.attribute(macroElement, PREFIX, "macro-id"),
            MarkupElements.attribute(macroElement, PREFIX, "local-id"),
            asStringMap());
    }

    /**
     * Reads the first present parameter among the given names, as trimmed text.
     *
     * @param names parameter names in order of preference; matched exactly, then ignoring case
     * @return text value, or null when none of the parameters is present or non-blank
     */
    String string(String... names) {
        for (String parameterName : names) {
            Element parameter = find(parameterName);
            if (parameter != null) {
                String value = AttributeValues.blankToNull(parameter.text());
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    Integer integer(String... names) {
        return AttributeValues.parseInteger(string(names));
    }

    Boolean bool(String... names) {
        return AttributeValues.parseBoolean(string(names));
    }

    /**
     * Reads an attachment parameter given either as an {@code ri:attachment} or as a plain filename.
     *
     * @param name parameter name
     * @param versionParameter sibling parameter holding the version for plain filenames, or null
     * @return attachment reference, or null when the parameter is absent
     */
    AttachmentReference attachment(String name, String versionParameter) {
        Element parameter = find(name);
        if (parameter == null) {
            return null;
        }
        ResourceReference reference = ResourceIdentifierParser.firstChildReference(parameter);
        if (reference instanceof AttachmentReference attachment) {
            return attachment;
        }
        String filename = AttributeValues.blankToNull(parameter.text());
        if (filename == null) {
            return null;
        }
        Integer version = versionParameter == null ? null : integer(versionParameter);
        return new AttachmentReference(filename, null, version);
    }

    UserReference user(String name) {
        Element parameter = find(name);
        if (parameter == null) {
            return null;
        }
        ResourceReference reference = ResourceIdentifierParser.firstChildReference(parameter);
        if (reference instanceof UserReference user) {
            return user;
        }
        String accountId = AttributeValues.blankToNull(parameter.text());
        return accountId == null ? null : UserReference.ofAccountId(accountId);
    }

    /**
     * Reads a content parameter that embeds an {@code ri:page} or {@code ri:blog-post}, or names a page as text.
     *
     * @param names parameter names in order of preference
     * @return page or blog post reference, or null
     */
    ResourceReference content(String... names) {
        for (String parameterName : names) {
            Element parameter = find(parameterName);
            if (parameter == null) {
                continue;
            }
            ResourceReference reference = ResourceIdentifierParser.firstChildReference(parameter);
            if (reference instanceof PageReference || reference instanceof BlogPostReference) {
                return reference;
            }
            String title = AttributeValues.blankToNull(parameter.text());
            if (title != null) {
                return new PageReference(title, null, null);
            }
        }
        return null;
    }

    Element richTextBody() {
        return MarkupElements.firstChildElement(macroElement, "rich-text-body");
    }

    /**
     * Gets the plain-text body exactly as written, CDATA included.
     * @return body text, or null when the macro has no plain-text body
     */
    String plainTextBody() {
        Element body = MarkupElements.firstChildElement(macroElement, "plain-text-body");
        return body == null ? null : body.wholeText();
    }

    Element element() {
        return macroElement;
    }

    Map<String, String> asStringMap() {
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, Element> entry : parameterElements.entrySet()) {
            values.put(entry.getKey(), entry.getValue().text().strip());
        }
        return values;
    }

    private Element find(String parameterName) {
        Element exact = parameterElements.get(parameterName);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, Element> entry : parameterElements.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(parameterName)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
