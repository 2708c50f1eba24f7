package com.williamcallahan.confluenceparser.service;

import com.williamcallahan.confluenceparser.domain.link.AttachmentReference;
import com.williamcallahan.confluenceparser.domain.link.BlogPostReference;
import com.williamcallahan.confluenceparser.domain.link.ContentEntityReference;
import com.williamcallahan.confluenceparser.domain.link.PageReference;
import com.williamcallahan.confluenceparser.domain.link.ResourceReference;
import com.williamcallahan.confluenceparser.domain.link.ShortcutReference;
import com.williamcallahan.confluenceparser.domain.link.SpaceReference;
import com.williamcallahan.confluenceparser.domain.link.UrlReference;
import com.williamcallahan.confluenceparser.domain.link.UserReference;
import com.williamcallahan.confluenceparser.support.AttributeValues;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Element;

/**
 * Reads {@code ri:*} resource identifier elements into typed references.
 */
final class ResourceIdentifierParser {

    private static final String PREFIX = "ri";

    static final Set<String> IDENTIFIER_TAGS = Set.of(
        "user", "page", "blog-post", "space", "attachment", "content-entity", "shortcut", "url");

    private ResourceIdentifierParser() {
        // Utility class - no instantiation
    }

    static boolean isResourceIdentifier(Element element) {
        return IDENTIFIER_TAGS.contains(MarkupElements.localName(element));
    }

    /**
     * Parses a resource identifier element.
     *
     * @param element element whose local name is one of {@link #IDENTIFIER_TAGS}
     * @return typed reference, or null for any other element
     */
    static ResourceReference parse(Element element) {
        return switch (MarkupElements.localName(element)) {
            case "user" -> new UserReference(
                attribute(element, "account-id"), attribute(element, "local-id"), attribute(element, "userkey"));
            case "page" -> new PageReference(
                attribute(element, "content-title"), attribute(element, "space-key"),
                AttributeValues.parseInteger(attribute(element, "version-at-save")));
            case "blog-post" -> new BlogPostReference(
                attribute(element, "content-title"), attribute(element, "space-key"),
                attribute(element, "posting-day"));
            case "space" -> new SpaceReference(attribute(element, "space-key"));
            case "attachment" -> new AttachmentReference(
                attribute(element, "filename"), attribute(element, "content-id"),
                AttributeValues.parseInteger(attribute(element, "version-at-save")));
            case "content-entity" -> new ContentEntityReference(attribute(element, "content-id"));
            case "shortcut" -> new ShortcutReference(attribute(element, "key"), attribute(element, "parameter"));
            case "url" -> new UrlReference(attribute(element, "value"));
            default -> null;
        };
    }

    /**
     * Finds the first identifier among an element's children, looking inside a wrapping
     * {@code ac:link} as well.
     *
     * @param parent element such as an {@code ac:parameter}
     * @return parsed reference, or null when no child is a resource identifier
     */
    static ResourceReference firstChildReference(Element parent) {
        for (Element child : parent.children()) {
            ResourceReference reference = "link".equals(MarkupElements.localName(child))
                ? firstChildReference(child)
                : parse(child);
            if (reference != null) {
                return reference;
            }
        }
        return null;
    }

    /**
     * Picks the reference a link resolves to when several are embedded.
     *
     * @param references candidates in document order
     * @return the candidate with the highest-priority kind, the earliest on ties; null when empty
     */
    static ResourceReference selectPreferred(List<ResourceReference> references) {
        ResourceReference preferred = null;
        for (ResourceReference candidate : references) {
            if (preferred == null || candidate.kind().ordinal() < preferred.kind().ordinal()) {
                preferred = candidate;
            }
        }
        return preferred;
    }

    private static String attribute(Element element, String name) {
        return MarkupElements.attribute(element, PREFIX, name);
    }
}
