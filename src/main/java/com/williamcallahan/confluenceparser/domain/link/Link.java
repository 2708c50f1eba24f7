package com.williamcallahan.confluenceparser.domain.link;

/**
 * Resolved target of a link-bearing element.
 *
 * <p>At most one {@link ResourceReference} is carried; the parser picks it by
 * {@link LinkKind} priority when the markup embeds several. A plain {@code href}
 * is kept in {@code url}.</p>
 *
 * @param url plain href for HTML anchors, null otherwise
 * @param reference the selected resource identifier payload, or null
 * @param anchor in-page anchor name, or null
 * @param cardAppearance smart-card appearance hint, or null
 * @param text visible link text taken from the link body, empty when absent
 */
public record Link(
    String url,
    ResourceReference reference,
    String anchor,
    String cardAppearance,
    String text
) {

    public Link {
        text = text == null ? "" : text;
    }

    /**
     * Derives the link kind from the payload present.
     * @return link kind, or null when neither a reference nor a url is set
     */
    public LinkKind kind() {
        if (reference != null) {
            return reference.kind();
        }
        if (url != null && !url.isEmpty()) {
            return LinkKind.URL;
        }
        return null;
    }

    /**
     * Builds the canonical URI for the link target.
     * @return canonical URI, or null when the link has no resolvable target
     */
    public String canonicalUri() {
        if (reference != null) {
            return reference.canonicalUri();
        }
        return url == null || url.isEmpty() ? null : url;
    }
}
