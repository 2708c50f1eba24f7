package com.williamcallahan.confluenceparser.domain.link;

/**
 * Typed payload of a {@code ri:} resource identifier.
 */
public sealed interface ResourceReference
    permits UserReference, PageReference, BlogPostReference, SpaceReference,
        AttachmentReference, ContentEntityReference, ShortcutReference, UrlReference {

    /**
     * Gets the link kind this reference resolves to.
     * @return link kind
     */
    LinkKind kind();

    /**
     * Builds the canonical URI for this reference.
     * @return canonical URI, or null when the reference lacks the identifying field
     */
    String canonicalUri();
}
