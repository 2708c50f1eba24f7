package com.williamcallahan.confluenceparser.domain.link;

/**
 * Kind of target a link points at.
 *
 * <p>Declaration order is the resolution priority: when a link embeds more than one
 * resource identifier, the one whose kind comes first wins.</p>
 */
public enum LinkKind {
    USER("user"),
    PAGE("page"),
    BLOG_POST("blog_post"),
    SPACE("space"),
    ATTACHMENT("attachment"),
    CONTENT_ENTITY("content_entity"),
    SHORTCUT("shortcut"),
    URL("url");

    private final String identifier;

    LinkKind(String identifier) {
        this.identifier = identifier;
    }

    /**
     * Gets the string identifier for this link kind.
     * @return string identifier
     */
    public String getIdentifier() {
        return identifier;
    }
}
