package com.williamcallahan.confluenceparser.domain.node;

import com.williamcallahan.confluenceparser.domain.link.LinkKind;

/**
 * Link flavour as exposed on link nodes.
 */
public enum LinkType {
    PAGE("page"),
    BLOG_POST("blog_post"),
    USER("user"),
    SPACE("space"),
    ATTACHMENT("attachment"),
    CONTENT_ENTITY("content_entity"),
    SHORTCUT("shortcut"),
    URL("url"),
    EXTERNAL("external"),
    MAILTO("mailto"),
    ANCHOR("anchor"),
    UNKNOWN("unknown");

    private final String identifier;

    LinkType(String identifier) {
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * Maps a resolved link kind to the link type of the node.
     * @param kind link kind, may be null
     * @return matching link type, {@link #UNKNOWN} for null
     */
    public static LinkType fromKind(LinkKind kind) {
        if (kind == null) {
            return UNKNOWN;
        }
        return switch (kind) {
            case USER -> USER;
            case PAGE -> PAGE;
            case BLOG_POST -> BLOG_POST;
            case SPACE -> SPACE;
            case ATTACHMENT -> ATTACHMENT;
            case CONTENT_ENTITY -> CONTENT_ENTITY;
            case SHORTCUT -> SHORTCUT;
            case URL -> URL;
        };
    }
}
