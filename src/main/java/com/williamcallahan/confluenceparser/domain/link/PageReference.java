package com.williamcallahan.confluenceparser.domain.link;

/**
 * Reference to a page, optionally pinned to the version seen when the content was saved.
 */
public record PageReference(String contentTitle, String spaceKey, Integer versionAtSave) implements ResourceReference {

    @Override
    public LinkKind kind() {
        return LinkKind.PAGE;
    }

    @Override
    public String canonicalUri() {
        String base = "page://" + nullToEmpty(spaceKey) + "/" + nullToEmpty(contentTitle);
        return versionAtSave == null ? base : base + "@v" + versionAtSave;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
