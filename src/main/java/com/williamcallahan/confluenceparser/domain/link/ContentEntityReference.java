package com.williamcallahan.confluenceparser.domain.link;

public record ContentEntityReference(String contentId) implements ResourceReference {

    @Override
    public LinkKind kind() {
        return LinkKind.CONTENT_ENTITY;
    }

    @Override
    public String canonicalUri() {
        return contentId == null || contentId.isEmpty() ? null : "contentid://" + contentId;
    }
}
