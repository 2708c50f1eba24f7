package com.williamcallahan.confluenceparser.domain.link;

public record SpaceReference(String spaceKey) implements ResourceReference {

    @Override
    public LinkKind kind() {
        return LinkKind.SPACE;
    }

    @Override
    public String canonicalUri() {
        return spaceKey == null || spaceKey.isEmpty() ? null : "space://" + spaceKey;
    }
}
