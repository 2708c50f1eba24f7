package com.williamcallahan.confluenceparser.domain.link;

public record UrlReference(String value) implements ResourceReference {

    @Override
    public LinkKind kind() {
        return LinkKind.URL;
    }

    @Override
    public String canonicalUri() {
        return value;
    }
}
