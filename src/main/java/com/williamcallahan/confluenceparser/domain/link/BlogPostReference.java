package com.williamcallahan.confluenceparser.domain.link;

/**
 * Reference to a blog post, addressed by space, title and posting day.
 */
public record BlogPostReference(String contentTitle, String spaceKey, String postingDay) implements ResourceReference {

    @Override
    public LinkKind kind() {
        return LinkKind.BLOG_POST;
    }

    @Override
    public String canonicalUri() {
        return "blog://" + orEmpty(spaceKey) + "/" + orEmpty(contentTitle) + "@" + orEmpty(postingDay);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
