package com.williamcallahan.confluenceparser.domain.link;

/**
 * Reference through a configured shortcut, e.g. key {@code jira} with parameter {@code ABC-1}.
 */
public record ShortcutReference(String key, String parameter) implements ResourceReference {

    @Override
    public LinkKind kind() {
        return LinkKind.SHORTCUT;
    }

    @Override
    public String canonicalUri() {
        if (key == null || key.isEmpty() || parameter == null || parameter.isEmpty()) {
            return null;
        }
        return "shortcut://" + key + "/" + parameter;
    }
}
