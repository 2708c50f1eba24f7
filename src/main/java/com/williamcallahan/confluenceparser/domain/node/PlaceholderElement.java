package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Editor placeholder prompt, e.g. "@ mention lead".
 */
public final class PlaceholderElement extends Node {

    private final String placeholderType;
    private final String text;

    public PlaceholderElement(String placeholderType, String text, NodeScope scope) {
        super(NodeType.PLACEHOLDER, List.of(), scope);
        this.placeholderType = placeholderType;
        this.text = text;
    }

    public PlaceholderElement(String text) {
        this(null, text, NodeScope.NONE);
    }

    public String placeholderType() {
        return placeholderType;
    }

    public String text() {
        return text;
    }
}
