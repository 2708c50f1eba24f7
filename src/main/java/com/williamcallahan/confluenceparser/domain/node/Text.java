package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Leaf holding character data.
 */
public final class Text extends Node {

    private final String text;

    public Text(String text, NodeScope scope) {
        super(NodeType.TEXT, List.of(), scope);
        this.text = text == null ? "" : text;
    }

    public Text(String text) {
        this(text, NodeScope.NONE);
    }

    public String text() {
        return text;
    }
}
