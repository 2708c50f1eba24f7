package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class I18nElement extends Node {

    private final String key;

    public I18nElement(String key, NodeScope scope) {
        super(NodeType.I18N, List.of(), scope);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
