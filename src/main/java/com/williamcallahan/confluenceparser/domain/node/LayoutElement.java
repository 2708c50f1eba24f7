package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class LayoutElement extends Node {

    public LayoutElement(List<? extends Node> children, NodeScope scope) {
        super(NodeType.LAYOUT, children, scope);
    }

    public List<LayoutSection> sections() {
        return filter(children(), LayoutSection.class);
    }
}
