package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class Paragraph extends Node {

    public Paragraph(List<? extends Node> children, NodeScope scope) {
        super(NodeType.PARAGRAPH, children, scope);
    }
}
