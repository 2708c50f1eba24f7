package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class LayoutCell extends Node {

    public LayoutCell(List<? extends Node> children, NodeScope scope) {
        super(NodeType.LAYOUT_CELL, children, scope);
    }
}
