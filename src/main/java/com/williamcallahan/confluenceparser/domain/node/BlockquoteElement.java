package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class BlockquoteElement extends Node {

    public BlockquoteElement(List<? extends Node> children, NodeScope scope) {
        super(NodeType.BLOCKQUOTE, children, scope);
    }
}
