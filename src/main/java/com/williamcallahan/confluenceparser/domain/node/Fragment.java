package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Synthetic root wrapping several top-level nodes.
 */
public final class Fragment extends Node {

    public Fragment(List<? extends Node> children) {
        super(NodeType.FRAGMENT, children, NodeScope.NONE);
    }
}
