package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Section heading, levels 1 through 6.
 */
public final class HeadingElement extends Node {

    private final int level;

    public HeadingElement(int level, List<? extends Node> children, NodeScope scope) {
        super(NodeType.HEADING, children, scope);
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6: " + level);
        }
        this.level = level;
    }

    public int level() {
        return level;
    }
}
