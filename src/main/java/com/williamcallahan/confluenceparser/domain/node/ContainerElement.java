package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;
import java.util.Set;

/**
 * Neutral wrapper such as {@code div} or {@code span}; renders its children only.
 */
public final class ContainerElement extends Node {

    private static final Set<String> INLINE_TAGS = Set.of("span", "font", "small", "big", "mark");

    private final String tag;

    public ContainerElement(String tag, List<? extends Node> children, NodeScope scope) {
        super(NodeType.CONTAINER, children, scope);
        this.tag = tag == null ? "div" : tag;
    }

    public ContainerElement(List<? extends Node> children) {
        this("div", children, NodeScope.NONE);
    }

    /**
     * Gets the local tag name the container was parsed from.
     * @return tag name
     */
    public String tag() {
        return tag;
    }

    @Override
    public boolean isBlock() {
        return !INLINE_TAGS.contains(tag);
    }
}
