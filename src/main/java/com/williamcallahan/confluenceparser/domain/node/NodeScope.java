package com.williamcallahan.confluenceparser.domain.node;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Contextual placement captured when a node is built.
 *
 * @param listDepth depth of the nearest enclosing list item (top-level items are 1), or null outside lists
 * @param layout address of the enclosing layout cell, or null outside layouts
 */
public record NodeScope(Integer listDepth, LayoutAddress layout) {

    public static final NodeScope NONE = new NodeScope(null, null);

    public NodeScope {
        if (listDepth != null && listDepth < 1) {
            throw new IllegalArgumentException("List depth must be at least 1");
        }
    }

    public OptionalInt listScope() {
        return listDepth == null ? OptionalInt.empty() : OptionalInt.of(listDepth);
    }

    public Optional<LayoutAddress> layoutScope() {
        return Optional.ofNullable(layout);
    }
}
