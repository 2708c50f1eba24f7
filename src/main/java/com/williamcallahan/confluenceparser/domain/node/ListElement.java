package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, unordered or task list.
 */
public final class ListElement extends Node {

    private final ListType listType;
    private final Integer start;
    private final String localId;

    /**
     * Creates a list node.
     *
     * @param listType list flavour
     * @param start first ordinal for ordered lists, null when absent or malformed
     * @param localId local id of a task-list macro, null otherwise
     * @param children items and any stray children
     * @param scope construction scope
     */
    public ListElement(ListType listType, Integer start, String localId, List<? extends Node> children,
            NodeScope scope) {
        super(NodeType.LIST, children, scope);
        this.listType = Objects.requireNonNull(listType, "List type cannot be null");
        this.start = start;
        this.localId = localId;
    }

    public ListElement(ListType listType, List<? extends Node> children) {
        this(listType, null, null, children, NodeScope.NONE);
    }

    public ListType listType() {
        return listType;
    }

    public Integer start() {
        return start;
    }

    public String localId() {
        return localId;
    }

    /**
     * Gets the items of this list, skipping any other children.
     * @return list items in order
     */
    public List<ListItem> items() {
        return filter(children(), ListItem.class);
    }
}
