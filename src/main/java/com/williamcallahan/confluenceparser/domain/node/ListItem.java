package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Item of a list; task items additionally carry a status and task identifiers.
 */
public final class ListItem extends Node {

    private final TaskListItemStatus status;
    private final String taskId;
    private final String taskUuid;
    private final String localId;

    public ListItem(TaskListItemStatus status, String taskId, String taskUuid, String localId,
            List<? extends Node> children, NodeScope scope) {
        super(NodeType.LIST_ITEM, children, scope);
        this.status = status;
        this.taskId = taskId;
        this.taskUuid = taskUuid;
        this.localId = localId;
    }

    public ListItem(List<? extends Node> children) {
        this(null, null, null, null, children, NodeScope.NONE);
    }

    public ListItem(TaskListItemStatus status, List<? extends Node> children) {
        this(status, null, null, null, children, NodeScope.NONE);
    }

    public TaskListItemStatus status() {
        return status;
    }

    public String taskId() {
        return taskId;
    }

    public String taskUuid() {
        return taskUuid;
    }

    public String localId() {
        return localId;
    }

    /**
     * Gets the item's nesting depth.
     * @return depth recorded at parse time, or 1 for a detached item
     */
    public int depth() {
        Integer depth = scope().listDepth();
        return depth == null ? 1 : depth;
    }
}
