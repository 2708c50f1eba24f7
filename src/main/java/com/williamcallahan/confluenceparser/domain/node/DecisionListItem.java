package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class DecisionListItem extends Node {

    private final DecisionListItemState state;
    private final String localId;

    public DecisionListItem(DecisionListItemState state, String localId, List<? extends Node> children,
            NodeScope scope) {
        super(NodeType.DECISION_LIST_ITEM, children, scope);
        this.state = state;
        this.localId = localId;
    }

    public DecisionListItem(DecisionListItemState state, List<? extends Node> children) {
        this(state, null, children, NodeScope.NONE);
    }

    /**
     * Gets the decision state.
     * @return state, or null when the source carried none (rendered as pending)
     */
    public DecisionListItemState state() {
        return state;
    }

    public String localId() {
        return localId;
    }
}
