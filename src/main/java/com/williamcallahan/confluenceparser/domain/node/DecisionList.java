package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class DecisionList extends Node {

    private final String localId;

    public DecisionList(String localId, List<? extends Node> children, NodeScope scope) {
        super(NodeType.DECISION_LIST, children, scope);
        this.localId = localId;
    }

    public DecisionList(List<? extends Node> children) {
        this(null, children, NodeScope.NONE);
    }

    public String localId() {
        return localId;
    }

    public List<DecisionListItem> items() {
        return filter(children(), DecisionListItem.class);
    }
}
