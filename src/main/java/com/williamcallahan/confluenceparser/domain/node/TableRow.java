package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

public final class TableRow extends Node {

    public TableRow(List<? extends Node> children, NodeScope scope) {
        super(NodeType.TABLE_ROW, children, scope);
    }

    public TableRow(List<? extends Node> children) {
        this(children, NodeScope.NONE);
    }

    public List<TableCell> cells() {
        return filter(children(), TableCell.class);
    }
}
