package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;

/**
 * Data or header cell holding rich content.
 */
public final class TableCell extends Node {

    private final boolean header;
    private final Integer rowspan;
    private final Integer colspan;

    public TableCell(boolean header, Integer rowspan, Integer colspan, List<? extends Node> children,
            NodeScope scope) {
        super(NodeType.TABLE_CELL, children, scope);
        this.header = header;
        this.rowspan = rowspan;
        this.colspan = colspan;
    }

    public TableCell(boolean header, List<? extends Node> children) {
        this(header, null, null, children, NodeScope.NONE);
    }

    public boolean isHeader() {
        return header;
    }

    public Integer rowspan() {
        return rowspan;
    }

    public Integer colspan() {
        return colspan;
    }
}
