package com.williamcallahan.confluenceparser.domain.node;

import java.util.ArrayList;
import java.util.List;

/**
 * Table of rows; section wrappers ({@code thead}, {@code tbody}, {@code tfoot}) are flattened at parse time.
 */
public final class Table extends Node {

    public Table(List<? extends Node> children, NodeScope scope) {
        super(NodeType.TABLE, children, scope);
    }

    public Table(List<? extends Node> children) {
        this(children, NodeScope.NONE);
    }

    public List<TableRow> rows() {
        return filter(children(), TableRow.class);
    }

    /**
     * Builds the rectangular cell matrix.
     *
     * <p>Each cell is the ordered list of that cell's child nodes. Rows shorter than the
     * widest row are padded with empty cells on the right.</p>
     *
     * @return matrix indexed as {@code cells.get(row).get(column)}
     */
    public List<List<List<Node>>> cells() {
        List<TableRow> rows = rows();
        int width = 0;
        for (TableRow row : rows) {
            width = Math.max(width, row.cells().size());
        }
        List<List<List<Node>>> matrix = new ArrayList<>(rows.size());
        for (TableRow row : rows) {
            List<List<Node>> line = new ArrayList<>(width);
            for (TableCell cell : row.cells()) {
                line.add(cell.children());
            }
            while (line.size() < width) {
                line.add(List.of());
            }
            matrix.add(List.copyOf(line));
        }
        return List.copyOf(matrix);
    }

    /**
     * Whether the first row is made up entirely of header cells.
     * @return true when row 0 exists, has cells, and every cell is a header
     */
    public boolean hasHeaderRow() {
        List<TableRow> rows = rows();
        if (rows.isEmpty()) {
            return false;
        }
        List<TableCell> firstRowCells = rows.get(0).cells();
        if (firstRowCells.isEmpty()) {
            return false;
        }
        for (TableCell cell : firstRowCells) {
            if (!cell.isHeader()) {
                return false;
            }
        }
        return true;
    }
}
