package com.williamcallahan.confluenceparser.domain.node;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies the cell matrix and header row detection.
 */
class TableTest {

    @Test
    void shortRowsArePaddedOnTheRight() {
        Text wide = new Text("x");
        Table table = new Table(List.of(
            new TableRow(List.of(
                new TableCell(true, List.of(new Text("a"))),
                new TableCell(true, List.of(new Text("b"))),
                new TableCell(true, List.of(new Text("c"))))),
            new TableRow(List.of(new TableCell(false, List.of(wide))))));

        List<List<List<Node>>> cells = table.cells();

        assertEquals(2, cells.size());
        assertThat(cells).allMatch(row -> row.size() == 3);
        assertEquals(List.of(wide), cells.get(1).get(0));
        assertEquals(List.of(), cells.get(1).get(2));
        assertEquals(1, table.rows().get(1).children().size());
    }

    @Test
    void headerRowRequiresEveryFirstRowCellToBeHeader() {
        Table headed = new Table(List.of(new TableRow(List.of(
            new TableCell(true, List.of()), new TableCell(true, List.of())))));
        Table mixed = new Table(List.of(new TableRow(List.of(
            new TableCell(true, List.of()), new TableCell(false, List.of())))));

        assertTrue(headed.hasHeaderRow());
        assertFalse(mixed.hasHeaderRow());
        assertFalse(new Table(List.of()).hasHeaderRow());
        assertFalse(new Table(List.of(new TableRow(List.of()))).hasHeaderRow());
    }
}
