package io.gherkinkit.gherkin;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DataTableTest {

    @Test
    void testViews() {
        DataTable table = new DataTable(List.of(
                List.of("name", "age"),
                List.of("alice", "30"),
                List.of("bob", "41")));
        assertEquals(3, table.getRowCount());
        assertEquals(2, table.getColumnCount());
        assertEquals(List.of("name", "age"), table.getHeaders());
        assertEquals(List.of(List.of("alice", "30"), List.of("bob", "41")), table.getDataRows());
        assertFalse(table.isEmpty());
    }

    @Test
    void testEmpty() {
        DataTable table = new DataTable(List.of());
        assertTrue(table.isEmpty());
        assertEquals(0, table.getColumnCount());
        assertNull(table.getHeaders());
        assertTrue(table.getDataRows().isEmpty());
        DataTable header = new DataTable(List.of(List.of("only")));
        assertTrue(header.getDataRows().isEmpty());
    }

    @Test
    void testDefensiveCopy() {
        List<String> row = new ArrayList<>(List.of("a"));
        List<List<String>> rows = new ArrayList<>();
        rows.add(row);
        DataTable table = new DataTable(rows);
        row.add("b");
        rows.add(List.of("c"));
        assertEquals(1, table.getRowCount());
        assertEquals(List.of("a"), table.getRows().get(0));
        assertThrows(UnsupportedOperationException.class, () -> table.getRows().get(0).add("x"));
    }

}
