package domain.table;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableTest {

    private static Table students() {
        return Table.of("students", List.of("name", "grade", "gpa"), List.of(
                List.of("ann", "A", "3.5"),
                List.of("bob", "B", ""),
                List.of("cid", "A", "3.5")
        ));
    }

    @Test
    void should_assign_range_labels_by_default() {
        Table t = students();
        assertEquals(List.of("0", "1", "2"), t.getIndex());
        assertEquals(3, t.rowCount());
        assertEquals(List.of("A", "B", "A"), t.column("grade"));
    }

    @Test
    void should_reject_duplicate_columns_and_ragged_rows() {
        assertThrows(IllegalArgumentException.class,
                () -> Table.of("t", List.of("a", "a"), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> Table.of("t", List.of("a", "b"), List.of(List.of("1"))));
    }

    @Test
    void should_report_table_and_available_columns_when_column_missing() {
        ColumnNotFoundException e = assertThrows(ColumnNotFoundException.class, () -> students().column("rank"));
        assertEquals("students", e.getTableName());
        assertEquals("rank", e.getColumn());
        assertEquals(List.of("name", "grade", "gpa"), e.getAvailableColumns());
    }

    @Test
    void select_should_keep_labels_and_requested_order() {
        Table t = new Table("t", List.of("a", "b"), List.of("7", "9"), List.of(List.of("1", "2"), List.of("3", "4")));
        Table s = t.select(List.of("b", "a"));
        assertEquals(List.of("b", "a"), s.getColumnNames());
        assertEquals(List.of("7", "9"), s.getIndex());
        assertEquals(List.of("4", "3"), s.row(1));
    }

    @Test
    void withColumn_should_replace_only_the_target_column() {
        Table t = students();
        Table r = t.withColumn("grade", List.of("0", "1", "0"));

        assertEquals(t.getColumnNames(), r.getColumnNames());
        assertEquals(List.of("bob", "1", ""), r.row(1));
        // source is untouched
        assertEquals(List.of("A", "B", "A"), t.column("grade"));
        assertThrows(IllegalArgumentException.class, () -> t.withColumn("grade", List.of("0")));
    }
}
