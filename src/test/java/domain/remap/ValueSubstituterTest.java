package domain.remap;

import domain.table.ColumnNotFoundException;
import domain.table.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueSubstituterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_replace_values_by_ids_and_keep_row_labels() throws Exception {
        SourceTable table = RemapFixtures.students(tempDir);
        RemapSettings settings = RemapFixtures.settings(tempDir.resolve("out"));
        IdMapBuilder idMap = new IdMapBuilder(table, "grade", settings);
        ValueSubstituter sub = new ValueSubstituter(table, idMap, "grade", settings);

        assertEquals(List.of(table, idMap), sub.requires());

        idMap.run();
        sub.run();

        assertEquals("\"\",grade\n0,0\n1,1\n2,0\n3,2\n4,3\n", Files.readString(sub.output().getPath()));
        Table t = sub.readSubstituted();
        assertEquals(List.of("0", "1", "2", "3", "4"), t.getIndex());
        assertEquals(List.of("0", "1", "0", "2", "3"), t.column("grade"));
    }

    @Test
    void retained_columns_should_follow_the_substituted_column() throws Exception {
        SourceTable table = RemapFixtures.students(tempDir);
        RemapSettings settings = RemapFixtures.settings(tempDir.resolve("out"));
        IdMapBuilder idMap = new IdMapBuilder(table, "grade", settings);
        ValueSubstituter sub = new ValueSubstituter(table, idMap, "grade", List.of("name"), null, settings);

        idMap.run();
        sub.run();

        assertEquals(List.of("name"), sub.getRetainColumns());
        Table t = sub.readSubstituted();
        assertEquals(List.of("grade", "name"), t.getColumnNames());
        assertEquals(List.of("2", "dan"), t.row(3));
    }

    @Test
    void unknown_retained_column_should_fail() throws Exception {
        SourceTable table = RemapFixtures.students(tempDir);
        RemapSettings settings = RemapFixtures.settings(tempDir.resolve("out"));
        IdMapBuilder idMap = new IdMapBuilder(table, "grade", settings);
        ValueSubstituter sub = new ValueSubstituter(table, idMap, "grade", List.of("major"), null, settings);

        idMap.run();
        assertThrows(ColumnNotFoundException.class, sub::run);
        assertFalse(sub.complete());
    }

    @Test
    void value_missing_from_map_should_fail_and_write_nothing() throws Exception {
        SourceTable table = RemapFixtures.students(tempDir);
        RemapSettings settings = RemapFixtures.settings(tempDir.resolve("out"));
        IdMapBuilder idMap = new IdMapBuilder(table, "grade", settings);
        // a stale map that only knows "A"
        Files.createDirectories(idMap.output().getPath().getParent());
        Files.writeString(idMap.output().getPath(), "\"\",grade\n0,A\n");

        ValueSubstituter sub = new ValueSubstituter(table, idMap, "grade", settings);

        UnmappedValueException e = assertThrows(UnmappedValueException.class, sub::run);
        assertEquals("grade", e.getColumn());
        assertEquals("B", e.getValue());
        assertEquals("1", e.getRowLabel());
        assertFalse(Files.exists(sub.output().getPath()));
    }
}
