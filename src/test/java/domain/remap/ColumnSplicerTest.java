package domain.remap;

import domain.table.Table;
import domain.table.TableReadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColumnSplicerTest {

    @TempDir
    Path tempDir;

    @Test
    void should_replace_target_column_in_place() throws Exception {
        SourceTable table = RemapFixtures.students(tempDir);
        RemapSettings settings = RemapFixtures.settings(tempDir.resolve("out"));
        IdMapBuilder idMap = new IdMapBuilder(table, "grade", settings);
        ValueSubstituter sub = new ValueSubstituter(table, idMap, "grade", settings);
        ColumnSplicer splice = new ColumnSplicer(table, sub, "grade", settings);

        idMap.run();
        sub.run();
        splice.run();

        assertEquals("students-grade-splice", splice.output().getPath().getFileName().toString());
        assertEquals("students", splice.tableName());
        assertEquals("name,grade,gpa,rank\n"
                        + "ann,0,3.5,1\n"
                        + "bob,1,,2\n"
                        + "cid,0,3.5,3\n"
                        + "dan,2,2.0,1\n"
                        + "eve,3,3.9,2\n",
                Files.readString(splice.output().getPath()));
    }

    @Test
    void should_align_by_row_label_not_position() throws Exception {
        SourceTable table = RemapFixtures.students(tempDir);
        RemapSettings settings = RemapFixtures.settings(tempDir.resolve("out"));
        IdMapBuilder idMap = new IdMapBuilder(table, "grade", settings);
        ValueSubstituter sub = new ValueSubstituter(table, idMap, "grade", settings);
        ColumnSplicer splice = new ColumnSplicer(table, sub, "grade", settings);

        Files.createDirectories(sub.output().getPath().getParent());
        Files.writeString(sub.output().getPath(), "\"\",grade\n4,9\n3,8\n2,7\n1,6\n0,5\n");
        splice.run();

        Table t = splice.readTable();
        assertEquals(List.of("5", "6", "7", "8", "9"), t.column("grade"));
    }

    @Test
    void should_fail_when_a_row_has_no_substituted_value() throws Exception {
        SourceTable table = RemapFixtures.students(tempDir);
        RemapSettings settings = RemapFixtures.settings(tempDir.resolve("out"));
        IdMapBuilder idMap = new IdMapBuilder(table, "grade", settings);
        ValueSubstituter sub = new ValueSubstituter(table, idMap, "grade", settings);
        ColumnSplicer splice = new ColumnSplicer(table, sub, "grade", settings);

        Files.createDirectories(sub.output().getPath().getParent());
        Files.writeString(sub.output().getPath(), "\"\",grade\n0,0\n1,1\n");

        assertThrows(IllegalStateException.class, splice::run);
        assertFalse(splice.complete());
    }

    @Test
    void reading_before_build_should_fail() throws Exception {
        SourceTable table = RemapFixtures.students(tempDir);
        RemapSettings settings = RemapFixtures.settings(tempDir.resolve("out"));
        ValueSubstituter sub = new ValueSubstituter(table, new IdMapBuilder(table, "grade", settings), "grade", settings);
        ColumnSplicer splice = new ColumnSplicer(table, sub, "grade", settings);

        assertThrows(TableReadException.class, splice::readTable);
    }
}
