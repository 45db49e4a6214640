package domain.table;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;

/** Storage format for tables (read from a path, write to a stream). */
public interface TableFormat {

    /**
     * Read a table whose first record is the header.
     *
     * @param indexed when true the first column holds row labels and is not a data column
     * @throws TableReadException if the file is missing, unreadable or malformed
     */
    Table read(Path path, String tableName, boolean indexed);

    /**
     * Raw records, header included when the file has one.
     */
    List<List<String>> readRecords(Path path);

    /**
     * Write the header and all rows. {@code null} cells are written as empty fields.
     *
     * @param includeIndex write the row labels as a leading column with an empty header
     */
    void write(Table table, Writer out, boolean includeIndex) throws IOException;
}
