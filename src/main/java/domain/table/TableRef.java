package domain.table;

import domain.pipeline.Task;

/**
 * A task whose output is a table: an input file, or a transform producing a full table.
 */
public interface TableRef extends Task {

    /**
     * Stable name used to derive artifact names.
     */
    String tableName();

    /**
     * Load the table from {@link #output()}.
     *
     * @throws TableReadException if it cannot be loaded
     */
    Table readTable();
}
