package domain.table;

import java.util.List;

/** A requested column is absent from the table. */
public class ColumnNotFoundException extends TableInputException {

    private final String column;
    private final List<String> availableColumns;

    public ColumnNotFoundException(String tableName, String column, List<String> availableColumns) {
        super(tableName, "column '" + column + "' not found in table '" + tableName
                + "' (available: " + availableColumns + ")");
        this.column = column;
        this.availableColumns = availableColumns == null ? List.of() : List.copyOf(availableColumns);
    }

    public String getColumn() {
        return column;
    }

    public List<String> getAvailableColumns() {
        return availableColumns;
    }
}
