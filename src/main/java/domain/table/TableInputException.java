package domain.table;

/**
 * Base type for failures caused by the input table itself (unreadable file, missing column).
 */
public class TableInputException extends RuntimeException {

    private final String tableName;

    public TableInputException(String tableName, String message) {
        super(message);
        this.tableName = tableName == null ? "" : tableName;
    }

    public TableInputException(String tableName, String message, Throwable cause) {
        super(message, cause);
        this.tableName = tableName == null ? "" : tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
