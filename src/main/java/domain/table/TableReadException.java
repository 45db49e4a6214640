package domain.table;

import java.nio.file.Path;

/** The table could not be loaded from its storage location. */
public class TableReadException extends TableInputException {

    private final Path location;

    public TableReadException(String tableName, Path location, String message) {
        super(tableName, message + ": " + location);
        this.location = location;
    }

    public TableReadException(String tableName, Path location, String message, Throwable cause) {
        super(tableName, message + ": " + location, cause);
        this.location = location;
    }

    public Path getLocation() {
        return location;
    }
}
