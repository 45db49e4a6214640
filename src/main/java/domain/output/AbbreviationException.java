package domain.output;

import java.util.List;

/**
 * Column names cannot be told apart by any common prefix length.
 */
public class AbbreviationException extends RuntimeException {

    private final List<String> columns;

    public AbbreviationException(List<String> columns, String message) {
        super(message + ": " + columns);
        this.columns = List.copyOf(columns);
    }

    public List<String> getColumns() {
        return columns;
    }
}
