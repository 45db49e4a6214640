package domain.remap;

/**
 * A column value has no entry in the id map used for substitution.
 *
 * <p>Substitution never drops or coerces such a value; the task fails instead.</p>
 */
public class UnmappedValueException extends RuntimeException {

    private final String column;
    private final String value;
    private final String rowLabel;

    public UnmappedValueException(String column, String value, String rowLabel) {
        super("value " + (value == null ? "<missing>" : "'" + value + "'")
                + " of column '" + column + "'"
                + (rowLabel == null ? "" : " at row " + rowLabel)
                + " has no id map entry");
        this.column = column;
        this.value = value;
        this.rowLabel = rowLabel;
    }

    public String getColumn() {
        return column;
    }

    /**
     * @return the offending value, {@code null} for a missing value
     */
    public String getValue() {
        return value;
    }

    public String getRowLabel() {
        return rowLabel;
    }
}
