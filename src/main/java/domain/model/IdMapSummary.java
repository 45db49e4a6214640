package domain.model;

/** Per-column id map facts for the run report. */
public final class IdMapSummary {

    private final String column;
    private final int cardinality;
    private final boolean hasMissing;
    private final String path;

    public IdMapSummary(String column, int cardinality, boolean hasMissing, String path) {
        this.column = column == null ? "" : column;
        this.cardinality = cardinality;
        this.hasMissing = hasMissing;
        this.path = path == null ? "" : path;
    }

    public String getColumn() {
        return column;
    }

    public int getCardinality() {
        return cardinality;
    }

    public boolean isHasMissing() {
        return hasMissing;
    }

    public String getPath() {
        return path;
    }
}
