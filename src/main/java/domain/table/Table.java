package domain.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable in-memory table: ordered column names, one row label per row and
 * string cells.
 *
 * <p>Row labels play the role of a row index. Tables read from a source file
 * get {@code "0".."n-1"}; tables read with an explicit index column keep the
 * labels found in the file. Transforms never mutate a table, they derive a new one.</p>
 */
public final class Table {

    private final String name;
    private final List<String> columns;
    private final List<String> index;
    private final List<List<String>> rows;
    private final Map<String, Integer> columnIndex;

    public Table(String name, List<String> columns, List<String> index, List<List<String>> rows) {
        if (columns == null) throw new IllegalArgumentException("columns is null");
        if (index == null) throw new IllegalArgumentException("index is null");
        if (rows == null) throw new IllegalArgumentException("rows is null");
        if (index.size() != rows.size()) {
            throw new IllegalArgumentException("index size " + index.size() + " != row count " + rows.size());
        }

        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String c = columns.get(i);
            if (c == null) throw new IllegalArgumentException("column name is null at position " + i);
            if (idx.putIfAbsent(c, i) != null) {
                throw new IllegalArgumentException("duplicate column name: " + c);
            }
        }

        List<List<String>> copy = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            if (row == null || row.size() != columns.size()) {
                throw new IllegalArgumentException("row " + r + " has " + (row == null ? 0 : row.size())
                        + " cells, expected " + columns.size());
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }

        this.name = name == null ? "" : name;
        this.columns = List.copyOf(columns);
        this.index = List.copyOf(index);
        this.rows = Collections.unmodifiableList(copy);
        this.columnIndex = idx;
    }

    /**
     * Table with the default row labels {@code 0..n-1}.
     */
    public static Table of(String name, List<String> columns, List<List<String>> rows) {
        return new Table(name, columns, rangeIndex(rows == null ? 0 : rows.size()), rows);
    }

    public static List<String> rangeIndex(int size) {
        List<String> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) out.add(String.valueOf(i));
        return out;
    }

    public String getName() {
        return name;
    }

    public List<String> getColumnNames() {
        return columns;
    }

    public List<String> getIndex() {
        return index;
    }

    public int rowCount() {
        return rows.size();
    }

    public List<String> row(int i) {
        return rows.get(i);
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column);
    }

    public int columnIndex(String column) {
        Integer i = columnIndex.get(column);
        if (i == null) throw new ColumnNotFoundException(name, column, columns);
        return i;
    }

    /**
     * Values of one column in row order. Cells are returned as stored (no missing-value normalization).
     */
    public List<String> column(String column) {
        int c = columnIndex(column);
        List<String> out = new ArrayList<>(rows.size());
        for (List<String> row : rows) out.add(row.get(c));
        return Collections.unmodifiableList(out);
    }

    /**
     * Projection onto the given columns, in the given order. Row labels are kept.
     */
    public Table select(List<String> names) {
        int[] pos = new int[names.size()];
        for (int i = 0; i < names.size(); i++) pos[i] = columnIndex(names.get(i));

        List<List<String>> out = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> r = new ArrayList<>(pos.length);
            for (int p : pos) r.add(row.get(p));
            out.add(r);
        }
        return new Table(name, names, index, out);
    }

    /**
     * Copy of this table where {@code column} holds {@code values}; column order and every other cell are kept.
     */
    public Table withColumn(String column, List<String> values) {
        int c = columnIndex(column);
        if (values == null || values.size() != rows.size()) {
            throw new IllegalArgumentException("replacement for column '" + column + "' has "
                    + (values == null ? 0 : values.size()) + " values, table has " + rows.size() + " rows");
        }

        List<List<String>> out = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = new ArrayList<>(rows.get(r));
            row.set(c, values.get(r));
            out.add(row);
        }
        return new Table(name, columns, index, out);
    }

    @Override
    public String toString() {
        return "Table{" + name + ", columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
