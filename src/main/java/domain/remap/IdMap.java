package domain.remap;

import domain.table.MissingValues;
import domain.table.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapping from the distinct values of one column to contiguous ids {@code 0..k-1}.
 *
 * <p>Ids follow first-occurrence order. Every missing representation collapses into one
 * entry ({@code null}), which gets an id like any other value.</p>
 */
public final class IdMap {

    private final String column;
    private final MissingValues missingValues;
    private final List<String> values;
    private final Map<String, Integer> ids;

    private IdMap(String column, MissingValues missingValues, List<String> values) {
        this.column = column;
        this.missingValues = missingValues;
        this.values = Collections.unmodifiableList(values);

        // LinkedHashMap accepts the null key used for the missing entry
        Map<String, Integer> m = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            if (m.putIfAbsent(values.get(i), i) != null) {
                throw new IllegalStateException("duplicate id map value for column '" + column + "': "
                        + display(values.get(i)));
            }
        }
        this.ids = m;
    }

    /**
     * Build from raw column values in row order.
     */
    public static IdMap fromColumn(String column, List<String> rawValues, MissingValues missingValues) {
        if (rawValues == null) throw new IllegalArgumentException("rawValues is null");
        MissingValues mv = missingValues == null ? MissingValues.defaults() : missingValues;

        Map<String, Boolean> distinct = new LinkedHashMap<>();
        for (String raw : rawValues) {
            distinct.putIfAbsent(mv.normalize(raw), Boolean.TRUE);
        }
        return new IdMap(column, mv, new ArrayList<>(distinct.keySet()));
    }

    /**
     * Parse persisted (id, value) records. A leading record whose id is not an integer is a header.
     * Ids must be exactly {@code 0..k-1} in order.
     */
    public static IdMap fromRecords(String column, List<List<String>> records, MissingValues missingValues) {
        if (records == null) throw new IllegalArgumentException("records is null");
        MissingValues mv = missingValues == null ? MissingValues.defaults() : missingValues;

        List<String> values = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            List<String> rec = records.get(i);
            String idField = rec.isEmpty() ? "" : rec.get(0).trim();

            if (i == 0 && !isInteger(idField)) continue;

            if (!isInteger(idField)) {
                throw new IllegalStateException("id map for column '" + column + "': record " + i
                        + " has non-integer id '" + idField + "'");
            }
            int id = Integer.parseInt(idField);
            if (id != values.size()) {
                throw new IllegalStateException("id map for column '" + column + "': expected id "
                        + values.size() + " but found " + id);
            }
            values.add(mv.normalize(rec.size() > 1 ? rec.get(1) : ""));
        }
        return new IdMap(column, mv, values);
    }

    private static boolean isInteger(String s) {
        if (s == null || s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return s.length() < 10;
    }

    private static String display(String value) {
        return value == null ? "<missing>" : "'" + value + "'";
    }

    public String getColumn() {
        return column;
    }

    /** Number of distinct values, missing counted once. */
    public int size() {
        return values.size();
    }

    /**
     * Distinct values in id order; {@code null} stands for the missing entry.
     */
    public List<String> values() {
        return values;
    }

    public boolean hasMissing() {
        return ids.containsKey(null);
    }

    /**
     * @return the id of a raw value, or {@code null} when the map has no entry for it
     */
    public Integer lookup(String rawValue) {
        return ids.get(missingValues.normalize(rawValue));
    }

    /**
     * @throws UnmappedValueException when the map has no entry for the value
     */
    public int idOf(String rawValue) {
        Integer id = lookup(rawValue);
        if (id == null) throw new UnmappedValueException(column, missingValues.normalize(rawValue), null);
        return id;
    }

    /**
     * @return the value for an id, {@code null} for the missing entry
     */
    public String valueOf(int id) {
        if (id < 0 || id >= values.size()) {
            throw new IllegalArgumentException("id " + id + " out of range [0, " + values.size() + ")");
        }
        return values.get(id);
    }

    public List<String> invert(List<Integer> idList) {
        List<String> out = new ArrayList<>(idList.size());
        for (Integer id : idList) out.add(valueOf(id));
        return out;
    }

    /**
     * Persisted form: the id is the row label, the single data column holds the value.
     */
    public Table toTable(String tableName) {
        List<List<String>> rows = new ArrayList<>(values.size());
        for (String v : values) {
            List<String> r = new ArrayList<>(1);
            r.add(v);
            rows.add(r);
        }
        return Table.of(tableName, List.of(column), rows);
    }
}
