package domain.remap;

import domain.output.ArtifactNamePolicy;
import domain.pipeline.Task;
import domain.table.Table;
import domain.table.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Replaces every value of one column by its id from a previously built id map.
 * <p>
 * Output: {@code <table>-<column>-idsub} (or the explicit name) holding the row labels,
 * the substituted column and any retained columns. The map is never extended: a value
 * without an entry fails the task with {@link UnmappedValueException} and nothing is written.
 */
public final class ValueSubstituter extends TableTransform {

    private static final Logger log = LoggerFactory.getLogger(ValueSubstituter.class);

    private final IdMapBuilder idMap;
    private final List<String> retainColumns;

    public ValueSubstituter(TableRef table, IdMapBuilder idMap, String column, RemapSettings settings) {
        this(table, idMap, column, List.of(), null, settings);
    }

    public ValueSubstituter(
            TableRef table,
            IdMapBuilder idMap,
            String column,
            List<String> retainColumns,
            String outName,
            RemapSettings settings
    ) {
        super(table, column, outName, settings);
        if (idMap == null) throw new IllegalArgumentException("idMap is null");
        this.idMap = idMap;
        this.retainColumns = retainColumns == null ? List.of() : List.copyOf(retainColumns);
    }

    @Override
    protected String defaultOutputName() {
        return ArtifactNamePolicy.substitutionName(table.tableName(), column);
    }

    @Override
    public List<Task> requires() {
        return List.of(table, idMap);
    }

    public IdMapBuilder getIdMap() {
        return idMap;
    }

    public List<String> getRetainColumns() {
        return retainColumns;
    }

    @Override
    public void run() {
        IdMap map = idMap.readIdMap();
        Table t = readInputTable();

        List<String> raw = t.column(column);
        List<String> label = t.getIndex();
        List<String> substituted = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            Integer id = map.lookup(raw.get(i));
            if (id == null) {
                throw new UnmappedValueException(column, settings.getMissingValues().normalize(raw.get(i)), label.get(i));
            }
            substituted.add(String.valueOf(id));
        }

        Set<String> cols = new LinkedHashSet<>();
        cols.add(column);
        cols.addAll(retainColumns);

        Table out = t.select(new ArrayList<>(cols)).withColumn(column, substituted);
        log.debug("[{}] substituted {} rows using {} ids", id(), raw.size(), map.size());
        writeTable(out, true);
    }

    /**
     * Load the persisted substituted table (row labels restored).
     */
    public Table readSubstituted() {
        return settings.getFormat().read(output().getPath(), table.tableName(), true);
    }
}
