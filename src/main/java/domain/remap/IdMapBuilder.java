package domain.remap;

import domain.output.ArtifactNamePolicy;
import domain.table.Table;
import domain.table.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and persists the {@link IdMap} of one column.
 * <p>
 * Output: {@code <table>-<column>-idmap} (or the explicit name), a two-column table
 * of (id, value) rows in id order.
 */
public final class IdMapBuilder extends TableTransform {

    private static final Logger log = LoggerFactory.getLogger(IdMapBuilder.class);

    public IdMapBuilder(TableRef table, String column, RemapSettings settings) {
        this(table, column, null, settings);
    }

    public IdMapBuilder(TableRef table, String column, String outName, RemapSettings settings) {
        super(table, column, outName, settings);
    }

    @Override
    protected String defaultOutputName() {
        return ArtifactNamePolicy.idMapName(table.tableName(), column);
    }

    @Override
    public void run() {
        Table t = readInputTable();
        IdMap map = IdMap.fromColumn(column, t.column(column), settings.getMissingValues());
        log.debug("[{}] {} rows -> {} distinct values (missing={})", id(), t.rowCount(), map.size(), map.hasMissing());
        writeTable(map.toTable(table.tableName()), true);
    }

    /**
     * Load the persisted map.
     *
     * @throws IllegalStateException if the map has not been built yet or is malformed
     */
    public IdMap readIdMap() {
        if (!output().exists()) throw new IllegalStateException("id map not built yet: " + output());
        return IdMap.fromRecords(column, settings.getFormat().readRecords(output().getPath()), settings.getMissingValues());
    }
}
