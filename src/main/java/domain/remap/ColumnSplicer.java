package domain.remap;

import domain.output.ArtifactNamePolicy;
import domain.pipeline.Task;
import domain.table.Table;
import domain.table.TableReadException;
import domain.table.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a copy of the input table in which one column is replaced by the output of a
 * {@link ValueSubstituter}.
 * <p>
 * Values are aligned by row label. Column order and every other cell stay as they are;
 * the result has no index column. Output: {@code <table>-<column>-splice} (or the explicit
 * name). The result is itself a table, named after its input table, so splices can be chained.
 */
public final class ColumnSplicer extends TableTransform implements TableRef {

    private static final Logger log = LoggerFactory.getLogger(ColumnSplicer.class);

    private final ValueSubstituter replacement;

    public ColumnSplicer(TableRef table, ValueSubstituter replacement, String column, RemapSettings settings) {
        this(table, replacement, column, null, settings);
    }

    public ColumnSplicer(TableRef table, ValueSubstituter replacement, String column, String outName, RemapSettings settings) {
        super(table, column, outName, settings);
        if (replacement == null) throw new IllegalArgumentException("replacement is null");
        this.replacement = replacement;
    }

    @Override
    protected String defaultOutputName() {
        return ArtifactNamePolicy.spliceName(table.tableName(), column);
    }

    @Override
    public List<Task> requires() {
        return List.of(table, replacement);
    }

    public ValueSubstituter getReplacement() {
        return replacement;
    }

    @Override
    public void run() {
        Table base = readInputTable();
        base.columnIndex(column);

        Table sub = replacement.readSubstituted();
        List<String> subLabels = sub.getIndex();
        List<String> subValues = sub.column(column);

        Map<String, String> byLabel = new HashMap<>(subLabels.size() * 2);
        for (int i = 0; i < subLabels.size(); i++) {
            if (byLabel.put(subLabels.get(i), subValues.get(i)) != null) {
                throw new IllegalStateException("duplicate row label '" + subLabels.get(i) + "' in " + replacement.output());
            }
        }

        List<String> aligned = new ArrayList<>(base.rowCount());
        for (String label : base.getIndex()) {
            String v = byLabel.get(label);
            if (v == null) {
                throw new IllegalStateException("row " + label + " of table '" + base.getName()
                        + "' has no substituted value in " + replacement.output());
            }
            aligned.add(v);
        }

        log.debug("[{}] splicing {} rows into column '{}'", id(), aligned.size(), column);
        writeTable(base.withColumn(column, aligned), false);
    }

    @Override
    public String tableName() {
        return table.tableName();
    }

    @Override
    public Table readTable() {
        if (!output().exists()) throw new TableReadException(tableName(), output().getPath(), "spliced table not built yet");
        return settings.getFormat().read(output().getPath(), tableName(), false);
    }
}
