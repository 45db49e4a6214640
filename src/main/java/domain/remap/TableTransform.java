package domain.remap;

import domain.pipeline.LocalTarget;
import domain.pipeline.Task;
import domain.table.Table;
import domain.table.TableRef;

import java.util.List;

/**
 * Base for tasks that transform one column of an input table.
 *
 * <p>The output location is {@code saveDir/outName} when an explicit name is given,
 * otherwise {@code saveDir/}{@link #defaultOutputName()}.</p>
 */
public abstract class TableTransform implements Task {

    protected final TableRef table;
    protected final String column;
    protected final String outName;
    protected final RemapSettings settings;

    protected TableTransform(TableRef table, String column, String outName, RemapSettings settings) {
        if (table == null) throw new IllegalArgumentException("table is null");
        if (column == null || column.isBlank()) throw new IllegalArgumentException("column is blank");
        if (settings == null) throw new IllegalArgumentException("settings is null");
        if (outName != null && outName.isBlank()) throw new IllegalArgumentException("outName is blank");
        this.table = table;
        this.column = column;
        this.outName = outName == null ? null : outName.trim();
        this.settings = settings;
    }

    protected abstract String defaultOutputName();

    public TableRef getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public String id() {
        return getClass().getSimpleName() + "[" + table.tableName() + "." + column + "]";
    }

    @Override
    public List<Task> requires() {
        return List.of(table);
    }

    @Override
    public LocalTarget output() {
        String name = outName != null ? outName : defaultOutputName();
        return new LocalTarget(settings.getSaveDir().resolve(name));
    }

    protected Table readInputTable() {
        return table.readTable();
    }

    protected void writeTable(Table t, boolean includeIndex) {
        output().write(out -> settings.getFormat().write(t, out, includeIndex));
    }

    @Override
    public String toString() {
        return id();
    }
}
