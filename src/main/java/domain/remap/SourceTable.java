package domain.remap;

import domain.output.ArtifactNamePolicy;
import domain.pipeline.LocalTarget;
import domain.pipeline.Task;
import domain.table.Table;
import domain.table.TableFormat;
import domain.table.TableReadException;
import domain.table.TableRef;

import java.nio.file.Path;
import java.util.List;

/**
 * An existing input table file. It has no requirements and cannot be produced:
 * it is complete when the file exists, and running it means the file is missing.
 */
public final class SourceTable implements TableRef {

    private final String name;
    private final LocalTarget target;
    private final TableFormat format;

    public SourceTable(Path path, String name, TableFormat format) {
        if (path == null) throw new IllegalArgumentException("path is null");
        if (format == null) throw new IllegalArgumentException("format is null");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("table name is blank");
        this.name = name.trim();
        this.target = new LocalTarget(path);
        this.format = format;
    }

    /**
     * Table named after its file name without extension.
     */
    public static SourceTable of(Path path, TableFormat format) {
        if (path == null) throw new IllegalArgumentException("path is null");
        return new SourceTable(path, ArtifactNamePolicy.tableNameOf(path.getFileName().toString()), format);
    }

    @Override
    public String id() {
        return "SourceTable[" + name + "]";
    }

    @Override
    public List<Task> requires() {
        return List.of();
    }

    @Override
    public LocalTarget output() {
        return target;
    }

    @Override
    public void run() {
        throw new TableReadException(name, target.getPath(), "input table not found");
    }

    @Override
    public String tableName() {
        return name;
    }

    @Override
    public Table readTable() {
        if (!target.exists()) throw new TableReadException(name, target.getPath(), "input table not found");
        return format.read(target.getPath(), name, false);
    }

    @Override
    public String toString() {
        return id();
    }
}
