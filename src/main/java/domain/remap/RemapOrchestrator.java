package domain.remap;

import domain.model.RemapWarning;
import domain.model.RemapWarningSink;
import domain.model.WarningCode;
import domain.output.ArtifactNamePolicy;
import domain.output.ColumnNameAbbreviator;
import domain.pipeline.LocalTarget;
import domain.pipeline.Task;
import domain.pipeline.TaskGraph;
import domain.table.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Replaces one or more categorical columns of a table with contiguous integer ids.
 *
 * <p>Each column gets a chain of three tasks:</p>
 * <ol>
 *   <li>{@link IdMapBuilder} builds the column's id map from the source table</li>
 *   <li>{@link ValueSubstituter} writes the column with every value replaced by its id</li>
 *   <li>{@link ColumnSplicer} splices that column into a full table</li>
 * </ol>
 *
 * <p>Splices are sequential: the splice of column N reads the table written by the splice
 * of column N-1, so the last splice holds every remapped column. Id maps and substitutions
 * only read the source table and can run in parallel. The whole graph is built here, in
 * the constructor; nothing is executed until the caller hands {@link #getGraph()} to a
 * {@link domain.pipeline.TaskExecutor}.</p>
 */
public final class RemapOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RemapOrchestrator.class);

    private final TableRef table;
    private final List<String> columns;
    private final RemapSettings settings;
    private final String finalName;
    private final List<RemapChain> chains;
    private final TaskGraph graph;

    public RemapOrchestrator(TableRef table, List<String> columns, RemapSettings settings) {
        this(table, columns, null, settings);
    }

    /**
     * @param outName name of the final table; {@code null} for {@code <table>-Map-<abbreviation>}
     * @throws IllegalArgumentException for an empty column list, blank or duplicate names
     * @throws domain.output.AbbreviationException if the default final name cannot be derived
     */
    public RemapOrchestrator(TableRef table, List<String> columns, String outName, RemapSettings settings) {
        if (table == null) throw new IllegalArgumentException("table is null");
        if (settings == null) throw new IllegalArgumentException("settings is null");
        this.table = table;
        this.columns = validateColumns(columns);
        this.settings = settings;

        if (outName != null && outName.isBlank()) throw new IllegalArgumentException("outName is blank");
        this.finalName = outName != null
                ? outName.trim()
                : ArtifactNamePolicy.finalName(table.tableName(), ColumnNameAbbreviator.abbreviate(this.columns));

        List<RemapChain> built = new ArrayList<>(this.columns.size());
        TableRef current = table;
        for (int i = 0; i < this.columns.size(); i++) {
            String col = this.columns.get(i);
            boolean last = i == this.columns.size() - 1;

            IdMapBuilder idMapper = new IdMapBuilder(table, col, settings);
            ValueSubstituter subber = new ValueSubstituter(table, idMapper, col, settings);
            ColumnSplicer splicer = new ColumnSplicer(current, subber, col, last ? finalName : null, settings);

            built.add(new RemapChain(col, idMapper, subber, splicer));
            current = splicer;
        }
        this.chains = Collections.unmodifiableList(built);

        this.graph = TaskGraph.of(finalResult());
        log.info("remap graph for table '{}' built: columns={}, tasks={}, final={}",
                table.tableName(), this.columns, graph.size(), output());
    }

    private static List<String> validateColumns(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("at least one column to remap is required");
        }
        Set<String> seen = new HashSet<>();
        for (String c : columns) {
            if (c == null || c.isBlank()) throw new IllegalArgumentException("blank column name in " + columns);
            if (!seen.add(c)) throw new IllegalArgumentException("duplicate column name '" + c + "' in " + columns);
        }
        return List.copyOf(columns);
    }

    public TableRef getTable() {
        return table;
    }

    public List<String> getColumns() {
        return columns;
    }

    public String getFinalName() {
        return finalName;
    }

    public List<RemapChain> getChains() {
        return chains;
    }

    public TaskGraph getGraph() {
        return graph;
    }

    /**
     * The last splice: its output is the pipeline's final table.
     */
    public ColumnSplicer finalResult() {
        return chains.get(chains.size() - 1).getSplicer();
    }

    public LocalTarget output() {
        return finalResult().output();
    }

    /**
     * Every generated task: id map builders, then substituters, then splicers.
     * The source table is not included.
     */
    public List<Task> allTasks() {
        List<Task> out = new ArrayList<>(chains.size() * 3);
        for (RemapChain c : chains) out.add(c.getIdMapBuilder());
        for (RemapChain c : chains) out.add(c.getSubstituter());
        for (RemapChain c : chains) out.add(c.getSplicer());
        return out;
    }

    public int deleteIntermediates() {
        return deleteIntermediates(settings.getWarningSink());
    }

    /**
     * Delete every artifact except the final table. Already-missing files are reported as
     * {@link WarningCode#CLEANUP_TARGET_MISSING}; any other I/O failure propagates.
     *
     * @return number of files deleted
     */
    public int deleteIntermediates(RemapWarningSink warningSink) {
        RemapWarningSink sink = warningSink == null ? RemapWarningSink.none() : warningSink;
        Task keep = finalResult();

        int deleted = 0;
        for (Task t : allTasks()) {
            if (t == keep) continue;
            if (t.output().delete()) {
                deleted++;
                log.debug("deleted intermediate {}", t.output());
            } else {
                log.warn("intermediate already absent: {}", t.output());
                sink.warn(RemapWarning.of(WarningCode.CLEANUP_TARGET_MISSING, t.id(), t.output().toString()));
            }
        }
        log.info("deleted {} intermediate artifact(s) for table '{}'", deleted, table.tableName());
        return deleted;
    }
}
