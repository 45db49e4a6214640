package domain.remap;

import domain.pipeline.Task;

import java.util.List;

/** The three tasks that remap one column: id map, substitution, splice. */
public final class RemapChain {

    private final String column;
    private final IdMapBuilder idMapBuilder;
    private final ValueSubstituter substituter;
    private final ColumnSplicer splicer;

    public RemapChain(String column, IdMapBuilder idMapBuilder, ValueSubstituter substituter, ColumnSplicer splicer) {
        this.column = column;
        this.idMapBuilder = idMapBuilder;
        this.substituter = substituter;
        this.splicer = splicer;
    }

    public String getColumn() {
        return column;
    }

    public IdMapBuilder getIdMapBuilder() {
        return idMapBuilder;
    }

    public ValueSubstituter getSubstituter() {
        return substituter;
    }

    public ColumnSplicer getSplicer() {
        return splicer;
    }

    public List<Task> tasks() {
        return List.of(idMapBuilder, substituter, splicer);
    }
}
