package domain.pipeline;

import java.util.List;

/**
 * A unit of work in a task graph.
 *
 * <p>A task declares the tasks it requires, a deterministic output location and the work
 * that produces it. Completion is decided only by the existence of the output: when the
 * output is already there the task is done and must not be recomputed.</p>
 */
public interface Task {

    /**
     * Human-readable identity used in logs and reports.
     */
    String id();

    /**
     * Tasks that must have completed before {@link #run()} may be called.
     * Dependencies are passed by reference, never by value.
     */
    List<Task> requires();

    LocalTarget output();

    /**
     * Produce {@link #output()}. Must leave either a complete output or none at all.
     */
    void run();

    default boolean complete() {
        return output().exists();
    }
}
