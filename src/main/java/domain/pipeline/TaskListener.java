package domain.pipeline;

import domain.model.TaskRunResult;

/** Callback for finished tasks (progress reporting). */
@FunctionalInterface
public interface TaskListener {

    static TaskListener none() {
        return (result, finished, total) -> {
        };
    }

    /**
     * Called once per task, possibly from a worker thread.
     */
    void onTaskFinished(TaskRunResult result, int finished, int total);
}
