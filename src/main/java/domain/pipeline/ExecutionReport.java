package domain.pipeline;

import domain.model.TaskRunResult;
import domain.model.TaskStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-task outcome of one {@link TaskExecutor#execute(TaskGraph)} call, in topological order.
 */
public final class ExecutionReport {

    private final List<TaskRunResult> results;
    private final long elapsedMs;

    public ExecutionReport(List<TaskRunResult> results, long elapsedMs) {
        this.results = List.copyOf(results);
        this.elapsedMs = elapsedMs;
    }

    public List<TaskRunResult> getResults() {
        return results;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public boolean isSuccess() {
        for (TaskRunResult r : results) {
            if (!r.getStatus().isSuccess()) return false;
        }
        return true;
    }

    public int count(TaskStatus status) {
        int n = 0;
        for (TaskRunResult r : results) {
            if (r.getStatus() == status) n++;
        }
        return n;
    }

    public List<TaskRunResult> failures() {
        List<TaskRunResult> out = new ArrayList<>();
        for (TaskRunResult r : results) {
            if (r.getStatus() == TaskStatus.FAILED) out.add(r);
        }
        return out;
    }

    public Optional<TaskRunResult> find(String taskId) {
        for (TaskRunResult r : results) {
            if (r.getTaskId().equals(taskId)) return Optional.of(r);
        }
        return Optional.empty();
    }

    /**
     * Rethrow the cause of the first failed task, unchanged when it is unchecked.
     */
    public void throwIfFailed() {
        for (TaskRunResult r : results) {
            if (r.getStatus() != TaskStatus.FAILED) continue;
            Throwable e = r.getError();
            if (e instanceof RuntimeException) throw (RuntimeException) e;
            if (e instanceof Error) throw (Error) e;
            throw new IllegalStateException("task failed: " + r.getTaskId() + " " + r.getMessage(), e);
        }
    }
}
