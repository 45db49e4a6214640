package domain.model;

/**
 * A single task outcome row for reporting.
 *
 * <p>Kept as a simple value object. The failure cause is carried for callers that want
 * to propagate it; the report only uses the message.</p>
 */
public final class TaskRunResult {

    private final TaskStatus status;
    private final String taskId;

    /**
     * simple class name of the task, e.g. IdMapBuilder
     */
    private final String taskType;

    /**
     * output location of the task
     */
    private final String output;
    private final long elapsedMs;

    /**
     * failure / skip reason, empty on success
     */
    private final String message;
    private final Throwable error;

    public TaskRunResult(TaskStatus status, String taskId, String taskType, String output, long elapsedMs, String message) {
        this(status, taskId, taskType, output, elapsedMs, message, null);
    }

    public TaskRunResult(
            TaskStatus status,
            String taskId,
            String taskType,
            String output,
            long elapsedMs,
            String message,
            Throwable error
    ) {
        if (status == null) throw new IllegalArgumentException("status is null");
        this.status = status;
        this.taskId = nullToEmpty(taskId);
        this.taskType = nullToEmpty(taskType);
        this.output = nullToEmpty(output);
        this.elapsedMs = elapsedMs;
        this.message = nullToEmpty(message);
        this.error = error;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTaskType() {
        return taskType;
    }

    public String getOutput() {
        return output;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return status + " " + taskId + (message.isEmpty() ? "" : " (" + message + ")");
    }
}
