package domain.model;

/**
 * A single warning emitted while building, running or cleaning up a remap pipeline.
 *
 * <p>Warnings are not fatal; they indicate something operators may want to review
 * (a task that was already complete, an artifact that was already gone).</p>
 */
public final class RemapWarning {

    private final WarningCode code;
    private final String taskId;
    private final String message;
    private final String detail;

    public RemapWarning(WarningCode code, String taskId, String message, String detail) {
        this.code = code == null ? WarningCode.TASK_FAILED : code;
        this.taskId = nullToEmpty(taskId);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static RemapWarning of(WarningCode code, String taskId, String message) {
        return new RemapWarning(code, taskId, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + " " + taskId + ": " + message + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
