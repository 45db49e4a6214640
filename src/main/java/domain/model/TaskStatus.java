package domain.model;

/** Outcome of one task in an execution. */
public enum TaskStatus {

    /** The task ran and produced its output. */
    DONE,

    /** The output already existed; nothing was recomputed. */
    SKIPPED,

    /** The task ran and failed. */
    FAILED,

    /** The task was not run because a requirement did not succeed. */
    UPSTREAM_FAILED;

    public boolean isSuccess() {
        return this == DONE || this == SKIPPED;
    }
}
