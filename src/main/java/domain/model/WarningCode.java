package domain.model;

/**
 * Standard warning codes for pipeline runs and cleanup.
 *
 * <p>Keep the set small and stable.</p>
 */
public enum WarningCode {

    /**
     * The task's output already existed, so the task was not run again.
     */
    TASK_ALREADY_COMPLETE,

    /**
     * The task failed; its dependents were not run.
     */
    TASK_FAILED,

    /**
     * The task was not run because one of its requirements failed.
     */
    UPSTREAM_FAILED,

    /**
     * An intermediate artifact slated for deletion was already absent.
     */
    CLEANUP_TARGET_MISSING
}
