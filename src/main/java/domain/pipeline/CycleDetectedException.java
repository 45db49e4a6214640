package domain.pipeline;

/**
 * The task requirements contain a cycle.
 */
public class CycleDetectedException extends IllegalStateException {

    public CycleDetectedException(String message) {
        super(message);
    }
}
