package domain.model;

/**
 * Sink for remap warnings.
 *
 * <p>Warnings come from the executor and from cleanup. A sink lets the CLI collect them
 * for the report without coupling those components to it.</p>
 */
public interface RemapWarningSink {

    static RemapWarningSink none() {
        return NullRemapWarningSink.INSTANCE;
    }

    void warn(RemapWarning warning);
}
