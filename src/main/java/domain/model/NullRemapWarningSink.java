package domain.model;

/** No-op warning sink. */
final class NullRemapWarningSink implements RemapWarningSink {

    static final NullRemapWarningSink INSTANCE = new NullRemapWarningSink();

    private NullRemapWarningSink() {
    }

    @Override
    public void warn(RemapWarning warning) {
        // no-op
    }
}
