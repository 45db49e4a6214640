package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>Deduplicates by (code|task|message|detail). Tasks may finish on several worker
 * threads, so {@link #warn} is synchronized.</p>
 */
public final class ListRemapWarningSink implements RemapWarningSink {

    private final List<RemapWarning> target;
    private final Set<String> seen = new HashSet<>(64);

    public ListRemapWarningSink(List<RemapWarning> target) {
        this.target = target;
    }

    private static String key(RemapWarning w) {
        return w.getCode().name() + "|"
                + w.getTaskId() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public synchronized void warn(RemapWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
