package domain.table;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides which raw cell values count as "missing".
 *
 * <p>All missing representations of a column collapse into one entry, written back
 * as an empty field. Only the column being remapped is normalized; other columns are
 * copied as-is.</p>
 */
public final class MissingValues {

    /**
     * Tokens recognized as missing by default (same set pandas uses when reading CSV).
     */
    public static final Set<String> DEFAULT_TOKENS = Set.of(
            "", "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan",
            "1.#IND", "1.#QNAN", "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a",
            "nan", "null"
    );

    private static final MissingValues DEFAULTS = new MissingValues(DEFAULT_TOKENS);

    private final Set<String> tokens;

    private MissingValues(Collection<String> tokens) {
        Set<String> s = new LinkedHashSet<>(tokens);
        // the empty field is always missing: that is how the sentinel is persisted
        s.add("");
        this.tokens = Set.copyOf(s);
    }

    public static MissingValues defaults() {
        return DEFAULTS;
    }

    public static MissingValues of(Collection<String> tokens) {
        if (tokens == null) throw new IllegalArgumentException("tokens is null");
        return new MissingValues(tokens);
    }

    public boolean isMissing(String raw) {
        return raw == null || tokens.contains(raw);
    }

    /**
     * @return {@code null} for a missing value, the raw value otherwise
     */
    public String normalize(String raw) {
        return isMissing(raw) ? null : raw;
    }

    public Set<String> getTokens() {
        return tokens;
    }
}
