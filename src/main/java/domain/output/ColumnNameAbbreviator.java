package domain.output;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives a short token from a list of column names for artifact naming.
 *
 * <p>Takes the smallest prefix length L such that the lower-cased L-character prefixes of
 * all names are pairwise distinct, title-cases each prefix and concatenates them in the
 * given order. {@code (grade, gpa, rank)} needs L=2 ("g" collides) and gives {@code GrGpRa}.
 * L never exceeds the shortest name.</p>
 */
public final class ColumnNameAbbreviator {

    private ColumnNameAbbreviator() {
    }

    /**
     * @throws IllegalArgumentException if the list is empty or holds a blank name
     * @throws AbbreviationException    if no prefix length yields distinct prefixes
     */
    public static String abbreviate(List<String> columns) {
        int len = prefixLength(columns);
        StringBuilder sb = new StringBuilder(columns.size() * len);
        for (String c : columns) {
            sb.append(titleCase(c.substring(0, len)));
        }
        return sb.toString();
    }

    /**
     * Smallest prefix length that makes all names distinct (case-insensitively).
     */
    public static int prefixLength(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("at least one column name is required");
        }

        int shortest = Integer.MAX_VALUE;
        for (String c : columns) {
            if (c == null || c.isEmpty()) throw new IllegalArgumentException("blank column name in " + columns);
            shortest = Math.min(shortest, c.length());
        }

        for (int len = 1; len <= shortest; len++) {
            if (distinctPrefixes(columns, len)) return len;
        }
        throw new AbbreviationException(columns, "no prefix length up to " + shortest + " gives distinct abbreviations");
    }

    private static boolean distinctPrefixes(List<String> columns, int len) {
        Set<String> seen = new HashSet<>();
        for (String c : columns) {
            if (!seen.add(c.substring(0, len).toLowerCase(Locale.ROOT))) return false;
        }
        return true;
    }

    // per code point, so the result keeps the prefix length ("ß" stays "ß", not "SS")
    private static String titleCase(String prefix) {
        StringBuilder sb = new StringBuilder(prefix.length());
        int i = 0;
        while (i < prefix.length()) {
            int cp = prefix.codePointAt(i);
            sb.appendCodePoint(i == 0 ? Character.toTitleCase(cp) : Character.toLowerCase(cp));
            i += Character.charCount(cp);
        }
        return sb.toString();
    }
}
