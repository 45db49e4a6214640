package domain.output;

import java.util.Locale;

/**
 * File naming policy for pipeline artifacts.
 * <p>
 * Default names:
 * <ul>
 *   <li>{@code <table>-<column>-idmap}: id map of one column</li>
 *   <li>{@code <table>-<column>-idsub}: substituted column</li>
 *   <li>{@code <table>-<column>-splice}: table with one column spliced in</li>
 *   <li>{@code <table>-Map-<abbreviation>}: final table with every requested column remapped</li>
 * </ul>
 * Name parts are reduced to file-name safe characters. Plain names pass through unchanged;
 * a name that had to be altered gets a hash of its raw form appended, e.g. {@code a b -> a_b_00017063}.
 */
public final class ArtifactNamePolicy {

    public static final String ID_MAP_SUFFIX = "idmap";
    public static final String SUBSTITUTION_SUFFIX = "idsub";
    public static final String SPLICE_SUFFIX = "splice";
    public static final String FINAL_MARKER = "Map";

    private ArtifactNamePolicy() {
    }

    public static String idMapName(String tableName, String column) {
        return join(tableName, column, ID_MAP_SUFFIX);
    }

    public static String substitutionName(String tableName, String column) {
        return join(tableName, column, SUBSTITUTION_SUFFIX);
    }

    public static String spliceName(String tableName, String column) {
        return join(tableName, column, SPLICE_SUFFIX);
    }

    /**
     * e.g. ("grades", "GrGpRa") -> grades-Map-GrGpRa
     */
    public static String finalName(String tableName, String abbreviation) {
        return namePart(tableName, "table") + "-" + FINAL_MARKER + "-" + namePart(abbreviation, "Cols");
    }

    public static String reportName(String finalName) {
        return limit(safePart(finalName, "remap"), 180) + "-report.xlsx";
    }

    /**
     * Table name derived from a file name: the file name without its last extension.
     * e.g. data/grades.csv -> grades
     */
    public static String tableNameOf(String fileName) {
        String s = fileName == null ? "" : fileName.trim();
        int slash = Math.max(s.lastIndexOf('/'), s.lastIndexOf('\\'));
        if (slash >= 0) s = s.substring(slash + 1);
        int dot = s.lastIndexOf('.');
        if (dot > 0) s = s.substring(0, dot);
        return s.isEmpty() ? "table" : s;
    }

    private static String join(String tableName, String column, String suffix) {
        return namePart(tableName, "table") + "-" + namePart(column, "column") + "-" + suffix;
    }

    /**
     * Injective variant of {@link #safePart}: "a b", "a_b" and "a?b" give three different parts.
     */
    static String namePart(String raw, String fallback) {
        String s = safePart(raw, fallback);
        if (s.equals(raw)) return s;
        return s + "_" + String.format("%08x", raw == null ? 0 : raw.hashCode());
    }

    static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replace('\n', '_')
                .replace('\r', '_');

        // Keep only filename-safe characters.
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        // avoid hidden files
        if (s.startsWith(".")) s = "_" + s.substring(1);

        // windows reserved names
        String u = s.toUpperCase(Locale.ROOT);
        if (u.equals("CON") || u.equals("PRN") || u.equals("AUX") || u.equals("NUL")
                || u.matches("COM[1-9]") || u.matches("LPT[1-9]")) {
            s = "_" + s;
        }
        return s;
    }

    private static String limit(String s, int max) {
        if (s == null) return "";
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
