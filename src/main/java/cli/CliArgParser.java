package cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 */
public final class CliArgParser {

    private CliArgParser() {
    }

    public static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an integer: '" + s + "'", e);
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase();
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--cleanup       => true</li>
     *   <li>--cleanup=true  => true</li>
     *   <li>--cleanup=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * Comma separated list. Items are trimmed; blank items are kept as "" so that
     * callers can reject them.
     * <ul>
     *   <li>null / blank => empty list</li>
     *   <li>"grade, gpa" => [grade, gpa]</li>
     * </ul>
     */
    public static List<String> parseList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split(",", -1)) {
            out.add(part.trim());
        }
        return out;
    }

    /**
     * Single-character delimiter. Accepts the literal character or one of
     * {@code tab}, {@code \t}, {@code comma}, {@code semicolon}, {@code pipe}.
     */
    public static char parseDelimiter(String raw, char def) {
        if (raw == null || raw.isEmpty()) return def;
        String v = raw.toLowerCase();
        switch (v) {
            case "tab":
            case "\\t":
            case "\t":
                return '\t';
            case "comma":
                return ',';
            case "semicolon":
                return ';';
            case "pipe":
                return '|';
            default:
                break;
        }
        if (raw.length() != 1) throw new IllegalArgumentException("delimiter must be a single character: '" + raw + "'");
        return raw.charAt(0);
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        if (args == null) return m;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) continue;

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1);
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1];
                    i++;
                }
            }

            if (!k.isEmpty()) m.put(k, v);
        }

        return m;
    }
}
