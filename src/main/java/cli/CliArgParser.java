package cli;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Option parsing for the fingerprint CLI.
 *
 * <p>{@code --key=value} keeps everything after the first {@code =} so {@code --sql=... a=1}
 * survives intact. {@code --key value} consumes the next token unless it is another option.
 * A bare {@code --key} maps to {@code ""}, which {@link #flag(Map, String)} reads as set.
 * Tokens that are not options are ignored.</p>
 */
public final class CliArgParser {

    private static final String PREFIX = "--";
    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "y", "yes");

    private CliArgParser() {
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new LinkedHashMap<>();
        if (args == null) return options;

        int i = 0;
        while (i < args.length) {
            String token = (args[i] == null) ? "" : args[i].trim();
            i++;
            if (!token.startsWith(PREFIX)) continue;

            String body = token.substring(PREFIX.length());
            int eq = body.indexOf('=');
            String key;
            String value;
            if (eq > 0) {
                key = body.substring(0, eq).trim();
                value = body.substring(eq + 1).trim();
            } else {
                key = body.trim();
                value = "";
                if (i < args.length && args[i] != null && !args[i].trim().startsWith(PREFIX)) {
                    value = args[i].trim();
                    i++;
                }
            }
            if (!key.isEmpty()) options.put(key, value);
        }
        return options;
    }

    /** {@code --failFast} and {@code --failFast=yes} are set, {@code --failFast=false} is not. */
    public static boolean flag(Map<String, String> options, String key) {
        if (options == null || key == null || !options.containsKey(key)) return false;
        String raw = options.get(key);
        return raw == null || raw.isBlank() || parseBoolean(raw, true);
    }

    /** First alias with a non-blank value, trimmed. */
    public static String firstNonBlank(Map<String, String> options, String... aliases) {
        if (options == null || aliases == null) return null;
        for (String alias : aliases) {
            String v = options.get(alias);
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }

    public static int parseInt(String s, int def) {
        return parseNumber(s, Integer::valueOf, def);
    }

    public static long parseLong(String s, long def) {
        return parseNumber(s, Long::valueOf, def);
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        return TRUE_WORDS.contains(s.trim().toLowerCase(Locale.ROOT));
    }

    private static <N extends Number> N parseNumber(String s, Function<String, N> parser, N def) {
        if (s == null || s.isBlank()) return def;
        try {
            return parser.apply(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
