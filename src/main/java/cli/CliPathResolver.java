package cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Resolves the batch run's file options.
 *
 * <p>The base directory comes from {@code --baseDir}, then {@code -DbaseDir}, then the working
 * directory. Relative {@code --in}, {@code --out} and {@code --csvOut} values resolve against it.</p>
 */
public final class CliPathResolver {

    public static final String PROP_BASE_DIR = "baseDir";

    private CliPathResolver() {}

    /** Resolves the base directory and publishes it as {@code -DbaseDir} for the rest of the run. */
    public static Path resolveBaseDir(Map<String, String> argv) {
        String fromArg = (argv == null) ? null : trimToNull(argv.get(PROP_BASE_DIR));
        if (fromArg != null) System.setProperty(PROP_BASE_DIR, fromArg);

        String raw = trimToNull(System.getProperty(PROP_BASE_DIR));
        Path cwd = Paths.get(System.getProperty("user.dir"));
        Path base = (raw == null) ? cwd : cwd.resolve(raw);
        return base.toAbsolutePath().normalize();
    }

    /** @return null when the option is absent or blank */
    public static Path resolveOption(Path baseDir, String raw) {
        String v = trimToNull(raw);
        if (v == null) return null;
        Path p = Paths.get(v);
        if (!p.isAbsolute() && baseDir != null) p = baseDir.resolve(p);
        return p.toAbsolutePath().normalize();
    }

    public static Path resolveOption(Path baseDir, String raw, String def) {
        Path p = resolveOption(baseDir, raw);
        return (p != null) ? p : resolveOption(baseDir, def);
    }

    public static void requireReadableFile(Path p, String label) {
        if (p == null) throw new IllegalArgumentException(label + " is required");
        if (!Files.isRegularFile(p)) throw new IllegalArgumentException(label + " not found: " + p);
        if (!Files.isReadable(p)) throw new IllegalArgumentException(label + " is not readable: " + p);
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
