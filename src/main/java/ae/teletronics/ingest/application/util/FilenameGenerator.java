package ae.teletronics.ingest.application.util;

import java.time.Instant;
import java.util.Locale;

/**
 * Builds the collision-resistant names used for remote objects and temp files:
 * {@code <sanitised-base>_<epochMillis>_<6 random>.<ext>}.
 */
public final class FilenameGenerator {

    private static final int MAX_BASE_LENGTH = 100;

    private FilenameGenerator() {}

    public static String generate(String originalName, Instant now) {
        String name = originalName == null ? "" : originalName.trim();
        String ext = extension(name);
        String base = ext.isEmpty() ? name : name.substring(0, name.length() - ext.length() - 1);

        String safeBase = sanitize(base);
        if (safeBase.isEmpty()) safeBase = "file";
        if (safeBase.length() > MAX_BASE_LENGTH) safeBase = safeBase.substring(0, MAX_BASE_LENGTH);

        String generated = safeBase + "_" + now.toEpochMilli() + "_" + TokenGenerator.randomSuffix(6);
        return ext.isEmpty() ? generated : generated + "." + ext;
    }

    /** Lower-cased extension without the dot, or empty. */
    public static String extension(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) return "";
        String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return ext.matches("[a-z0-9]{1,10}") ? ext : "";
    }

    public static String stripExtension(String filename) {
        String ext = extension(filename);
        return ext.isEmpty() ? filename : filename.substring(0, filename.length() - ext.length() - 1);
    }

    /** Keeps letters, digits, dot and dash; everything else becomes an underscore. */
    public static String sanitize(String input) {
        if (input == null) return "";
        return input.replaceAll("[^a-zA-Z0-9.-]", "_");
    }
}
