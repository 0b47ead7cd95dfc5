package ae.teletronics.ingest.domain;

import java.util.Locale;

/**
 * Coarse media family of a stored file, derived from its declared MIME type.
 * Drives provider routing and accept-queue priority.
 */
public enum FileTypeCategory {
    IMAGE,
    VIDEO,
    AUDIO,
    DOCUMENT,
    ARCHIVE,
    OTHER;

    public static FileTypeCategory fromMimeType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) return OTHER;
        String m = mimeType.trim().toLowerCase(Locale.ROOT);

        if (m.startsWith("image/")) return IMAGE;
        if (m.startsWith("video/")) return VIDEO;
        if (m.startsWith("audio/")) return AUDIO;
        if (m.contains("pdf") || m.contains("document") || m.startsWith("text/") || m.contains("msword")) {
            return DOCUMENT;
        }
        if (m.contains("zip") || m.contains("rar") || m.contains("tar") || m.contains("7z")) {
            return ARCHIVE;
        }
        return OTHER;
    }

    /**
     * Accept-queue priority; lower runs sooner.
     */
    public int acceptPriority() {
        return switch (this) {
            case IMAGE -> 1;
            case VIDEO -> 2;
            case DOCUMENT -> 3;
            default -> 5;
        };
    }
}
