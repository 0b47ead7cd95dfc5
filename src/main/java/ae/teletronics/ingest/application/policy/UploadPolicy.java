package ae.teletronics.ingest.application.policy;

import ae.teletronics.ingest.application.exceptions.RejectedUploadException;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Global acceptance rules applied before any bytes are staged.
 * Allow-list entries are exact types ("application/pdf") or family wildcards ("image/*").
 */
public class UploadPolicy {

    private final long maxFileSize;
    private final List<String> allowedMimeTypes;

    public UploadPolicy(long maxFileSize, List<String> allowedMimeTypes) {
        if (maxFileSize <= 0) {
            throw new IllegalArgumentException("maxFileSize must be > 0");
        }
        this.maxFileSize = maxFileSize;
        this.allowedMimeTypes = Objects.requireNonNull(allowedMimeTypes, "allowedMimeTypes").stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public void check(String mimeType, long size) {
        if (size > maxFileSize) {
            throw new RejectedUploadException("File size " + size + " exceeds maximum limit of " + maxFileSize + " bytes");
        }
        if (!isAllowed(mimeType)) {
            throw new RejectedUploadException("File type " + mimeType + " is not allowed");
        }
    }

    public boolean isAllowed(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) return false;
        String m = mimeType.trim().toLowerCase(Locale.ROOT);
        for (String allowed : allowedMimeTypes) {
            if (allowed.endsWith("/*")) {
                if (m.startsWith(allowed.substring(0, allowed.length() - 1))) return true;
            } else if (m.equals(allowed)) {
                return true;
            }
        }
        return false;
    }

    public long getMaxFileSize() { return maxFileSize; }

    public List<String> getAllowedMimeTypes() { return allowedMimeTypes; }
}
