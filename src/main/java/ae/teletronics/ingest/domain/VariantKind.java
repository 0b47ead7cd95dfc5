package ae.teletronics.ingest.domain;

import java.util.Locale;

/**
 * Derived renditions and the transform each one asks the provider for.
 */
public enum VariantKind {
    THUMBNAIL(new TransformOptions(150, 150, "fill", null, null, false)),
    SMALL(new TransformOptions(300, 300, "limit", null, null, false)),
    MEDIUM(new TransformOptions(600, 600, "limit", null, null, false)),
    LARGE(new TransformOptions(1200, 1200, "limit", null, null, false)),
    XLARGE(new TransformOptions(2000, 2000, "limit", null, null, false)),
    WEBP(new TransformOptions(null, null, null, 90, "webp", false)),
    AVIF(new TransformOptions(null, null, null, 80, "avif", false)),
    COMPRESSED(new TransformOptions(null, null, null, 60, null, true));

    private final TransformOptions transform;

    VariantKind(TransformOptions transform) {
        this.transform = transform;
    }

    public TransformOptions transform() { return transform; }

    public static VariantKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("variant is required");
        }
        return VariantKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
