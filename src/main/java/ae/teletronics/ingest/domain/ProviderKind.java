package ae.teletronics.ingest.domain;

/**
 * Closed set of storage backends. The wire name is what ends up in File records and logs.
 */
public enum ProviderKind {
    /** Image/video store with native transformations (Cloudinary). */
    TRANSFORM("cloudinary"),
    /** General-purpose object store (S3). */
    OBJECT_STORE("s3");

    private final String wireName;

    ProviderKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    /**
     * Routing rule: images and video go to the transform-capable backend, everything else to the object store.
     */
    public static ProviderKind forType(FileTypeCategory type) {
        if (type == FileTypeCategory.IMAGE || type == FileTypeCategory.VIDEO) {
            return TRANSFORM;
        }
        return OBJECT_STORE;
    }
}
