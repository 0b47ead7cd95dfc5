package ae.teletronics.ingest.domain;

public enum FilePrivacy {
    PUBLIC,
    PRIVATE,
    PROTECTED;

    public boolean isPublic() { return this == PUBLIC; }
}
