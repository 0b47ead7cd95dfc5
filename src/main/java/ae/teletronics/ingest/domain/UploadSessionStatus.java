package ae.teletronics.ingest.domain;

/**
 * Only ACTIVE may transition; the three other states are terminal.
 */
public enum UploadSessionStatus {
    ACTIVE,
    COMPLETED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() { return this != ACTIVE; }
}
