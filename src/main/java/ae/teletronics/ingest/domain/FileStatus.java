package ae.teletronics.ingest.domain;

public enum FileStatus {
    UPLOADING,
    PROCESSING,
    READY,
    FAILED,
    DELETED
}
