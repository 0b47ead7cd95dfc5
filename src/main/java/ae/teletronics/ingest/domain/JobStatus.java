package ae.teletronics.ingest.domain;

public enum JobStatus {
    WAITING,
    ACTIVE,
    COMPLETED,
    /** Dead list: not retried any more. */
    FAILED
}
