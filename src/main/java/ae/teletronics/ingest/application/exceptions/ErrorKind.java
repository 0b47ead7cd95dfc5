package ae.teletronics.ingest.application.exceptions;

/**
 * Error taxonomy of the ingest core. Only {@link #PROVIDER_FAILURE} is worth retrying;
 * everything else fails the same way on every attempt.
 */
public enum ErrorKind {
    INVALID_ARGUMENT(false),
    NOT_FOUND(false),
    INVALID_CHUNK_INDEX(false),
    CHUNK_SIZE_MISMATCH(false),
    SESSION_NOT_WRITABLE(false),
    NOT_COMPLETED(false),
    SIZE_MISMATCH(false),
    REJECTED(false),
    SUSPICIOUS_CONTENT(false),
    UNSUPPORTED_TYPE(false),
    TOO_LARGE(false),
    PROVIDER_FAILURE(true),
    JOB_EXHAUSTED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() { return retryable; }
}
