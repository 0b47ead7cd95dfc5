package ae.teletronics.ingest.application.exceptions;

import java.util.Objects;

/**
 * Base of every failure raised by the ingest core. The {@link ErrorKind} tells callers
 * (and the job dispatcher) what went wrong and whether trying again can help.
 */
public class IngestException extends RuntimeException {

    private final ErrorKind kind;

    public IngestException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public IngestException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() { return kind; }

    public boolean isRetryable() { return kind.isRetryable(); }

    public static IngestException invalidArgument(String message) {
        return new IngestException(ErrorKind.INVALID_ARGUMENT, message);
    }
}
