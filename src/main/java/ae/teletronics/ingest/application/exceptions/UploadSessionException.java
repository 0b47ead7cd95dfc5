package ae.teletronics.ingest.application.exceptions;

/**
 * Chunk protocol violations: bad index, bad chunk length, session no longer writable,
 * not yet complete, or an assembled file of the wrong size.
 */
public class UploadSessionException extends IngestException {

    private final String sessionId;

    public UploadSessionException(ErrorKind kind, String sessionId, String message) {
        super(kind, message);
        this.sessionId = sessionId;
    }

    public String getSessionId() { return sessionId; }
}
