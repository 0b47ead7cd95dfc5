package ae.teletronics.ingest.application.exceptions;

/**
 * Upload refused by policy (size, type, virus scan) or by content inspection.
 */
public class RejectedUploadException extends IngestException {

    public RejectedUploadException(String message) {
        super(ErrorKind.REJECTED, message);
    }

    public RejectedUploadException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public static RejectedUploadException suspicious(String message) {
        return new RejectedUploadException(ErrorKind.SUSPICIOUS_CONTENT, message);
    }
}
