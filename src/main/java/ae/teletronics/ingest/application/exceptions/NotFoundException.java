package ae.teletronics.ingest.application.exceptions;

/**
 * Missing resource, or a resource owned by somebody else. Both look the same to the caller.
 */
public class NotFoundException extends IngestException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
