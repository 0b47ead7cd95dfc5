package ae.teletronics.ingest.application.exceptions;

import ae.teletronics.ingest.domain.ProviderKind;

/**
 * Raised by storage providers. Remote errors and timeouts use {@link ErrorKind#PROVIDER_FAILURE};
 * local acceptance checks use {@link ErrorKind#UNSUPPORTED_TYPE} or {@link ErrorKind#TOO_LARGE}.
 */
public class ProviderException extends IngestException {

    private final ProviderKind provider;

    public ProviderException(ProviderKind provider, ErrorKind kind, String message) {
        super(kind, message);
        this.provider = provider;
    }

    public ProviderException(ProviderKind provider, String message, Throwable cause) {
        super(ErrorKind.PROVIDER_FAILURE, message, cause);
        this.provider = provider;
    }

    public ProviderKind getProvider() { return provider; }
}
