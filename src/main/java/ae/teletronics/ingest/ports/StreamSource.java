package ae.teletronics.ingest.ports;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Supplier of re-openable InputStreams, so that scanning, sniffing, hashing and staging
 * can each read the content from the start.
 */
@FunctionalInterface
public interface StreamSource {
    InputStream openStream() throws IOException;

    static StreamSource of(byte[] bytes) {
        return () -> new ByteArrayInputStream(bytes);
    }
}
