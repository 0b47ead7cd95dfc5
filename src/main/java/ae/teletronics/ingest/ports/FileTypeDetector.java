package ae.teletronics.ingest.ports;

import java.io.IOException;
import java.util.Optional;

/**
 * Content sniffing used to cross-check the MIME type a client declared for an upload.
 */
public interface FileTypeDetector {

    /**
     * @param filenameHint optional name whose extension breaks ties between candidate types
     * @return the sniffed type, empty when the content only looks like {@code application/octet-stream}
     */
    Optional<String> detect(StreamSource source, String filenameHint) throws IOException;

}
