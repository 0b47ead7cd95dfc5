package ae.teletronics.ingest.adapters.detection;

import ae.teletronics.ingest.ports.FileTypeDetector;
import ae.teletronics.ingest.ports.StreamSource;
import org.apache.tika.config.TikaConfig;
import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Magic-byte sniffing with Apache Tika.
 *
 * Content wins over the filename hint. A bare octet-stream result counts as "unknown".
 */
public class TikaFileTypeDetector implements FileTypeDetector {

    private final DefaultDetector detector;

    public TikaFileTypeDetector() {
        this.detector = new DefaultDetector(TikaConfig.getDefaultConfig().getMimeRepository());
    }

    @Override
    public Optional<String> detect(StreamSource source, String filenameHint) throws IOException {
        Metadata md = new Metadata();
        if (filenameHint != null && !filenameHint.isBlank()) {
            md.set(TikaCoreProperties.RESOURCE_NAME_KEY, filenameHint);
        }

        // Tika needs mark/reset support
        try (InputStream in = new BufferedInputStream(source.openStream())) {
            MediaType mediaType = detector.detect(in, md);
            if (mediaType != null && !MediaType.OCTET_STREAM.equals(mediaType)) {
                return Optional.of(mediaType.getBaseType().toString());
            }
        }
        return Optional.empty();
    }
}
