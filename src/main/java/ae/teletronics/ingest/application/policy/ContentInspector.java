package ae.teletronics.ingest.application.policy;

import ae.teletronics.ingest.application.dto.InspectionResult;
import ae.teletronics.ingest.application.exceptions.RejectedUploadException;
import ae.teletronics.ingest.ports.FileTypeDetector;
import ae.teletronics.ingest.ports.StreamSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Looks at the actual bytes of an upload.
 *
 * A sniffed type that disagrees with the declared one is only a warning. Markup or script
 * fragments in the first kilobyte are a hard rejection.
 */
public class ContentInspector {

    private static final Logger log = LoggerFactory.getLogger(ContentInspector.class);

    static final int SCAN_WINDOW_BYTES = 1024;

    private static final List<Pattern> SUSPICIOUS_PATTERNS = List.of(
            Pattern.compile("<script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("vbscript:", Pattern.CASE_INSENSITIVE),
            // inline event handler inside a tag, e.g. <img onerror=...>
            Pattern.compile("<[^>]*\\son\\w+\\s*=", Pattern.CASE_INSENSITIVE)
    );

    private final FileTypeDetector typeDetector;

    public ContentInspector(FileTypeDetector typeDetector) {
        this.typeDetector = typeDetector;
    }

    /**
     * @throws RejectedUploadException SUSPICIOUS_CONTENT when a script pattern is found
     */
    public InspectionResult inspect(byte[] bytes, String filename, String declaredMimeType) {
        List<String> warnings = new ArrayList<>();

        String detected = null;
        try {
            Optional<String> sniffed = typeDetector.detect(StreamSource.of(bytes), filename);
            detected = sniffed.orElse(null);
        } catch (IOException e) {
            // undetectable content is not an error, many binary formats are unknown
            log.debug("Type detection failed for {}: {}", filename, e.getMessage());
        }

        if (detected != null && !matchesDeclared(declaredMimeType, detected)) {
            String warning = "Declared type " + declaredMimeType + " does not match detected type " + detected;
            log.warn("{} ({})", warning, filename);
            warnings.add(warning);
        }

        String head = new String(bytes, 0, Math.min(bytes.length, SCAN_WINDOW_BYTES), StandardCharsets.UTF_8);
        for (Pattern p : SUSPICIOUS_PATTERNS) {
            if (p.matcher(head).find()) {
                throw RejectedUploadException.suspicious("File contains potentially malicious content");
            }
        }

        return new InspectionResult(detected, warnings);
    }

    private static boolean matchesDeclared(String declared, String detected) {
        if (declared == null) return false;
        return declared.toLowerCase(Locale.ROOT).contains(detected.toLowerCase(Locale.ROOT));
    }
}
