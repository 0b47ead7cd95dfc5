package ae.teletronics.ingest.application.dto;

import java.util.List;

/**
 * Outcome of content inspection. Warnings are informational and never block the upload.
 */
public record InspectionResult(String detectedMimeType, List<String> warnings) {
    public InspectionResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
