package ae.teletronics.ingest.application.jobs;

import ae.teletronics.ingest.application.util.FilenameGenerator;
import ae.teletronics.ingest.domain.VariantKind;
import ae.teletronics.ingest.domain.model.StoredFile;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Payload keys shared by producers and handlers, plus the staging key convention.
 */
public final class JobPayloads {

    public static final String FILE_ID = "fileId";
    public static final String STAGING_KEY = "stagingKey";
    public static final String VARIANTS = "variants";

    private JobPayloads() {}

    /** Staged bytes of a file live under {@code <owner>/<generatedFilename>}. */
    public static String stagingKey(StoredFile file) {
        return stagingKey(file.getOwnerId(), file.getGeneratedFilename());
    }

    public static String stagingKey(String ownerId, String generatedFilename) {
        return FilenameGenerator.sanitize(ownerId) + "/" + generatedFilename;
    }

    public static String encodeVariants(List<VariantKind> variants) {
        return variants.stream().map(Enum::name).collect(Collectors.joining(","));
    }

    public static List<VariantKind> decodeVariants(String encoded) {
        if (encoded == null || encoded.isBlank()) return List.of();
        return Arrays.stream(encoded.split(","))
                .filter(s -> !s.isBlank())
                .map(VariantKind::parse)
                .distinct()
                .toList();
    }
}
