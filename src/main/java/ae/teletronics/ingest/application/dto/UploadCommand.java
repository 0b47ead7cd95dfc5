package ae.teletronics.ingest.application.dto;

import ae.teletronics.ingest.domain.FileCategory;
import ae.teletronics.ingest.domain.FilePrivacy;
import ae.teletronics.ingest.domain.VariantKind;

import java.util.List;
import java.util.Map;

public record UploadCommand(
        String ownerId,
        String originalName,
        String mimeType,
        byte[] bytes,
        FileCategory category,   // null -> CONTENT
        FilePrivacy privacy,     // null -> PRIVATE
        List<VariantKind> variants,
        Map<String, Object> metadata
) {
    public UploadCommand {
        variants = variants == null ? List.of() : List.copyOf(variants);
        metadata = metadata == null ? Map.of() : metadata;
    }
}
