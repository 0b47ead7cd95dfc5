package ae.teletronics.ingest.ports;

import ae.teletronics.ingest.application.exceptions.ErrorKind;
import ae.teletronics.ingest.application.exceptions.ProviderException;
import ae.teletronics.ingest.domain.FileTypeCategory;
import ae.teletronics.ingest.domain.ProviderKind;
import ae.teletronics.ingest.domain.TransformOptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One remote storage backend.
 *
 * Implementations never retry internally: every remote call is bounded by a timeout and
 * failures surface as {@link ProviderException} with {@link ErrorKind#PROVIDER_FAILURE},
 * leaving retries to the job queue.
 */
public interface StorageProvider {

    ProviderKind kind();

    Set<FileTypeCategory> supportedTypes();

    long maxFileSize();

    /**
     * @throws ProviderException UNSUPPORTED_TYPE or TOO_LARGE
     */
    default void ensureAcceptable(FileTypeCategory type, long size) {
        if (!supportedTypes().contains(type)) {
            throw new ProviderException(kind(), ErrorKind.UNSUPPORTED_TYPE,
                    "File type " + type + " is not supported by " + kind().wireName());
        }
        if (size > maxFileSize()) {
            throw new ProviderException(kind(), ErrorKind.TOO_LARGE,
                    "File of " + size + " bytes exceeds the " + maxFileSize() + " byte limit of " + kind().wireName());
        }
    }

    UploadResult upload(UploadRequest request);

    /**
     * Best-effort derived rendition. Backends without native transformations return the original URL.
     */
    ProcessResult process(String existingUrl, TransformOptions options);

    /**
     * With {@code force} set, provider errors are swallowed and the call reports success.
     */
    boolean delete(DeleteRequest request);

    Map<String, Object> getInfo(String objectId);

    String generateSignedUrl(String objectId, long ttlSeconds);

    record UploadRequest(byte[] bytes,
                         String filename,
                         String mimeType,
                         long size,
                         boolean isPublic,
                         String folder,
                         Map<String, Object> metadata) {
        public UploadRequest {
            Objects.requireNonNull(bytes, "bytes");
            Objects.requireNonNull(filename, "filename");
            Map<String, Object> copy = new LinkedHashMap<>();
            if (metadata != null) {
                metadata.forEach((k, v) -> {
                    if (v != null) copy.put(k, v);
                });
            }
            metadata = Collections.unmodifiableMap(copy);
        }
    }

    record UploadResult(String url, String objectId, long size, String format, Map<String, Object> metadata) {
        public UploadResult {
            metadata = metadata == null ? Map.of() : metadata;
        }
    }

    record ProcessResult(String url, Integer width, Integer height, long size, String format,
                         Map<String, Object> metadata) {
        public ProcessResult {
            metadata = metadata == null ? Map.of() : metadata;
        }
    }

    /**
     * Addresses the object by id, or by its URL when the id is unknown.
     */
    record DeleteRequest(String objectId, String url, boolean force) {
        public static DeleteRequest byId(String objectId, boolean force) {
            return new DeleteRequest(objectId, null, force);
        }
    }
}
