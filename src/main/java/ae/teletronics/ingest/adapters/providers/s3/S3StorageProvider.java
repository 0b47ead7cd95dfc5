package ae.teletronics.ingest.adapters.providers.s3;

import ae.teletronics.ingest.application.exceptions.ErrorKind;
import ae.teletronics.ingest.application.exceptions.ProviderException;
import ae.teletronics.ingest.application.util.FilenameGenerator;
import ae.teletronics.ingest.domain.FileTypeCategory;
import ae.teletronics.ingest.domain.ProviderKind;
import ae.teletronics.ingest.domain.TransformOptions;
import ae.teletronics.ingest.ports.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.ServerSideEncryption;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.net.URI;
import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Amazon S3 (or any S3-compatible store) as the general object store and backup target.
 * The object id is the S3 key.
 */
public class S3StorageProvider implements StorageProvider {

    private static final Logger log = LoggerFactory.getLogger(S3StorageProvider.class);

    static final long MAX_FILE_SIZE = 5L * 1024 * 1024 * 1024;
    static final String DEFAULT_FOLDER = "files";
    static final long PRIVATE_URL_TTL_SECONDS = 3600;

    private final S3Client s3;
    private final S3Presigner presigner;
    private final Settings settings;

    public S3StorageProvider(S3Client s3, S3Presigner presigner, Settings settings) {
        this.s3 = s3;
        this.presigner = presigner;
        this.settings = settings;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.OBJECT_STORE;
    }

    @Override
    public Set<FileTypeCategory> supportedTypes() {
        return EnumSet.allOf(FileTypeCategory.class);
    }

    @Override
    public long maxFileSize() {
        return MAX_FILE_SIZE;
    }

    @Override
    public UploadResult upload(UploadRequest request) {
        String folder = StringUtils.hasText(request.folder()) ? request.folder() : DEFAULT_FOLDER;
        String key = folder + "/" + request.filename();

        PutObjectRequest put = PutObjectRequest.builder()
                .bucket(settings.bucket())
                .key(key)
                .contentType(request.mimeType())
                .contentLength((long) request.bytes().length)
                .metadata(toUserMetadata(request.metadata()))
                .acl(request.isPublic() ? ObjectCannedACL.PUBLIC_READ : ObjectCannedACL.PRIVATE)
                .serverSideEncryption(ServerSideEncryption.AES256)
                .overrideConfiguration(c -> c.apiCallTimeout(settings.timeout()))
                .build();
        try {
            s3.putObject(put, RequestBody.fromBytes(request.bytes()));
        } catch (SdkException e) {
            throw new ProviderException(kind(), "S3 upload of " + key + " failed: " + e.getMessage(), e);
        }

        String url = request.isPublic() ? publicUrl(key) : generateSignedUrl(key, PRIVATE_URL_TTL_SECONDS);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("bucket", settings.bucket());
        metadata.put("key", key);
        metadata.put("region", settings.region());
        metadata.put("isPublic", request.isPublic());

        log.info("Uploaded {} to s3://{}/{}", request.filename(), settings.bucket(), key);
        return new UploadResult(url, key, request.bytes().length, FilenameGenerator.extension(request.filename()), metadata);
    }

    /**
     * S3 has no native transformations; the original URL comes back unchanged.
     */
    @Override
    public ProcessResult process(String existingUrl, TransformOptions options) {
        String key = extractKey(existingUrl);
        if (key == null) {
            throw new ProviderException(kind(), ErrorKind.INVALID_ARGUMENT, "Not an S3 object URL: " + existingUrl);
        }
        HeadObjectResponse head = head(key);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("originalUrl", existingUrl);
        metadata.put("processedBy", "none");
        return new ProcessResult(existingUrl, null, null,
                head.contentLength() == null ? 0L : head.contentLength(),
                FilenameGenerator.extension(key), metadata);
    }

    @Override
    public boolean delete(DeleteRequest request) {
        String key = StringUtils.hasText(request.objectId()) ? request.objectId() : extractKey(request.url());
        try {
            if (key == null) {
                throw new ProviderException(kind(), ErrorKind.INVALID_ARGUMENT,
                        "Key or a valid S3 URL is required for deletion");
            }
            s3.deleteObject(DeleteObjectRequest.builder()
                    .bucket(settings.bucket())
                    .key(key)
                    .overrideConfiguration(c -> c.apiCallTimeout(settings.timeout()))
                    .build());
            log.info("Deleted s3://{}/{}", settings.bucket(), key);
            return true;
        } catch (SdkException | ProviderException e) {
            if (request.force()) {
                log.warn("Ignoring S3 delete failure for {}: {}", key, e.getMessage());
                return true;
            }
            if (e instanceof ProviderException pe) {
                throw pe;
            }
            throw new ProviderException(kind(), "S3 delete of " + key + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> getInfo(String objectId) {
        HeadObjectResponse head = head(objectId);
        Map<String, Object> info = new HashMap<>();
        info.put("key", objectId);
        info.put("contentLength", head.contentLength());
        info.put("contentType", head.contentType());
        info.put("eTag", head.eTag());
        info.put("lastModified", head.lastModified() == null ? null : head.lastModified().toString());
        info.put("serverSideEncryption", head.serverSideEncryptionAsString());
        info.put("metadata", head.metadata());
        return info;
    }

    @Override
    public String generateSignedUrl(String objectId, long ttlSeconds) {
        try {
            GetObjectPresignRequest presign = GetObjectPresignRequest.builder()
                    .signatureDuration(Duration.ofSeconds(ttlSeconds))
                    .getObjectRequest(GetObjectRequest.builder().bucket(settings.bucket()).key(objectId).build())
                    .build();
            return presigner.presignGetObject(presign).url().toString();
        } catch (SdkException e) {
            throw new ProviderException(kind(), "Could not presign " + objectId + ": " + e.getMessage(), e);
        }
    }

    /* helpers */

    private HeadObjectResponse head(String key) {
        try {
            return s3.headObject(HeadObjectRequest.builder()
                    .bucket(settings.bucket())
                    .key(key)
                    .overrideConfiguration(c -> c.apiCallTimeout(settings.timeout()))
                    .build());
        } catch (SdkException e) {
            throw new ProviderException(kind(), "S3 head of " + key + " failed: " + e.getMessage(), e);
        }
    }

    String publicUrl(String key) {
        if (StringUtils.hasText(settings.cdnDomain())) {
            return "https://" + settings.cdnDomain() + "/" + key;
        }
        return "https://" + settings.bucket() + ".s3." + settings.region() + ".amazonaws.com/" + key;
    }

    /**
     * Accepts CDN, virtual-hosted ({@code bucket.s3.region.amazonaws.com/key}) and path-style
     * ({@code s3.region.amazonaws.com/bucket/key}) URLs. Query strings of presigned URLs are ignored.
     */
    String extractKey(String url) {
        if (!StringUtils.hasText(url)) return null;
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return null;
        }
        String host = uri.getHost();
        String path = uri.getPath();
        if (host == null || path == null || path.length() <= 1) return null;
        path = path.substring(1);

        if (host.equalsIgnoreCase(settings.cdnDomain())) {
            return path;
        }
        if (host.startsWith(settings.bucket() + ".s3")) {
            return path;
        }
        if (host.startsWith("s3.") || host.startsWith("s3-") || host.equals("s3.amazonaws.com")) {
            String bucketPrefix = settings.bucket() + "/";
            return path.startsWith(bucketPrefix) ? path.substring(bucketPrefix.length()) : null;
        }
        return null;
    }

    /**
     * User metadata keys are lower-cased and reduced to {@code [a-z0-9-]}; nested values are skipped.
     */
    static Map<String, String> toUserMetadata(Map<String, Object> metadata) {
        Map<String, String> out = new LinkedHashMap<>();
        metadata.forEach((k, v) -> {
            if (v == null || v instanceof Map || v instanceof Iterable) return;
            out.put(k.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-"), String.valueOf(v));
        });
        return out;
    }

    public record Settings(String bucket, String region, String cdnDomain, Duration timeout) {}
}
