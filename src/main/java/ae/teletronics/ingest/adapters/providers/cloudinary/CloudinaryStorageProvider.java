package ae.teletronics.ingest.adapters.providers.cloudinary;

import ae.teletronics.ingest.application.exceptions.ErrorKind;
import ae.teletronics.ingest.application.exceptions.ProviderException;
import ae.teletronics.ingest.application.util.FilenameGenerator;
import ae.teletronics.ingest.application.util.Hashing;
import ae.teletronics.ingest.domain.FileTypeCategory;
import ae.teletronics.ingest.domain.ProviderKind;
import ae.teletronics.ingest.domain.TransformOptions;
import ae.teletronics.ingest.ports.ClockProvider;
import ae.teletronics.ingest.ports.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cloudinary over its REST upload and admin APIs.
 *
 * Objects are addressed as {@code resourceType/deliveryType/publicId}, e.g.
 * {@code image/upload/ingest/photo_1700000000000_ab12cd}. Requests are signed with
 * SHA-1 over the sorted parameters followed by the API secret.
 */
public class CloudinaryStorageProvider implements StorageProvider {

    private static final Logger log = LoggerFactory.getLogger(CloudinaryStorageProvider.class);

    static final long MAX_FILE_SIZE = 100L * 1024 * 1024;

    private static final Set<FileTypeCategory> SUPPORTED = EnumSet.of(FileTypeCategory.IMAGE, FileTypeCategory.VIDEO);

    // https://res.cloudinary.com/<cloud>/<resourceType>/<type>/[v<version>/]<publicId>[.<ext>]
    private static final Pattern DELIVERY_URL = Pattern.compile(
            "^(https?://[^/]+/[^/]+/)(image|video|raw)/([a-z_]+)/(?:v(\\d+)/)?(.+?)(?:\\.([A-Za-z0-9]+))?$");

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP = new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final ClockProvider clock;
    private final Settings settings;

    public CloudinaryStorageProvider(WebClient webClient, ClockProvider clock, Settings settings) {
        this.webClient = webClient;
        this.clock = clock;
        this.settings = settings;
        if (!settings.isConfigured()) {
            log.warn("Cloudinary credentials not configured, uploads will fail");
        }
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.TRANSFORM;
    }

    @Override
    public Set<FileTypeCategory> supportedTypes() {
        return SUPPORTED;
    }

    @Override
    public long maxFileSize() {
        return MAX_FILE_SIZE;
    }

    @Override
    public UploadResult upload(UploadRequest request) {
        String resourceType = resourceTypeOf(request.mimeType());
        String deliveryType = request.isPublic() ? "upload" : "private";
        String folder = StringUtils.hasText(request.folder()) ? request.folder() : settings.folder();
        String publicId = FilenameGenerator.stripExtension(request.filename());

        Map<String, String> params = new TreeMap<>();
        params.put("public_id", publicId);
        params.put("folder", folder);
        params.put("overwrite", "true");
        params.put("type", deliveryType);
        params.put("access_mode", request.isPublic() ? "public" : "authenticated");
        params.put("timestamp", timestamp());
        String context = context(request.metadata());
        if (!context.isEmpty()) {
            params.put("context", context);
        }

        MultiValueMap<String, String> form = signedForm(params);
        form.add("file", "data:" + request.mimeType() + ";base64," + Base64.getEncoder().encodeToString(request.bytes()));

        Map<String, Object> body = call("upload", () -> webClient.post()
                .uri(settings.apiBaseUrl() + "/v1_1/{cloud}/{resourceType}/upload", settings.cloudName(), resourceType)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(JSON_MAP)
                .timeout(settings.timeout())
                .block());

        String storedId = String.valueOf(body.get("public_id"));
        String objectId = resourceType + "/" + deliveryType + "/" + storedId;

        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, "width", body.get("width"));
        putIfPresent(metadata, "height", body.get("height"));
        putIfPresent(metadata, "resourceType", body.get("resource_type"));
        putIfPresent(metadata, "createdAt", body.get("created_at"));
        putIfPresent(metadata, "version", body.get("version"));

        log.info("Uploaded {} to Cloudinary as {}", request.filename(), objectId);
        return new UploadResult(
                String.valueOf(body.get("secure_url")),
                objectId,
                asLong(body.get("bytes"), request.size()),
                body.get("format") == null ? null : String.valueOf(body.get("format")),
                metadata);
    }

    /**
     * Builds a transformation URL from an existing delivery URL. The asset is looked up once
     * so the result carries the original size and dimensions where the transform keeps them.
     */
    @Override
    public ProcessResult process(String existingUrl, TransformOptions options) {
        Matcher m = parseDeliveryUrl(existingUrl);
        String objectId = m.group(2) + "/" + m.group(3) + "/" + m.group(5);
        String transformation = transformation(options);

        Map<String, Object> info = getInfo(objectId);
        String ext = m.group(6);
        String format = options.format() != null ? options.format()
                : info.get("format") != null ? String.valueOf(info.get("format")) : ext;

        String url = existingUrl;
        if (!transformation.isEmpty()) {
            StringBuilder sb = new StringBuilder(m.group(1))
                    .append(m.group(2)).append('/').append(m.group(3)).append('/')
                    .append(transformation).append('/');
            if (m.group(4) != null) {
                sb.append('v').append(m.group(4)).append('/');
            }
            sb.append(m.group(5));
            if (format != null) {
                sb.append('.').append(format);
            }
            url = sb.toString();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("transformation", transformation);
        metadata.put("processedBy", ProviderKind.TRANSFORM.wireName());
        return new ProcessResult(
                url,
                options.width() != null ? options.width() : asInteger(info.get("width")),
                options.height() != null ? options.height() : asInteger(info.get("height")),
                asLong(info.get("bytes"), 0L),
                format,
                metadata);
    }

    @Override
    public boolean delete(DeleteRequest request) {
        try {
            String objectId = request.objectId();
            if (!StringUtils.hasText(objectId) && StringUtils.hasText(request.url())) {
                Matcher m = parseDeliveryUrl(request.url());
                objectId = m.group(2) + "/" + m.group(3) + "/" + m.group(5);
            }
            if (!StringUtils.hasText(objectId)) {
                throw new ProviderException(kind(), ErrorKind.INVALID_ARGUMENT,
                        "Object id or a Cloudinary URL is required for deletion");
            }
            String[] parts = splitObjectId(objectId);

            Map<String, String> params = new TreeMap<>();
            params.put("public_id", parts[2]);
            params.put("type", parts[1]);
            params.put("invalidate", "true");
            params.put("timestamp", timestamp());
            MultiValueMap<String, String> form = signedForm(params);

            Map<String, Object> body = call("destroy", () -> webClient.post()
                    .uri(settings.apiBaseUrl() + "/v1_1/{cloud}/{resourceType}/destroy", settings.cloudName(), parts[0])
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .bodyToMono(JSON_MAP)
                    .timeout(settings.timeout())
                    .block());

            if ("ok".equals(body.get("result"))) {
                log.info("Deleted {} from Cloudinary", objectId);
                return true;
            }
            log.warn("Cloudinary did not delete {}: {}", objectId, body.get("result"));
            return request.force();
        } catch (RuntimeException e) {
            if (request.force()) {
                log.warn("Ignoring Cloudinary delete failure for {}: {}", request.objectId(), e.getMessage());
                return true;
            }
            throw e;
        }
    }

    @Override
    public Map<String, Object> getInfo(String objectId) {
        String[] parts = splitObjectId(objectId);
        // public ids contain folder slashes that must stay unencoded
        URI uri = UriComponentsBuilder.fromHttpUrl(settings.apiBaseUrl())
                .pathSegment("v1_1", settings.cloudName(), "resources", parts[0], parts[1])
                .path("/" + parts[2])
                .encode()
                .build()
                .toUri();
        Map<String, Object> body = call("resource lookup", () -> webClient.get()
                .uri(uri)
                .headers(h -> h.setBasicAuth(settings.apiKey(), settings.apiSecret()))
                .retrieve()
                .bodyToMono(JSON_MAP)
                .timeout(settings.timeout())
                .block());
        return new HashMap<>(body);
    }

    /**
     * Time-limited download URL through the private download API.
     */
    @Override
    public String generateSignedUrl(String objectId, long ttlSeconds) {
        String[] parts = splitObjectId(objectId);
        long now = clock.now().getEpochSecond();

        Map<String, String> params = new TreeMap<>();
        params.put("public_id", parts[2]);
        params.put("type", parts[1]);
        params.put("expires_at", String.valueOf(now + ttlSeconds));
        params.put("timestamp", String.valueOf(now));

        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(settings.apiBaseUrl())
                .path("/v1_1/{cloud}/{resourceType}/download");
        signedForm(params).forEach((k, values) -> values.forEach(v -> uri.queryParam(k, v)));
        return uri.encode().buildAndExpand(settings.cloudName(), parts[0]).toUriString();
    }

    /* signing */

    MultiValueMap<String, String> signedForm(Map<String, String> params) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        params.forEach(form::add);
        form.add("api_key", settings.apiKey());
        form.add("signature", sign(params, settings.apiSecret()));
        return form;
    }

    static String sign(Map<String, String> params, String secret) {
        StringBuilder toSign = new StringBuilder();
        new TreeMap<>(params).forEach((k, v) -> {
            if (v == null || v.isEmpty()) return;
            if (toSign.length() > 0) toSign.append('&');
            toSign.append(k).append('=').append(v);
        });
        return Hashing.sha1Hex(toSign.append(secret).toString());
    }

    static String transformation(TransformOptions options) {
        List<String> parts = new ArrayList<>();
        if (options.width() != null) parts.add("w_" + options.width());
        if (options.height() != null) parts.add("h_" + options.height());
        if (options.width() != null || options.height() != null) {
            parts.add("c_" + (options.crop() != null ? options.crop() : "fill"));
        }
        if (options.quality() != null) parts.add("q_" + options.quality());
        if (options.format() != null) parts.add("f_" + options.format());
        if (options.progressive()) parts.add("fl_progressive");
        return String.join(",", parts);
    }

    /* helpers */

    private <T> T call(String operation, RemoteCall<T> remote) {
        try {
            T result = remote.run();
            if (result == null) {
                throw new ProviderException(kind(), "Cloudinary " + operation + " returned no body", null);
            }
            return result;
        } catch (ProviderException e) {
            throw e;
        } catch (WebClientResponseException e) {
            throw new ProviderException(kind(), "Cloudinary " + operation + " failed with HTTP "
                    + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new ProviderException(kind(), "Cloudinary " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private Matcher parseDeliveryUrl(String url) {
        Matcher m = url == null ? null : DELIVERY_URL.matcher(url);
        if (m == null || !m.matches()) {
            throw new ProviderException(kind(), ErrorKind.INVALID_ARGUMENT, "Not a Cloudinary delivery URL: " + url);
        }
        return m;
    }

    private String[] splitObjectId(String objectId) {
        String[] parts = objectId == null ? new String[0] : objectId.split("/", 3);
        if (parts.length != 3) {
            throw new ProviderException(kind(), ErrorKind.INVALID_ARGUMENT, "Malformed Cloudinary object id: " + objectId);
        }
        return parts;
    }

    private String timestamp() {
        return String.valueOf(clock.now().getEpochSecond());
    }

    static String resourceTypeOf(String mimeType) {
        return mimeType != null && mimeType.startsWith("video/") ? "video" : "image";
    }

    private static String context(Map<String, Object> metadata) {
        StringBuilder sb = new StringBuilder();
        metadata.forEach((k, v) -> {
            if (v == null || v instanceof Map || v instanceof Iterable) return;
            if (sb.length() > 0) sb.append('|');
            sb.append(k).append('=').append(String.valueOf(v).replace("|", "\\|").replace("=", "\\="));
        });
        return sb.toString();
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) target.put(key, value);
    }

    private static long asLong(Object value, long fallback) {
        return value instanceof Number n ? n.longValue() : fallback;
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number n ? n.intValue() : null;
    }

    @FunctionalInterface
    private interface RemoteCall<T> {
        T run();
    }

    public record Settings(String cloudName,
                           String apiKey,
                           String apiSecret,
                           String folder,
                           String apiBaseUrl,
                           Duration timeout) {

        public boolean isConfigured() {
            return StringUtils.hasText(cloudName) && StringUtils.hasText(apiKey) && StringUtils.hasText(apiSecret);
        }
    }
}
