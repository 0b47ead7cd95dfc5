package ae.teletronics.ingest.application.routing;

import ae.teletronics.ingest.domain.FileTypeCategory;
import ae.teletronics.ingest.domain.ProviderKind;
import ae.teletronics.ingest.domain.model.StoredFile;
import ae.teletronics.ingest.ports.StorageProvider;
import ae.teletronics.ingest.ports.StorageProvider.UploadRequest;
import ae.teletronics.ingest.ports.StorageProvider.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the primary backend for a file and pushes backup copies to the object store.
 */
@Component
public class ProviderRouter {

    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);

    static final String BACKUP_FOLDER = "backups";
    static final String BACKUP_PREFIX = "backup_";

    private final Map<ProviderKind, StorageProvider> providers = new EnumMap<>(ProviderKind.class);

    public ProviderRouter(List<StorageProvider> providers) {
        for (StorageProvider p : providers) {
            StorageProvider previous = this.providers.put(p.kind(), p);
            if (previous != null) {
                throw new IllegalStateException("Two storage providers registered for " + p.kind());
            }
        }
    }

    public StorageProvider choose(FileTypeCategory type) {
        return provider(ProviderKind.forType(type));
    }

    public StorageProvider provider(ProviderKind kind) {
        StorageProvider p = providers.get(kind);
        if (p == null) {
            throw new IllegalStateException("No storage provider configured for " + kind);
        }
        return p;
    }

    public boolean needsBackup(StoredFile file) {
        return file.getPrimaryProvider() != null && file.getPrimaryProvider() != ProviderKind.OBJECT_STORE;
    }

    /**
     * Uploads a private copy to the object store. Never throws: a failed backup is logged
     * and reported as empty.
     */
    public Optional<UploadResult> replicate(StoredFile file, byte[] bytes) {
        if (!needsBackup(file)) {
            return Optional.empty();
        }
        try {
            StorageProvider backup = provider(ProviderKind.OBJECT_STORE);
            Map<String, Object> metadata = new HashMap<>(file.getMetadata());
            metadata.put("isBackup", true);
            metadata.put("fileId", file.getId());

            UploadResult result = backup.upload(new UploadRequest(
                    bytes,
                    BACKUP_PREFIX + file.getGeneratedFilename(),
                    file.getMimeType(),
                    bytes.length,
                    false,
                    BACKUP_FOLDER,
                    metadata));
            log.info("Backup stored for file {} at {}", file.getId(), result.objectId());
            return Optional.of(result);
        } catch (Exception e) {
            log.warn("Backup replication failed for file {}: {}", file.getId(), e.getMessage(), e);
            return Optional.empty();
        }
    }
}
