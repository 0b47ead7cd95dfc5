package ae.teletronics.ingest.domain.model;

import ae.teletronics.ingest.domain.FileCategory;
import ae.teletronics.ingest.domain.FilePrivacy;
import ae.teletronics.ingest.domain.FileStatus;
import ae.teletronics.ingest.domain.FileTypeCategory;
import ae.teletronics.ingest.domain.ProviderKind;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mongo document describing a durably stored asset.
 * The bytes live on a remote provider; this record tracks where and in which state.
 *
 * Uniqueness rules (scoped to the owner):
 *  - (ownerId + contentHash) is unique among READY files only
 */
@Document(collection = "files")
@CompoundIndexes({
        @CompoundIndex(name = "uniq_owner_hash_ready",
                def = "{'ownerId': 1, 'contentHash': 1}",
                unique = true,
                partialFilter = "{'status': 'READY'}"),
        @CompoundIndex(name = "idx_owner_status", def = "{'ownerId': 1, 'status': 1}")
})
public class StoredFile {

    @Id
    private String id;

    private String ownerId;

    /** Name as supplied by the client (preserved for display). */
    private String originalName;

    /** Collision-resistant name used as the remote object name. Stable across retries. */
    private String generatedFilename;

    private String mimeType;

    private FileTypeCategory typeCategory;

    private long sizeBytes;

    /** SHA-256 of the full content, lowercase hex. */
    private String contentHash;

    private ProviderKind primaryProvider;
    private String primaryObjectId;
    private String primaryUrl;

    private ProviderKind backupProvider;
    private String backupObjectId;
    private String backupUrl;

    private FileCategory category = FileCategory.CONTENT;

    private FilePrivacy privacy = FilePrivacy.PRIVATE;

    @Indexed(name = "idx_status")
    private FileStatus status = FileStatus.UPLOADING;

    private Map<String, Object> metadata = new HashMap<>();

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    private Instant deletedAt;

    public StoredFile() { }

    public StoredFile(String ownerId,
                      String originalName,
                      String generatedFilename,
                      String mimeType,
                      long sizeBytes,
                      String contentHash,
                      FileCategory category,
                      FilePrivacy privacy,
                      Map<String, Object> metadata) {
        this.ownerId = ownerId;
        this.originalName = originalName;
        this.generatedFilename = generatedFilename;
        this.mimeType = mimeType;
        this.typeCategory = FileTypeCategory.fromMimeType(mimeType);
        this.sizeBytes = sizeBytes;
        this.contentHash = contentHash;
        this.category = category == null ? FileCategory.CONTENT : category;
        this.privacy = privacy == null ? FilePrivacy.PRIVATE : privacy;
        this.status = FileStatus.UPLOADING;
        this.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
    }

    /* -------------------- State transitions -------------------- */

    public void markProcessing() {
        this.status = FileStatus.PROCESSING;
    }

    public void markReady(ProviderKind provider, String objectId, String url, Map<String, Object> providerMetadata) {
        this.primaryProvider = provider;
        this.primaryObjectId = objectId;
        this.primaryUrl = url;
        if (providerMetadata != null) {
            this.metadata.putAll(providerMetadata);
        }
        this.status = FileStatus.READY;
    }

    public void markFailed(String error, Instant at) {
        this.status = FileStatus.FAILED;
        this.metadata.put("error", error);
        this.metadata.put("failedAt", at.toString());
    }

    public void markDeleted(Instant at) {
        this.status = FileStatus.DELETED;
        this.deletedAt = at;
    }

    public boolean isDeleted() { return status == FileStatus.DELETED; }

    public boolean hasBackup() { return backupUrl != null; }

    /* -------------------- Getters & setters -------------------- */

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getOriginalName() { return originalName; }
    public void setOriginalName(String originalName) { this.originalName = originalName; }

    public String getGeneratedFilename() { return generatedFilename; }
    public void setGeneratedFilename(String generatedFilename) { this.generatedFilename = generatedFilename; }

    public String getMimeType() { return mimeType; }
    public void setMimeType(String mimeType) { this.mimeType = mimeType; }

    public FileTypeCategory getTypeCategory() { return typeCategory; }
    public void setTypeCategory(FileTypeCategory typeCategory) { this.typeCategory = typeCategory; }

    public long getSizeBytes() { return sizeBytes; }
    public void setSizeBytes(long sizeBytes) { this.sizeBytes = sizeBytes; }

    public String getContentHash() { return contentHash; }
    public void setContentHash(String contentHash) { this.contentHash = contentHash; }

    public ProviderKind getPrimaryProvider() { return primaryProvider; }
    public void setPrimaryProvider(ProviderKind primaryProvider) { this.primaryProvider = primaryProvider; }

    public String getPrimaryObjectId() { return primaryObjectId; }
    public void setPrimaryObjectId(String primaryObjectId) { this.primaryObjectId = primaryObjectId; }

    public String getPrimaryUrl() { return primaryUrl; }
    public void setPrimaryUrl(String primaryUrl) { this.primaryUrl = primaryUrl; }

    public ProviderKind getBackupProvider() { return backupProvider; }
    public void setBackupProvider(ProviderKind backupProvider) { this.backupProvider = backupProvider; }

    public String getBackupObjectId() { return backupObjectId; }
    public void setBackupObjectId(String backupObjectId) { this.backupObjectId = backupObjectId; }

    public String getBackupUrl() { return backupUrl; }
    public void setBackupUrl(String backupUrl) { this.backupUrl = backupUrl; }

    public FileCategory getCategory() { return category; }
    public void setCategory(FileCategory category) { this.category = category; }

    public FilePrivacy getPrivacy() { return privacy; }
    public void setPrivacy(FilePrivacy privacy) { this.privacy = privacy; }

    public FileStatus getStatus() { return status; }
    public void setStatus(FileStatus status) { this.status = status; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? new HashMap<>() : metadata;
    }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getDeletedAt() { return deletedAt; }
    public void setDeletedAt(Instant deletedAt) { this.deletedAt = deletedAt; }

    /* -------------------- Equality by id -------------------- */

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredFile)) return false;
        StoredFile that = (StoredFile) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() { return Objects.hash(id); }

    @Override
    public String toString() {
        return "StoredFile{" +
                "id='" + id + '\'' +
                ", ownerId='" + ownerId + '\'' +
                ", originalName='" + originalName + '\'' +
                ", typeCategory=" + typeCategory +
                ", sizeBytes=" + sizeBytes +
                ", status=" + status +
                ", primaryProvider=" + primaryProvider +
                '}';
    }
}
