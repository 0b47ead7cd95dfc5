package ae.teletronics.ingest.domain.model;

import ae.teletronics.ingest.domain.UploadSessionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * One in-flight chunked upload.
 *
 * Chunk {@code i} covers bytes {@code [i * chunkSize, min((i + 1) * chunkSize, totalSize))} of the
 * pre-allocated temp file. {@code uploadedChunks} is kept sorted so that the stored document reads
 * naturally and {@link #missingChunks()} is cheap.
 */
@Document(collection = "upload_sessions")
@CompoundIndexes({
        @CompoundIndex(name = "idx_status_expiresAt", def = "{'status': 1, 'expiresAt': 1}")
})
public class UploadSession {

    @Id
    private String id;

    @Indexed(name = "idx_owner")
    private String ownerId;

    private String filename;

    private String mimeType;

    private long totalSize;

    private int chunkSize;

    private int totalChunks;

    private Set<Integer> uploadedChunks = new TreeSet<>();

    private long uploadedSize;

    private UploadSessionStatus status = UploadSessionStatus.ACTIVE;

    /** Absolute path of the pre-sized temp file holding the partial content. */
    private String tempStoragePath;

    private Map<String, Object> metadata = new HashMap<>();

    private Instant expiresAt;

    private Instant createdAt;

    private Instant updatedAt;

    public UploadSession() { }

    public UploadSession(String ownerId,
                         String filename,
                         String mimeType,
                         long totalSize,
                         int chunkSize,
                         String tempStoragePath,
                         Map<String, Object> metadata,
                         Instant createdAt,
                         Instant expiresAt) {
        this.ownerId = ownerId;
        this.filename = filename;
        this.mimeType = mimeType;
        this.totalSize = totalSize;
        this.chunkSize = chunkSize;
        this.totalChunks = computeTotalChunks(totalSize, chunkSize);
        this.tempStoragePath = tempStoragePath;
        this.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.expiresAt = expiresAt;
    }

    /* -------------------- Chunk arithmetic -------------------- */

    public static int computeTotalChunks(long totalSize, int chunkSize) {
        if (totalSize <= 0 || chunkSize <= 0) {
            throw new IllegalArgumentException("totalSize and chunkSize must be > 0");
        }
        long chunks = (totalSize + chunkSize - 1) / chunkSize;
        if (chunks > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many chunks: " + chunks);
        }
        return (int) chunks;
    }

    /**
     * Exact payload length required for the given chunk. The last chunk carries the remainder,
     * or a full chunk when totalSize is an exact multiple of chunkSize.
     */
    public long expectedChunkLength(int chunkIndex) {
        if (chunkIndex != totalChunks - 1) {
            return chunkSize;
        }
        long remainder = totalSize % chunkSize;
        return remainder == 0 ? chunkSize : remainder;
    }

    public long offsetOf(int chunkIndex) {
        return (long) chunkIndex * chunkSize;
    }

    public boolean isValidChunkIndex(int chunkIndex) {
        return chunkIndex >= 0 && chunkIndex < totalChunks;
    }

    public boolean hasChunk(int chunkIndex) {
        return uploadedChunks.contains(chunkIndex);
    }

    public boolean isFullyUploaded() {
        return uploadedChunks.size() == totalChunks;
    }

    public List<Integer> missingChunks() {
        List<Integer> missing = new ArrayList<>(totalChunks - uploadedChunks.size());
        for (int i = 0; i < totalChunks; i++) {
            if (!uploadedChunks.contains(i)) missing.add(i);
        }
        return missing;
    }

    public int progressPercentage() {
        if (totalSize == 0) return 0;
        return (int) Math.round(uploadedSize * 100.0 / totalSize);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /* -------------------- Getters & setters -------------------- */

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }

    public String getMimeType() { return mimeType; }
    public void setMimeType(String mimeType) { this.mimeType = mimeType; }

    public long getTotalSize() { return totalSize; }
    public void setTotalSize(long totalSize) { this.totalSize = totalSize; }

    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }

    public int getTotalChunks() { return totalChunks; }
    public void setTotalChunks(int totalChunks) { this.totalChunks = totalChunks; }

    public Set<Integer> getUploadedChunks() { return Collections.unmodifiableSet(uploadedChunks); }
    public void setUploadedChunks(Set<Integer> uploadedChunks) {
        this.uploadedChunks = uploadedChunks == null ? new TreeSet<>() : new TreeSet<>(uploadedChunks);
    }

    public long getUploadedSize() { return uploadedSize; }
    public void setUploadedSize(long uploadedSize) { this.uploadedSize = uploadedSize; }

    public UploadSessionStatus getStatus() { return status; }
    public void setStatus(UploadSessionStatus status) { this.status = status; }

    public String getTempStoragePath() { return tempStoragePath; }
    public void setTempStoragePath(String tempStoragePath) { this.tempStoragePath = tempStoragePath; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    /* -------------------- Equality by id -------------------- */

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UploadSession)) return false;
        UploadSession that = (UploadSession) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() { return Objects.hash(id); }

    @Override
    public String toString() {
        return "UploadSession{" +
                "id='" + id + '\'' +
                ", ownerId='" + ownerId + '\'' +
                ", filename='" + filename + '\'' +
                ", totalSize=" + totalSize +
                ", chunks=" + uploadedChunks.size() + "/" + totalChunks +
                ", status=" + status +
                '}';
    }
}
