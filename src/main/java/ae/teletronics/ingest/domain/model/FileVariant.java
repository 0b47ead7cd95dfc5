package ae.teletronics.ingest.domain.model;

import ae.teletronics.ingest.domain.VariantKind;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A derived rendition of a {@link StoredFile}. At most one per (fileId, variant).
 */
@Document(collection = "file_variants")
@CompoundIndexes({
        @CompoundIndex(name = "uniq_file_variant", def = "{'fileId': 1, 'variant': 1}", unique = true)
})
public class FileVariant {

    @Id
    private String id;

    private String fileId;

    private VariantKind variant;

    private String url;

    private Integer width;

    private Integer height;

    private long sizeBytes;

    private String format;

    private Integer quality;

    private Map<String, Object> metadata = new HashMap<>();

    @CreatedDate
    private Instant createdAt;

    public FileVariant() { }

    public FileVariant(String fileId, VariantKind variant) {
        this.fileId = fileId;
        this.variant = variant;
    }

    public String dimensions() {
        return (width != null && height != null) ? width + "x" + height : null;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getFileId() { return fileId; }
    public void setFileId(String fileId) { this.fileId = fileId; }

    public VariantKind getVariant() { return variant; }
    public void setVariant(VariantKind variant) { this.variant = variant; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public Integer getWidth() { return width; }
    public void setWidth(Integer width) { this.width = width; }

    public Integer getHeight() { return height; }
    public void setHeight(Integer height) { this.height = height; }

    public long getSizeBytes() { return sizeBytes; }
    public void setSizeBytes(long sizeBytes) { this.sizeBytes = sizeBytes; }

    public String getFormat() { return format; }
    public void setFormat(String format) { this.format = format; }

    public Integer getQuality() { return quality; }
    public void setQuality(Integer quality) { this.quality = quality; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? new HashMap<>() : metadata;
    }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileVariant)) return false;
        FileVariant that = (FileVariant) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() { return Objects.hash(id); }

    @Override
    public String toString() {
        return "FileVariant{" +
                "fileId='" + fileId + '\'' +
                ", variant=" + variant +
                ", url='" + url + '\'' +
                ", format='" + format + '\'' +
                '}';
    }
}
