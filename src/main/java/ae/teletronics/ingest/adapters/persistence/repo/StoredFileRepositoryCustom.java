package ae.teletronics.ingest.adapters.persistence.repo;

import ae.teletronics.ingest.domain.ProviderKind;

import java.time.Instant;

/**
 * Targeted updates that must not overwrite concurrent changes to other fields.
 */
public interface StoredFileRepositoryCustom {

    /**
     * Sets the backup location unless the file has been deleted meanwhile.
     *
     * @return true if a document was updated
     */
    boolean recordBackup(String fileId, ProviderKind provider, String objectId, String url, Instant now);

    /**
     * Soft delete; false when the file is missing or already deleted.
     */
    boolean markDeleted(String fileId, Instant now);
}
