package ae.teletronics.ingest.application.jobs;

import ae.teletronics.ingest.adapters.persistence.repo.FileVariantRepository;
import ae.teletronics.ingest.adapters.persistence.repo.StoredFileRepository;
import ae.teletronics.ingest.application.routing.ProviderRouter;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.ProviderKind;
import ae.teletronics.ingest.domain.model.QueuedJob;
import ae.teletronics.ingest.domain.model.StoredFile;
import ae.teletronics.ingest.ports.StagingStoragePort;
import ae.teletronics.ingest.ports.StorageProvider.DeleteRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Removes everything a deleted file left behind: remote objects, variant rows and staged bytes.
 * Remote deletes are forced, so a missing object does not fail the job.
 */
@Component
public class CleanupJobHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(CleanupJobHandler.class);

    private final StoredFileRepository files;
    private final FileVariantRepository variants;
    private final StagingStoragePort staging;
    private final ProviderRouter router;

    public CleanupJobHandler(StoredFileRepository files,
                             FileVariantRepository variants,
                             StagingStoragePort staging,
                             ProviderRouter router) {
        this.files = files;
        this.variants = variants;
        this.staging = staging;
        this.router = router;
    }

    @Override
    public JobKind kind() {
        return JobKind.CLEANUP;
    }

    @Override
    public void handle(QueuedJob job) throws IOException {
        String fileId = job.payloadValue(JobPayloads.FILE_ID);
        Optional<StoredFile> found = files.findById(fileId);
        if (found.isEmpty()) {
            log.info("File {} no longer exists, nothing to clean up", fileId);
            variants.deleteByFileId(fileId);
            return;
        }
        StoredFile file = found.get();

        deleteRemote(file.getPrimaryProvider(), file.getPrimaryObjectId());
        deleteRemote(file.getBackupProvider(), file.getBackupObjectId());
        long removed = variants.deleteByFileId(fileId);
        staging.delete(JobPayloads.stagingKey(file));

        log.info("Cleaned up file {} ({} variant(s))", fileId, removed);
    }

    private void deleteRemote(ProviderKind kind, String objectId) {
        if (kind == null || objectId == null) return;
        router.provider(kind).delete(DeleteRequest.byId(objectId, true));
    }
}
