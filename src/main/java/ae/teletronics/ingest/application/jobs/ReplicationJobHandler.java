package ae.teletronics.ingest.application.jobs;

import ae.teletronics.ingest.adapters.persistence.repo.StoredFileRepository;
import ae.teletronics.ingest.application.routing.ProviderRouter;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.ProviderKind;
import ae.teletronics.ingest.domain.model.QueuedJob;
import ae.teletronics.ingest.domain.model.StoredFile;
import ae.teletronics.ingest.ports.ClockProvider;
import ae.teletronics.ingest.ports.StagingStoragePort;
import ae.teletronics.ingest.ports.StorageProvider.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Copies the staged bytes of a file to the backup store, then drops the staged copy
 * whether or not the backup succeeded.
 */
@Component
public class ReplicationJobHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(ReplicationJobHandler.class);

    private final StoredFileRepository files;
    private final StagingStoragePort staging;
    private final ProviderRouter router;
    private final ClockProvider clock;

    public ReplicationJobHandler(StoredFileRepository files,
                                 StagingStoragePort staging,
                                 ProviderRouter router,
                                 ClockProvider clock) {
        this.files = files;
        this.staging = staging;
        this.router = router;
        this.clock = clock;
    }

    @Override
    public JobKind kind() {
        return JobKind.REPLICATE_BACKUP;
    }

    @Override
    public void handle(QueuedJob job) throws IOException {
        String fileId = job.payloadValue(JobPayloads.FILE_ID);
        String stagingKey = job.payloadValue(JobPayloads.STAGING_KEY);

        Optional<StoredFile> found = files.findById(fileId).filter(f -> !f.isDeleted());
        if (found.isEmpty()) {
            log.info("File {} is gone, dropping staged bytes without backup", fileId);
            staging.delete(stagingKey);
            return;
        }
        StoredFile file = found.get();

        byte[] bytes = staging.read(stagingKey);
        try {
            Optional<UploadResult> backup = router.replicate(file, bytes);
            backup.ifPresent(r -> files.recordBackup(
                    fileId, ProviderKind.OBJECT_STORE, r.objectId(), r.url(), clock.now()));
        } finally {
            staging.delete(stagingKey);
        }
    }
}
