package ae.teletronics.ingest.application.jobs;

import ae.teletronics.ingest.adapters.persistence.repo.StoredFileRepository;
import ae.teletronics.ingest.application.exceptions.NotFoundException;
import ae.teletronics.ingest.application.routing.ProviderRouter;
import ae.teletronics.ingest.domain.FileStatus;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.VariantKind;
import ae.teletronics.ingest.domain.model.QueuedJob;
import ae.teletronics.ingest.domain.model.StoredFile;
import ae.teletronics.ingest.ports.ClockProvider;
import ae.teletronics.ingest.ports.JobQueue;
import ae.teletronics.ingest.ports.StagingStoragePort;
import ae.teletronics.ingest.ports.StorageProvider;
import ae.teletronics.ingest.ports.StorageProvider.DeleteRequest;
import ae.teletronics.ingest.ports.StorageProvider.UploadRequest;
import ae.teletronics.ingest.ports.StorageProvider.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves staged bytes of a new file to its primary provider and schedules the follow-up work.
 */
@Component
public class AcceptJobHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(AcceptJobHandler.class);

    private final StoredFileRepository files;
    private final StagingStoragePort staging;
    private final ProviderRouter router;
    private final JobQueue queue;
    private final ClockProvider clock;

    public AcceptJobHandler(StoredFileRepository files,
                            StagingStoragePort staging,
                            ProviderRouter router,
                            JobQueue queue,
                            ClockProvider clock) {
        this.files = files;
        this.staging = staging;
        this.router = router;
        this.queue = queue;
        this.clock = clock;
    }

    @Override
    public JobKind kind() {
        return JobKind.ACCEPT_UPLOAD;
    }

    @Override
    public void handle(QueuedJob job) throws Exception {
        String fileId = job.payloadValue(JobPayloads.FILE_ID);
        String stagingKey = job.payloadValue(JobPayloads.STAGING_KEY);
        List<VariantKind> variants = JobPayloads.decodeVariants(job.payloadValue(JobPayloads.VARIANTS));

        StoredFile file = files.findById(fileId)
                .orElseThrow(() -> new NotFoundException("File not found: " + fileId));

        if (file.isDeleted()) {
            log.info("File {} was deleted before it was stored, skipping", fileId);
            return;
        }
        if (file.getStatus() == FileStatus.READY) {
            // redelivery after a crash between the final save and the ack
            log.info("File {} already stored, re-issuing follow-up jobs", fileId);
            scheduleFollowUps(file, stagingKey, variants);
            return;
        }

        StorageProvider provider;
        UploadResult result;
        try {
            byte[] bytes = staging.read(stagingKey);
            provider = router.choose(file.getTypeCategory());
            provider.ensureAcceptable(file.getTypeCategory(), file.getSizeBytes());

            file.markProcessing();
            file = files.save(file);

            result = provider.upload(new UploadRequest(
                    bytes,
                    file.getGeneratedFilename(),
                    file.getMimeType(),
                    file.getSizeBytes(),
                    file.getPrivacy().isPublic(),
                    null,
                    file.getMetadata()));
        } catch (Exception e) {
            markFailed(file, e);
            throw e;
        }

        Map<String, Object> providerMetadata = new HashMap<>(result.metadata());
        providerMetadata.put("processedAt", clock.now().toString());
        file.markReady(provider.kind(), result.objectId(), result.url(), providerMetadata);

        try {
            file = files.save(file);
        } catch (DuplicateKeyException dke) {
            resolveDuplicate(file, provider, result, stagingKey);
            return;
        }

        log.info("File {} stored on {} as {}", fileId, provider.kind().wireName(), result.objectId());
        scheduleFollowUps(file, stagingKey, variants);
    }

    private void scheduleFollowUps(StoredFile file, String stagingKey, List<VariantKind> variants) {
        if (!variants.isEmpty()) {
            queue.enqueue(JobKind.GENERATE_VARIANTS, Map.of(
                    JobPayloads.FILE_ID, file.getId(),
                    JobPayloads.VARIANTS, JobPayloads.encodeVariants(variants)
            ), JobKind.GENERATE_VARIANTS.defaultPriority());
        }
        if (router.needsBackup(file)) {
            queue.enqueue(JobKind.REPLICATE_BACKUP, Map.of(
                    JobPayloads.FILE_ID, file.getId(),
                    JobPayloads.STAGING_KEY, stagingKey
            ), JobKind.REPLICATE_BACKUP.defaultPriority());
        } else {
            dropStaged(stagingKey);
        }
    }

    /**
     * A twin with the same owner and content became READY first: this copy is retired and
     * its remote object removed.
     */
    private void resolveDuplicate(StoredFile file, StorageProvider provider, UploadResult result, String stagingKey) {
        Instant now = clock.now();
        String twinId = files.findFirstByOwnerIdAndContentHashAndStatus(
                        file.getOwnerId(), file.getContentHash(), FileStatus.READY)
                .map(StoredFile::getId)
                .orElse(null);
        log.info("File {} duplicates ready file {}, retiring it", file.getId(), twinId);

        file.getMetadata().put("duplicateOf", twinId);
        file.markDeleted(now);
        files.save(file);

        provider.delete(DeleteRequest.byId(result.objectId(), true));
        dropStaged(stagingKey);
    }

    private void markFailed(StoredFile file, Exception cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            file.markFailed(reason, clock.now());
            files.save(file);
        } catch (RuntimeException e) {
            log.error("Could not mark file {} as failed", file.getId(), e);
        }
        log.warn("Storing file {} failed: {}", file.getId(), reason);
    }

    private void dropStaged(String stagingKey) {
        if (stagingKey == null) return;
        try {
            staging.delete(stagingKey);
        } catch (IOException e) {
            log.warn("Could not delete staged bytes {}: {}", stagingKey, e.getMessage());
        }
    }
}
