package ae.teletronics.ingest.application;

import ae.teletronics.ingest.adapters.persistence.repo.FileVariantRepository;
import ae.teletronics.ingest.adapters.persistence.repo.StoredFileRepository;
import ae.teletronics.ingest.application.dto.QueueStats;
import ae.teletronics.ingest.application.exceptions.ErrorKind;
import ae.teletronics.ingest.application.exceptions.IngestException;
import ae.teletronics.ingest.application.exceptions.NotFoundException;
import ae.teletronics.ingest.application.jobs.JobPayloads;
import ae.teletronics.ingest.application.routing.ProviderRouter;
import ae.teletronics.ingest.domain.FileStatus;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.QueueName;
import ae.teletronics.ingest.domain.model.FileVariant;
import ae.teletronics.ingest.domain.model.StoredFile;
import ae.teletronics.ingest.ports.ClockProvider;
import ae.teletronics.ingest.ports.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of stored files: status polling, access URLs, variants, soft delete and queue depths.
 */
@Service
public class FileAccessService {

    private static final Logger log = LoggerFactory.getLogger(FileAccessService.class);

    private final StoredFileRepository files;
    private final FileVariantRepository variants;
    private final ProviderRouter router;
    private final JobQueue queue;
    private final ClockProvider clock;

    public FileAccessService(StoredFileRepository files,
                             FileVariantRepository variants,
                             ProviderRouter router,
                             JobQueue queue,
                             ClockProvider clock) {
        this.files = files;
        this.variants = variants;
        this.router = router;
        this.queue = queue;
        this.clock = clock;
    }

    /** Other owners and deleted files both read as not found. */
    public StoredFile getFile(String fileId, String ownerId) {
        return files.findById(fileId)
                .filter(f -> f.getOwnerId().equals(ownerId))
                .filter(f -> !f.isDeleted())
                .orElseThrow(() -> new NotFoundException("File not found: " + fileId));
    }

    /**
     * Public files return their permanent URL; everything else gets a signed URL valid for
     * {@code ttlSeconds}.
     */
    public String accessUrl(String fileId, String ownerId, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw IngestException.invalidArgument("ttlSeconds must be > 0");
        }
        StoredFile file = getFile(fileId, ownerId);
        if (file.getStatus() != FileStatus.READY) {
            throw new IngestException(ErrorKind.NOT_COMPLETED, "File " + fileId + " is " + file.getStatus());
        }
        if (file.getPrivacy().isPublic()) {
            return file.getPrimaryUrl();
        }
        return router.provider(file.getPrimaryProvider()).generateSignedUrl(file.getPrimaryObjectId(), ttlSeconds);
    }

    public List<FileVariant> listVariants(String fileId, String ownerId) {
        getFile(fileId, ownerId);
        return variants.findByFileId(fileId);
    }

    /**
     * Soft delete; remote objects are removed later by a cleanup job.
     */
    public void delete(String fileId, String ownerId) {
        getFile(fileId, ownerId);
        if (!files.markDeleted(fileId, clock.now())) {
            // lost a race with another delete
            return;
        }
        queue.enqueue(JobKind.CLEANUP, Map.of(JobPayloads.FILE_ID, fileId), JobKind.CLEANUP.defaultPriority());
        log.info("File {} deleted by {}", fileId, ownerId);
    }

    public Map<QueueName, QueueStats> queueDepths() {
        Map<QueueName, QueueStats> depths = new EnumMap<>(QueueName.class);
        for (QueueName q : QueueName.values()) {
            depths.put(q, queue.stats(q));
        }
        return depths;
    }
}
