package ae.teletronics.ingest.application;

import ae.teletronics.ingest.adapters.persistence.repo.StoredFileRepository;
import ae.teletronics.ingest.application.dto.CompletedUpload;
import ae.teletronics.ingest.application.dto.InspectionResult;
import ae.teletronics.ingest.application.dto.UploadCommand;
import ae.teletronics.ingest.application.exceptions.IngestException;
import ae.teletronics.ingest.application.exceptions.RejectedUploadException;
import ae.teletronics.ingest.application.jobs.JobPayloads;
import ae.teletronics.ingest.application.policy.ContentInspector;
import ae.teletronics.ingest.application.policy.UploadPolicy;
import ae.teletronics.ingest.application.util.FilenameGenerator;
import ae.teletronics.ingest.application.util.Hashing;
import ae.teletronics.ingest.domain.FileCategory;
import ae.teletronics.ingest.domain.FilePrivacy;
import ae.teletronics.ingest.domain.FileStatus;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.VariantKind;
import ae.teletronics.ingest.domain.model.StoredFile;
import ae.teletronics.ingest.domain.model.UploadSession;
import ae.teletronics.ingest.ports.ClockProvider;
import ae.teletronics.ingest.ports.JobQueue;
import ae.teletronics.ingest.ports.StagingStoragePort;
import ae.teletronics.ingest.ports.StreamSource;
import ae.teletronics.ingest.ports.VirusScanner;
import ae.teletronics.ingest.ports.VirusScanner.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for whole-file uploads and for the hand-off of finished chunked uploads.
 *
 * Accepting a file is fast: validate, inspect, fingerprint, stage the bytes locally, persist
 * the File as UPLOADING and enqueue an accept job. Pushing bytes to a provider happens later
 * on a worker.
 */
@Service
public class UploadOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(UploadOrchestrator.class);

    private final StoredFileRepository files;
    private final StagingStoragePort staging;
    private final JobQueue queue;
    private final UploadPolicy policy;
    private final ContentInspector inspector;
    private final VirusScanner virusScanner;
    private final ResumableUploadManager resumableUploads;
    private final ClockProvider clock;
    private final boolean strictVirusScan;

    public UploadOrchestrator(StoredFileRepository files,
                              StagingStoragePort staging,
                              JobQueue queue,
                              UploadPolicy policy,
                              ContentInspector inspector,
                              VirusScanner virusScanner,
                              ResumableUploadManager resumableUploads,
                              ClockProvider clock,
                              @Value("${ingest.virus-scan.strict:false}") boolean strictVirusScan) {
        this.files = files;
        this.staging = staging;
        this.queue = queue;
        this.policy = policy;
        this.inspector = inspector;
        this.virusScanner = virusScanner;
        this.resumableUploads = resumableUploads;
        this.clock = clock;
        this.strictVirusScan = strictVirusScan;
    }

    /**
     * @return the new File in UPLOADING state, or an existing READY File with the same content
     *         for the same owner
     */
    public StoredFile submitUpload(UploadCommand cmd) throws IOException {
        if (cmd == null || !StringUtils.hasText(cmd.ownerId()) || !StringUtils.hasText(cmd.originalName())) {
            throw IngestException.invalidArgument("ownerId and originalName are required");
        }
        if (cmd.bytes() == null || cmd.bytes().length == 0) {
            throw IngestException.invalidArgument("File content is empty");
        }
        final String ownerId = cmd.ownerId();
        final byte[] bytes = cmd.bytes();

        policy.check(cmd.mimeType(), bytes.length);

        ScanReport scan = scan(bytes, cmd.originalName());
        InspectionResult inspection = inspector.inspect(bytes, cmd.originalName(), cmd.mimeType());

        final String contentHash = Hashing.sha256Hex(bytes);
        Optional<StoredFile> existing = files.findFirstByOwnerIdAndContentHashAndStatus(ownerId, contentHash, FileStatus.READY);
        if (existing.isPresent()) {
            log.info("Upload of {} by {} matches ready file {}", cmd.originalName(), ownerId, existing.get().getId());
            return existing.get();
        }

        Instant now = clock.now();
        String generatedFilename = FilenameGenerator.generate(cmd.originalName(), now);
        String stagingKey = JobPayloads.stagingKey(ownerId, generatedFilename);
        staging.save(StreamSource.of(bytes), stagingKey);

        StoredFile file = new StoredFile(
                ownerId,
                cmd.originalName(),
                generatedFilename,
                cmd.mimeType(),
                bytes.length,
                contentHash,
                cmd.category(),
                cmd.privacy(),
                buildMetadata(cmd, scan, inspection, now));

        try {
            file = files.save(file);
        } catch (RuntimeException e) {
            discardStaged(stagingKey);
            throw e;
        }

        try {
            queue.enqueue(JobKind.ACCEPT_UPLOAD, Map.of(
                    JobPayloads.FILE_ID, file.getId(),
                    JobPayloads.STAGING_KEY, stagingKey,
                    JobPayloads.VARIANTS, JobPayloads.encodeVariants(cmd.variants())
            ), file.getTypeCategory().acceptPriority());
        } catch (RuntimeException e) {
            log.error("Could not enqueue accept job for file {}", file.getId(), e);
            file.markFailed("Could not enqueue accept job: " + e.getMessage(), clock.now());
            files.save(file);
            discardStaged(stagingKey);
            throw e;
        }

        log.info("File {} accepted for {} ({} bytes, {})", file.getId(), ownerId, bytes.length, file.getTypeCategory());
        return file;
    }

    /**
     * Hands a completed chunked upload to {@link #submitUpload}. The session is released only
     * once the submission went through, so a failed hand-off can be retried.
     */
    public StoredFile finalizeResumableUpload(String sessionId,
                                              String ownerId,
                                              FileCategory category,
                                              FilePrivacy privacy,
                                              List<VariantKind> variants) throws IOException {
        CompletedUpload completed = resumableUploads.completeUpload(sessionId, ownerId);
        UploadSession session = completed.session();

        StoredFile file = submitUpload(new UploadCommand(
                ownerId,
                session.getFilename(),
                session.getMimeType(),
                completed.bytes(),
                category,
                privacy,
                variants,
                session.getMetadata()));

        resumableUploads.release(sessionId);
        return file;
    }

    /* helpers */

    private ScanReport scan(byte[] bytes, String filename) {
        ScanReport report;
        try {
            report = virusScanner.scan(StreamSource.of(bytes));
        } catch (IOException e) {
            report = ScanReport.error("unknown", e.getMessage());
        }

        switch (report.getVerdict()) {
            case INFECTED -> throw new RejectedUploadException(
                    "File rejected: virus detected (" + String.join(", ", report.getSignatures()) + ")");
            case ERROR -> {
                if (strictVirusScan) {
                    throw new RejectedUploadException("Virus scan unavailable: " + report.getDetails());
                }
                log.warn("Virus scan of {} failed, accepting unscanned: {}", filename, report.getDetails());
            }
            default -> { /* CLEAN */ }
        }
        return report;
    }

    private Map<String, Object> buildMetadata(UploadCommand cmd, ScanReport scan, InspectionResult inspection, Instant now) {
        Map<String, Object> metadata = new HashMap<>(cmd.metadata());
        metadata.put("uploadedAt", now.toString());

        Map<String, Object> scanInfo = new LinkedHashMap<>();
        scanInfo.put("engine", scan.getEngine());
        scanInfo.put("scanned", scan.getVerdict() != VirusScanner.Verdict.ERROR);
        scanInfo.put("clean", scan.getVerdict() == VirusScanner.Verdict.CLEAN);
        scanInfo.put("scanDate", now.toString());
        metadata.put("virusScanResult", scanInfo);

        if (inspection.detectedMimeType() != null) {
            metadata.put("detectedMimeType", inspection.detectedMimeType());
        }
        if (inspection.hasWarnings()) {
            metadata.put("warnings", inspection.warnings());
        }
        return metadata;
    }

    private void discardStaged(String stagingKey) {
        try {
            staging.delete(stagingKey);
        } catch (IOException e) {
            log.warn("Could not delete staged bytes {}: {}", stagingKey, e.getMessage());
        }
    }
}
