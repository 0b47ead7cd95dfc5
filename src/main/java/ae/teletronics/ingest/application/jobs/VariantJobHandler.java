package ae.teletronics.ingest.application.jobs;

import ae.teletronics.ingest.adapters.persistence.repo.FileVariantRepository;
import ae.teletronics.ingest.adapters.persistence.repo.StoredFileRepository;
import ae.teletronics.ingest.application.routing.ProviderRouter;
import ae.teletronics.ingest.domain.FileStatus;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.VariantKind;
import ae.teletronics.ingest.domain.model.FileVariant;
import ae.teletronics.ingest.domain.model.QueuedJob;
import ae.teletronics.ingest.domain.model.StoredFile;
import ae.teletronics.ingest.ports.StorageProvider;
import ae.teletronics.ingest.ports.StorageProvider.ProcessResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * Asks the primary provider for each requested rendition and upserts one FileVariant per kind.
 * A failing variant is logged and does not stop the others.
 */
@Component
public class VariantJobHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(VariantJobHandler.class);

    private final StoredFileRepository files;
    private final FileVariantRepository variants;
    private final ProviderRouter router;

    public VariantJobHandler(StoredFileRepository files, FileVariantRepository variants, ProviderRouter router) {
        this.files = files;
        this.variants = variants;
        this.router = router;
    }

    @Override
    public JobKind kind() {
        return JobKind.GENERATE_VARIANTS;
    }

    @Override
    public void handle(QueuedJob job) {
        String fileId = job.payloadValue(JobPayloads.FILE_ID);
        List<VariantKind> requested = JobPayloads.decodeVariants(job.payloadValue(JobPayloads.VARIANTS));

        Optional<StoredFile> found = files.findById(fileId);
        if (found.isEmpty() || found.get().getStatus() != FileStatus.READY) {
            log.info("File {} is not ready, skipping variant generation", fileId);
            return;
        }
        StoredFile file = found.get();
        StorageProvider provider = router.provider(file.getPrimaryProvider());

        int generated = 0;
        for (VariantKind kind : requested) {
            try {
                ProcessResult result = provider.process(file.getPrimaryUrl(), kind.transform());
                FileVariant variant = variants.findByFileIdAndVariant(fileId, kind)
                        .orElseGet(() -> new FileVariant(fileId, kind));
                variant.setUrl(result.url());
                variant.setWidth(result.width());
                variant.setHeight(result.height());
                variant.setSizeBytes(result.size());
                variant.setFormat(result.format());
                variant.setQuality(kind.transform().quality());
                variant.setMetadata(new HashMap<>(result.metadata()));
                variants.save(variant);
                generated++;
            } catch (Exception e) {
                log.warn("Variant {} for file {} failed: {}", kind, fileId, e.getMessage());
            }
        }
        log.info("Generated {}/{} variant(s) for file {}", generated, requested.size(), fileId);
    }
}
