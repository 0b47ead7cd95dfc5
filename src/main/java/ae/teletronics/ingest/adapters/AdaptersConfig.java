package ae.teletronics.ingest.adapters;

import ae.teletronics.ingest.adapters.antivirus.ClamAvVirusScanner;
import ae.teletronics.ingest.adapters.antivirus.NoOpVirusScanner;
import ae.teletronics.ingest.adapters.detection.TikaFileTypeDetector;
import ae.teletronics.ingest.adapters.persistence.MongoUploadSessionStore;
import ae.teletronics.ingest.adapters.queue.MongoJobQueue;
import ae.teletronics.ingest.adapters.scheduling.JobWorkerPool;
import ae.teletronics.ingest.adapters.storage.LocalChunkFileStore;
import ae.teletronics.ingest.adapters.storage.LocalFsStorageAdapter;
import ae.teletronics.ingest.adapters.time.SystemClockProvider;
import ae.teletronics.ingest.application.jobs.JobDispatcher;
import ae.teletronics.ingest.application.jobs.RetryPolicy;
import ae.teletronics.ingest.application.policy.ContentInspector;
import ae.teletronics.ingest.application.policy.UploadPolicy;
import ae.teletronics.ingest.domain.QueueName;
import ae.teletronics.ingest.ports.ChunkFileStore;
import ae.teletronics.ingest.ports.ClockProvider;
import ae.teletronics.ingest.ports.FileTypeDetector;
import ae.teletronics.ingest.ports.JobQueue;
import ae.teletronics.ingest.ports.StagingStoragePort;
import ae.teletronics.ingest.ports.UploadSessionStore;
import ae.teletronics.ingest.ports.VirusScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Configuration
public class AdaptersConfig {

    private static final Logger log = LoggerFactory.getLogger(AdaptersConfig.class);

    @Bean
    @ConditionalOnMissingBean(StagingStoragePort.class)
    public StagingStoragePort stagingStoragePort(
            @Value("${ingest.upload.staging-path:/data/ingest/staging}") String basePath,
            @Value("${ingest.upload.fsync-on-write:false}") boolean fsyncOnWrite
    ) throws IOException {
        Path root = Paths.get(basePath).toAbsolutePath().normalize();
        Files.createDirectories(root);
        return new LocalFsStorageAdapter(root, fsyncOnWrite);
    }

    @Bean
    @ConditionalOnMissingBean(ChunkFileStore.class)
    public ChunkFileStore chunkFileStore(
            @Value("${ingest.sessions.temp-dir:/data/ingest/sessions}") String tempDir
    ) throws IOException {
        return new LocalChunkFileStore(Paths.get(tempDir).toAbsolutePath().normalize());
    }

    @Bean
    @ConditionalOnMissingBean(UploadSessionStore.class)
    public UploadSessionStore uploadSessionStore(MongoTemplate mongoTemplate) {
        return new MongoUploadSessionStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(FileTypeDetector.class)
    public FileTypeDetector fileTypeDetector() {
        return new TikaFileTypeDetector();
    }

    @Bean
    @ConditionalOnMissingBean(VirusScanner.class)
    public VirusScanner virusScanner(
            @Value("${ingest.virus-scan.enabled:false}") boolean enabled,
            @Value("${ingest.virus-scan.host:localhost}") String host,
            @Value("${ingest.virus-scan.port:3310}") int port,
            @Value("${ingest.virus-scan.timeout-ms:30000}") int timeoutMillis
    ) {
        if (!enabled) {
            log.info("Virus scanning disabled");
            return new NoOpVirusScanner();
        }
        log.info("Virus scanning with clamd at {}:{}", host, port);
        return new ClamAvVirusScanner(host, port, timeoutMillis);
    }

    @Bean
    @ConditionalOnMissingBean(ClockProvider.class)
    public ClockProvider clockProvider() {
        return new SystemClockProvider();
    }

    @Bean
    @ConditionalOnMissingBean(UploadPolicy.class)
    public UploadPolicy uploadPolicy(
            @Value("${ingest.upload.max-file-size:100MB}") DataSize maxFileSize,
            @Value("${ingest.upload.allowed-mime-types:image/*,video/*,application/pdf,text/plain}") List<String> allowedMimeTypes
    ) {
        return new UploadPolicy(maxFileSize.toBytes(), allowedMimeTypes);
    }

    @Bean
    @ConditionalOnMissingBean(ContentInspector.class)
    public ContentInspector contentInspector(FileTypeDetector detector) {
        return new ContentInspector(detector);
    }

    @Bean
    @ConditionalOnMissingBean(RetryPolicy.class)
    public RetryPolicy retryPolicy(
            @Value("${ingest.queue.max-attempts:3}") int maxAttempts,
            @Value("${ingest.queue.backoff-initial:PT2S}") Duration initialBackoff
    ) {
        return new RetryPolicy(maxAttempts, initialBackoff);
    }

    @Bean
    @ConditionalOnMissingBean(JobQueue.class)
    public JobQueue jobQueue(MongoTemplate mongoTemplate,
                             ClockProvider clock,
                             RetryPolicy retryPolicy,
                             @Value("${ingest.queue.lease:PT5M}") Duration lease) {
        return new MongoJobQueue(mongoTemplate, clock, retryPolicy, lease);
    }

    @Bean
    @ConditionalOnProperty(name = "ingest.workers.enabled", havingValue = "true", matchIfMissing = true)
    public JobWorkerPool jobWorkerPool(JobDispatcher dispatcher,
                                       @Value("${ingest.workers.accept-concurrency:4}") int acceptConcurrency,
                                       @Value("${ingest.workers.processing-concurrency:2}") int processingConcurrency,
                                       @Value("${ingest.workers.poll-interval:PT1S}") Duration pollInterval,
                                       @Value("${ingest.workers.shutdown-timeout:PT30S}") Duration shutdownTimeout) {
        Map<QueueName, Integer> concurrency = new EnumMap<>(QueueName.class);
        concurrency.put(QueueName.ACCEPT, acceptConcurrency);
        concurrency.put(QueueName.PROCESSING, processingConcurrency);
        return new JobWorkerPool(dispatcher, concurrency, pollInterval, shutdownTimeout);
    }
}
