package ae.teletronics.ingest.adapters.scheduling;

import ae.teletronics.ingest.application.ResumableUploadManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class UploadSessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(UploadSessionSweeper.class);

    private final ResumableUploadManager uploads;

    public UploadSessionSweeper(ResumableUploadManager uploads) {
        this.uploads = uploads;
    }

    @Scheduled(fixedDelayString = "${ingest.sessions.sweep-interval-ms:3600000}",
               initialDelayString = "${ingest.sessions.sweep-interval-ms:3600000}")
    public void sweep() {
        log.debug("Sweeping expired upload sessions");
        try {
            uploads.sweepExpired();
        } catch (Exception e) {
            log.error("Upload session sweep failed: {}", e.getMessage(), e);
        }
    }
}
