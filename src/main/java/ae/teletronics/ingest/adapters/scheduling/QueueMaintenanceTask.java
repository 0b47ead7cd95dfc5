package ae.teletronics.ingest.adapters.scheduling;

import ae.teletronics.ingest.ports.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Returns jobs held by crashed workers to the queue.
 */
@Component
public class QueueMaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(QueueMaintenanceTask.class);

    private final JobQueue queue;

    public QueueMaintenanceTask(JobQueue queue) {
        this.queue = queue;
    }

    @Scheduled(fixedDelayString = "${ingest.queue.maintenance-interval-ms:30000}",
               initialDelayString = "${ingest.queue.maintenance-interval-ms:30000}")
    public void releaseExpiredLeases() {
        try {
            int released = queue.releaseExpiredLeases();
            if (released > 0) {
                log.info("Released {} job(s) with expired leases", released);
            }
        } catch (Exception e) {
            log.error("Lease maintenance failed: {}", e.getMessage(), e);
        }
    }
}
