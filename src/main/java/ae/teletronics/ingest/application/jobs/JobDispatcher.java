package ae.teletronics.ingest.application.jobs;

import ae.teletronics.ingest.application.exceptions.JobExhaustedException;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.QueueName;
import ae.teletronics.ingest.domain.model.QueuedJob;
import ae.teletronics.ingest.ports.JobQueue;
import ae.teletronics.ingest.ports.JobQueue.NackOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One worker step: claim a job, run its handler, then ack or nack it.
 */
@Component
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobQueue queue;
    private final Map<JobKind, JobHandler> handlers = new EnumMap<>(JobKind.class);

    public JobDispatcher(JobQueue queue, List<JobHandler> handlers) {
        this.queue = queue;
        for (JobHandler h : handlers) {
            if (this.handlers.put(h.kind(), h) != null) {
                throw new IllegalStateException("Two handlers registered for " + h.kind());
            }
        }
    }

    /**
     * @return false when the queue had nothing runnable
     */
    public boolean runNext(QueueName queueName) {
        Optional<QueuedJob> claimed = queue.poll(queueName);
        if (claimed.isEmpty()) {
            return false;
        }
        QueuedJob job = claimed.get();

        JobHandler handler = handlers.get(job.getKind());
        if (handler == null) {
            log.error("No handler for job {} of kind {}", job.getId(), job.getKind());
            queue.nack(job, new IllegalStateException("No handler for " + job.getKind()), false);
            return true;
        }

        try {
            handler.handle(job);
            queue.ack(job);
            log.debug("Job {} ({}) completed on attempt {}", job.getId(), job.getKind(), job.getAttempts());
        } catch (Exception e) {
            boolean retryable = RetryPolicy.isRetryable(e);
            NackOutcome outcome = queue.nack(job, e, retryable);
            if (outcome == NackOutcome.RETRY_SCHEDULED) {
                log.warn("Job {} ({}) attempt {}/{} failed, will retry: {}",
                        job.getId(), job.getKind(), job.getAttempts(), job.getMaxAttempts(), e.getMessage());
            } else if (retryable) {
                JobExhaustedException exhausted = new JobExhaustedException(job.getId(), job.getAttempts(), e);
                log.error(exhausted.getMessage(), e);
            } else {
                log.error("Job {} ({}) failed permanently: {}", job.getId(), job.getKind(), e.getMessage(), e);
            }
        }
        return true;
    }
}
