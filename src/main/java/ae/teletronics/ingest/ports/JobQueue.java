package ae.teletronics.ingest.ports;

import ae.teletronics.ingest.application.dto.QueueStats;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.QueueName;
import ae.teletronics.ingest.domain.model.QueuedJob;

import java.util.Map;
import java.util.Optional;

/**
 * Durable, prioritized job queue with at-least-once delivery.
 * A claimed job is leased to one worker; when the lease runs out the job can be claimed again.
 */
public interface JobQueue {

    QueuedJob enqueue(JobKind kind, Map<String, String> payload, int priority);

    /**
     * Claim the next runnable job (lowest priority value first, then oldest {@code runAt}).
     */
    Optional<QueuedJob> poll(QueueName queue);

    void ack(QueuedJob job);

    /**
     * Report a failed attempt. Non-retryable errors and exhausted attempts move the job
     * to the dead list; otherwise it is rescheduled with exponential backoff.
     */
    NackOutcome nack(QueuedJob job, Throwable error, boolean retryable);

    QueueStats stats(QueueName queue);

    /**
     * Release jobs whose lease expired (crashed worker).
     *
     * @return number of jobs released or moved to the dead list
     */
    int releaseExpiredLeases();

    enum NackOutcome { RETRY_SCHEDULED, DEAD }
}
