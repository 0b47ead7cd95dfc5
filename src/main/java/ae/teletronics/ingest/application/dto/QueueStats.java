package ae.teletronics.ingest.application.dto;

import ae.teletronics.ingest.domain.QueueName;

/**
 * Queue depth snapshot. {@code waiting} counts runnable jobs, {@code delayed} those held back by backoff.
 */
public record QueueStats(
        QueueName queue,
        long waiting,
        long delayed,
        long active,
        long completed,
        long failed
) {}
