package ae.teletronics.ingest.application.jobs;

import ae.teletronics.ingest.application.exceptions.IngestException;
import ae.teletronics.ingest.application.exceptions.JobExhaustedException;
import ae.teletronics.ingest.domain.model.QueuedJob;
import ae.teletronics.ingest.ports.JobQueue.NackOutcome;

import java.time.Duration;
import java.time.Instant;

/**
 * Bounded retries with exponential backoff: after the n-th failed attempt the job waits
 * {@code initialBackoff * 2^(n-1)} (2s, 4s, 8s, ... by default).
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(2);

    private static final int MAX_SHIFT = 20;

    private final int maxAttempts;
    private final Duration initialBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (initialBackoff.isNegative()) throw new IllegalArgumentException("initialBackoff must be >= 0");
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF);
    }

    public int maxAttempts() { return maxAttempts; }

    public Duration initialBackoff() { return initialBackoff; }

    public static Duration backoff(long initialMillis, int failedAttempts) {
        int shift = Math.min(Math.max(failedAttempts - 1, 0), MAX_SHIFT);
        return Duration.ofMillis(initialMillis << shift);
    }

    /** Anything that is not an {@link IngestException} is assumed to be transient. */
    public static boolean isRetryable(Throwable error) {
        if (error instanceof IngestException ie) {
            return ie.isRetryable();
        }
        return true;
    }

    /**
     * Decides what happens to a job whose latest attempt failed. Uses the attempt budget and
     * backoff recorded on the job itself, so a config change does not affect jobs already queued.
     */
    public static Decision onFailure(QueuedJob job, Throwable error, boolean retryable, Instant now) {
        if (!retryable) {
            return new Decision(NackOutcome.DEAD, null, describe(error));
        }
        if (job.attemptsExhausted()) {
            return new Decision(NackOutcome.DEAD, null,
                    new JobExhaustedException(job.getId(), job.getAttempts(), error).getMessage());
        }
        Instant runAt = now.plus(backoff(job.getBackoffMillis(), job.getAttempts()));
        return new Decision(NackOutcome.RETRY_SCHEDULED, runAt, describe(error));
    }

    private static String describe(Throwable t) {
        if (t == null) return null;
        String msg = t.getMessage();
        return t.getClass().getSimpleName() + (msg != null ? ": " + msg : "");
    }

    public record Decision(NackOutcome outcome, Instant runAt, String lastError) {}
}
