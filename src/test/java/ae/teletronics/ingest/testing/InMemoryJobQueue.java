package ae.teletronics.ingest.testing;

import ae.teletronics.ingest.application.dto.QueueStats;
import ae.teletronics.ingest.application.jobs.RetryPolicy;
import ae.teletronics.ingest.application.jobs.RetryPolicy.Decision;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.JobStatus;
import ae.teletronics.ingest.domain.QueueName;
import ae.teletronics.ingest.domain.model.QueuedJob;
import ae.teletronics.ingest.ports.ClockProvider;
import ae.teletronics.ingest.ports.JobQueue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

public class InMemoryJobQueue implements JobQueue {

    private final ClockProvider clock;
    private final RetryPolicy retryPolicy;
    private final List<QueuedJob> jobs = new ArrayList<>();

    public InMemoryJobQueue(ClockProvider clock, RetryPolicy retryPolicy) {
        this.clock = clock;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public synchronized QueuedJob enqueue(JobKind kind, Map<String, String> payload, int priority) {
        QueuedJob job = new QueuedJob(kind, payload, priority,
                retryPolicy.maxAttempts(), retryPolicy.initialBackoff().toMillis(), clock.now());
        job.setId(UUID.randomUUID().toString());
        jobs.add(job);
        return job;
    }

    @Override
    public synchronized Optional<QueuedJob> poll(QueueName queue) {
        Instant now = clock.now();
        Optional<QueuedJob> next = jobs.stream()
                .filter(j -> j.getQueue() == queue && j.getStatus() == JobStatus.WAITING && !j.getRunAt().isAfter(now))
                .min(Comparator.comparingInt(QueuedJob::getPriority)
                        .thenComparing(QueuedJob::getRunAt)
                        .thenComparing(QueuedJob::getCreatedAt));
        next.ifPresent(j -> {
            j.setStatus(JobStatus.ACTIVE);
            j.setAttempts(j.getAttempts() + 1);
            j.setLeaseUntil(now.plusSeconds(300));
        });
        return next;
    }

    @Override
    public synchronized void ack(QueuedJob job) {
        job.setStatus(JobStatus.COMPLETED);
        job.setFinishedAt(clock.now());
        job.setLeaseUntil(null);
    }

    @Override
    public synchronized NackOutcome nack(QueuedJob job, Throwable error, boolean retryable) {
        Decision d = RetryPolicy.onFailure(job, error, retryable, clock.now());
        job.setLastError(d.lastError());
        job.setLeaseUntil(null);
        if (d.outcome() == NackOutcome.DEAD) {
            job.setStatus(JobStatus.FAILED);
            job.setFinishedAt(clock.now());
        } else {
            job.setStatus(JobStatus.WAITING);
            job.setRunAt(d.runAt());
        }
        return d.outcome();
    }

    @Override
    public synchronized QueueStats stats(QueueName queue) {
        Instant now = clock.now();
        return new QueueStats(queue,
                count(queue, JobStatus.WAITING, j -> !j.getRunAt().isAfter(now)),
                count(queue, JobStatus.WAITING, j -> j.getRunAt().isAfter(now)),
                count(queue, JobStatus.ACTIVE, j -> true),
                count(queue, JobStatus.COMPLETED, j -> true),
                count(queue, JobStatus.FAILED, j -> true));
    }

    @Override
    public synchronized int releaseExpiredLeases() {
        return 0;
    }

    public synchronized List<QueuedJob> jobs() {
        return List.copyOf(jobs);
    }

    public synchronized List<QueuedJob> jobsOfKind(JobKind kind) {
        return jobs.stream().filter(j -> j.getKind() == kind).toList();
    }

    private long count(QueueName queue, JobStatus status, Predicate<QueuedJob> extra) {
        return jobs.stream().filter(j -> j.getQueue() == queue && j.getStatus() == status && extra.test(j)).count();
    }
}
