package ae.teletronics.ingest.adapters.queue;

import ae.teletronics.ingest.application.dto.QueueStats;
import ae.teletronics.ingest.application.jobs.RetryPolicy;
import ae.teletronics.ingest.application.jobs.RetryPolicy.Decision;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.JobStatus;
import ae.teletronics.ingest.domain.QueueName;
import ae.teletronics.ingest.domain.model.QueuedJob;
import ae.teletronics.ingest.ports.ClockProvider;
import ae.teletronics.ingest.ports.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job queue on the {@code jobs} collection.
 *
 * Claims are a single findAndModify (WAITING -> ACTIVE, attempts + 1, lease set), so two
 * workers never get the same job. Every later transition is guarded on the job still being
 * ACTIVE under the same attempt, which keeps a worker whose lease was taken over from
 * clobbering the new owner's outcome.
 */
public class MongoJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(MongoJobQueue.class);

    static final int MAX_ERROR_LENGTH = 2000;

    private final MongoTemplate mongo;
    private final ClockProvider clock;
    private final RetryPolicy retryPolicy;
    private final Duration lease;

    public MongoJobQueue(MongoTemplate mongo, ClockProvider clock, RetryPolicy retryPolicy, Duration lease) {
        this.mongo = mongo;
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.lease = lease;
    }

    @Override
    public QueuedJob enqueue(JobKind kind, Map<String, String> payload, int priority) {
        QueuedJob job = new QueuedJob(kind, payload, priority,
                retryPolicy.maxAttempts(), retryPolicy.initialBackoff().toMillis(), clock.now());
        job = mongo.insert(job);
        log.debug("Enqueued job {} ({}) with priority {}", job.getId(), kind, priority);
        return job;
    }

    @Override
    public Optional<QueuedJob> poll(QueueName queue) {
        Instant now = clock.now();
        Query q = Query.query(Criteria.where("queue").is(queue)
                        .and("status").is(JobStatus.WAITING)
                        .and("runAt").lte(now))
                .with(Sort.by(Sort.Order.asc("priority"), Sort.Order.asc("runAt"), Sort.Order.asc("createdAt")));
        Update u = new Update()
                .set("status", JobStatus.ACTIVE)
                .set("leaseUntil", now.plus(lease))
                .set("updatedAt", now)
                .inc("attempts", 1);
        return Optional.ofNullable(mongo.findAndModify(q, u, FindAndModifyOptions.options().returnNew(true), QueuedJob.class));
    }

    @Override
    public void ack(QueuedJob job) {
        Instant now = clock.now();
        Update u = new Update()
                .set("status", JobStatus.COMPLETED)
                .set("finishedAt", now)
                .set("updatedAt", now)
                .unset("leaseUntil");
        if (mongo.updateFirst(ownedBy(job), u, QueuedJob.class).getModifiedCount() == 0) {
            log.warn("Ack for job {} ignored, lease was lost", job.getId());
        }
    }

    @Override
    public NackOutcome nack(QueuedJob job, Throwable error, boolean retryable) {
        Instant now = clock.now();
        Decision decision = RetryPolicy.onFailure(job, error, retryable, now);

        Update u = new Update()
                .set("lastError", truncate(decision.lastError()))
                .set("updatedAt", now)
                .unset("leaseUntil");
        if (decision.outcome() == NackOutcome.DEAD) {
            u.set("status", JobStatus.FAILED).set("finishedAt", now);
        } else {
            u.set("status", JobStatus.WAITING).set("runAt", decision.runAt());
        }
        if (mongo.updateFirst(ownedBy(job), u, QueuedJob.class).getModifiedCount() == 0) {
            log.warn("Nack for job {} ignored, lease was lost", job.getId());
        }
        return decision.outcome();
    }

    @Override
    public QueueStats stats(QueueName queue) {
        Instant now = clock.now();
        return new QueueStats(
                queue,
                count(Criteria.where("queue").is(queue).and("status").is(JobStatus.WAITING).and("runAt").lte(now)),
                count(Criteria.where("queue").is(queue).and("status").is(JobStatus.WAITING).and("runAt").gt(now)),
                count(Criteria.where("queue").is(queue).and("status").is(JobStatus.ACTIVE)),
                count(Criteria.where("queue").is(queue).and("status").is(JobStatus.COMPLETED)),
                count(Criteria.where("queue").is(queue).and("status").is(JobStatus.FAILED)));
    }

    @Override
    public int releaseExpiredLeases() {
        Instant now = clock.now();
        List<QueuedJob> expired = mongo.find(
                Query.query(Criteria.where("status").is(JobStatus.ACTIVE).and("leaseUntil").lt(now)),
                QueuedJob.class);

        int released = 0;
        for (QueuedJob job : expired) {
            Update u = new Update().set("updatedAt", now).unset("leaseUntil");
            if (job.attemptsExhausted()) {
                u.set("status", JobStatus.FAILED)
                        .set("finishedAt", now)
                        .set("lastError", "Lease expired after " + job.getAttempts() + " attempt(s)");
            } else {
                u.set("status", JobStatus.WAITING).set("runAt", now);
            }
            if (mongo.updateFirst(ownedBy(job), u, QueuedJob.class).getModifiedCount() > 0) {
                released++;
                log.warn("Job {} ({}) lease expired, now {}", job.getId(), job.getKind(),
                        job.attemptsExhausted() ? JobStatus.FAILED : JobStatus.WAITING);
            }
        }
        return released;
    }

    /* helpers */

    private static Query ownedBy(QueuedJob job) {
        return Query.query(Criteria.where("_id").is(job.getId())
                .and("status").is(JobStatus.ACTIVE)
                .and("attempts").is(job.getAttempts()));
    }

    private long count(Criteria c) {
        return mongo.count(Query.query(c), QueuedJob.class);
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_ERROR_LENGTH) return s;
        return s.substring(0, MAX_ERROR_LENGTH);
    }
}
