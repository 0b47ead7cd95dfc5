package ae.teletronics.ingest.domain.model;

import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.JobStatus;
import ae.teletronics.ingest.domain.QueueName;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Durable job record. A job is claimable when WAITING and {@code runAt <= now};
 * a claim sets ACTIVE, bumps {@code attempts} and grants a lease until {@code leaseUntil}.
 */
@Document(collection = "jobs")
@CompoundIndexes({
        @CompoundIndex(name = "idx_claim", def = "{'queue': 1, 'status': 1, 'priority': 1, 'runAt': 1}"),
        @CompoundIndex(name = "idx_lease", def = "{'status': 1, 'leaseUntil': 1}")
})
public class QueuedJob {

    @Id
    private String id;

    private QueueName queue;

    private JobKind kind;

    private Map<String, String> payload = new HashMap<>();

    /** Lower runs sooner. */
    private int priority;

    private int attempts;

    private int maxAttempts;

    /** Delay before the first retry; doubles per further attempt. */
    private long backoffMillis;

    private JobStatus status = JobStatus.WAITING;

    private Instant runAt;

    private Instant leaseUntil;

    private String lastError;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant finishedAt;

    public QueuedJob() { }

    public QueuedJob(JobKind kind,
                     Map<String, String> payload,
                     int priority,
                     int maxAttempts,
                     long backoffMillis,
                     Instant now) {
        this.queue = kind.queue();
        this.kind = kind;
        this.payload = payload == null ? new HashMap<>() : new HashMap<>(payload);
        this.priority = priority;
        this.maxAttempts = maxAttempts;
        this.backoffMillis = backoffMillis;
        this.status = JobStatus.WAITING;
        this.runAt = now;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public String payloadValue(String key) {
        return payload.get(key);
    }

    public boolean attemptsExhausted() {
        return attempts >= maxAttempts;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public QueueName getQueue() { return queue; }
    public void setQueue(QueueName queue) { this.queue = queue; }

    public JobKind getKind() { return kind; }
    public void setKind(JobKind kind) { this.kind = kind; }

    public Map<String, String> getPayload() { return payload; }
    public void setPayload(Map<String, String> payload) {
        this.payload = payload == null ? new HashMap<>() : payload;
    }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public long getBackoffMillis() { return backoffMillis; }
    public void setBackoffMillis(long backoffMillis) { this.backoffMillis = backoffMillis; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public Instant getRunAt() { return runAt; }
    public void setRunAt(Instant runAt) { this.runAt = runAt; }

    public Instant getLeaseUntil() { return leaseUntil; }
    public void setLeaseUntil(Instant leaseUntil) { this.leaseUntil = leaseUntil; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueuedJob)) return false;
        QueuedJob that = (QueuedJob) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() { return Objects.hash(id); }

    @Override
    public String toString() {
        return "QueuedJob{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", status=" + status +
                ", attempts=" + attempts + "/" + maxAttempts +
                ", priority=" + priority +
                '}';
    }
}
