package ae.teletronics.ingest.domain;

/**
 * What a job does, which queue it runs on and its default priority (lower runs sooner).
 * Accept jobs override the priority per file type, see {@link FileTypeCategory#acceptPriority()}.
 */
public enum JobKind {
    ACCEPT_UPLOAD(QueueName.ACCEPT, 5),
    GENERATE_VARIANTS(QueueName.PROCESSING, 3),
    REPLICATE_BACKUP(QueueName.PROCESSING, 5),
    CLEANUP(QueueName.PROCESSING, 10);

    private final QueueName queue;
    private final int defaultPriority;

    JobKind(QueueName queue, int defaultPriority) {
        this.queue = queue;
        this.defaultPriority = defaultPriority;
    }

    public QueueName queue() { return queue; }

    public int defaultPriority() { return defaultPriority; }
}
