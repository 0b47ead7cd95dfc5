package ae.teletronics.ingest.domain;

/** The two logical job queues. */
public enum QueueName {
    /** Finalizes storage of freshly accepted uploads. */
    ACCEPT,
    /** Derived work: variants, backups, cleanup. */
    PROCESSING
}
