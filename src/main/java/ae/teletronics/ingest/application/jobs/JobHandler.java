package ae.teletronics.ingest.application.jobs;

import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.model.QueuedJob;

/**
 * Executes one kind of job. Handlers must tolerate redelivery of the same job.
 */
public interface JobHandler {

    JobKind kind();

    /**
     * Throwing marks the attempt as failed; see {@link RetryPolicy#isRetryable(Throwable)}.
     */
    void handle(QueuedJob job) throws Exception;
}
