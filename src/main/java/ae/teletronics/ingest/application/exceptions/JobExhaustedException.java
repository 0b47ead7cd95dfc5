package ae.teletronics.ingest.application.exceptions;

/**
 * A retryable job used up its attempts and went to the dead list.
 */
public class JobExhaustedException extends IngestException {

    private final String jobId;
    private final int attempts;

    public JobExhaustedException(String jobId, int attempts, Throwable lastError) {
        super(ErrorKind.JOB_EXHAUSTED,
                "Job " + jobId + " failed after " + attempts + " attempt(s): " + describe(lastError),
                lastError);
        this.jobId = jobId;
        this.attempts = attempts;
    }

    public String getJobId() { return jobId; }
    public int getAttempts() { return attempts; }

    private static String describe(Throwable t) {
        if (t == null) return "unknown";
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
