package io.recur4j.exception;

/**
 * Thrown when an operation references an unknown job id.
 */
public class JobNotFoundException extends SchedulerException {

    private static final String ERROR_CODE = "NOT_FOUND";

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super(ERROR_CODE, "Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
