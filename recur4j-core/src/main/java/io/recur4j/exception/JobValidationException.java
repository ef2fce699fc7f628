package io.recur4j.exception;

/**
 * Thrown when a job definition is rejected; nothing is created.
 */
public class JobValidationException extends SchedulerException {

    private static final String ERROR_CODE = "VALIDATION";

    public JobValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
