package io.recur4j.exception;

/**
 * Base exception for errors surfaced to scheduler callers.
 * Carries a short error code for API responses and logs.
 */
public class SchedulerException extends RuntimeException {

    private final String errorCode;

    public SchedulerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
