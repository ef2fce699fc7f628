package io.recur4j.core;

public record ExecutionOutcome(
        boolean success,
        String message
) {
    public static ExecutionOutcome succeeded(String message) {
        return new ExecutionOutcome(true, message);
    }

    public static ExecutionOutcome failed(String message) {
        return new ExecutionOutcome(false, message);
    }
}
