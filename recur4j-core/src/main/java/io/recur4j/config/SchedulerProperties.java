package io.recur4j.config;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for scheduler behavior.
 *
 * <p>Bound from {@code recur4j.*} by the Spring Boot starter; plain setters otherwise.
 */
public class SchedulerProperties {
    private Duration scanPeriod = Duration.ofSeconds(10);
    private int executionLogRetention = 10;
    private int maxConcurrency = 20; // worker threads
    private String timezone; // null = system default
    private Duration executionTimeout; // null = unbounded
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean recomputeNextRunOnResume = false;

    public Duration getScanPeriod() {
        return scanPeriod;
    }

    public void setScanPeriod(Duration scanPeriod) {
        this.scanPeriod = scanPeriod;
    }

    public int getExecutionLogRetention() {
        return executionLogRetention;
    }

    public void setExecutionLogRetention(int executionLogRetention) {
        this.executionLogRetention = executionLogRetention;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public void setExecutionTimeout(Duration executionTimeout) {
        this.executionTimeout = executionTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isRecomputeNextRunOnResume() {
        return recomputeNextRunOnResume;
    }

    public void setRecomputeNextRunOnResume(boolean recomputeNextRunOnResume) {
        this.recomputeNextRunOnResume = recomputeNextRunOnResume;
    }

    /**
     * Zone used to evaluate the wall-clock fields of recurrence rules.
     */
    public ZoneId resolveZone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            throw new IllegalArgumentException("recur4j.timezone is not a valid zone id: " + timezone, e);
        }
    }

    /**
     * Fails fast on settings the scheduler cannot run with.
     */
    public void validate() {
        if (scanPeriod == null || scanPeriod.isZero() || scanPeriod.isNegative()) {
            throw new IllegalArgumentException("recur4j.scanPeriod must be a positive duration");
        }
        if (executionLogRetention < 0) {
            throw new IllegalArgumentException("recur4j.executionLogRetention must not be negative");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("recur4j.maxConcurrency must be a positive number");
        }
        if (executionTimeout != null && (executionTimeout.isZero() || executionTimeout.isNegative())) {
            throw new IllegalArgumentException("recur4j.executionTimeout must be a positive duration");
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("recur4j.shutdownTimeout must not be negative");
        }
        resolveZone();
    }
}
