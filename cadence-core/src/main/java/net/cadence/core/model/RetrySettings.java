package net.cadence.core.model;

import java.time.Duration;

public record RetrySettings(int maxRetries, long retryDelaySeconds) {
    public static final int MAX_RETRIES_LIMIT = 10;
    /** 7일 */
    public static final long MAX_RETRY_DELAY_SECONDS = 7 * 24 * 3600;

    public static RetrySettings none() { return new RetrySettings(0, 60); }

    public Duration retryDelay() { return Duration.ofSeconds(retryDelaySeconds); }
}
