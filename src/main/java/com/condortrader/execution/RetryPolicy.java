package com.condortrader.execution;

import java.time.Duration;
import lombok.Getter;

/**
 * Exponential backoff {@code min(initial * 2^(attempt-1), max)} with a retry budget.
 * Stateless: the attempt count lives on whatever is being retried.
 */
@Getter
public class RetryPolicy {

    private final int maxRetries;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(int maxRetries, Duration initialBackoff, Duration maxBackoff) {
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    /** Delay before attempt {@code attempt + 1}, after {@code attempt} failed attempts. */
    public Duration backoff(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long millis = initialBackoff.toMillis() * (1L << exponent);
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }

    /** True while another attempt is allowed after {@code attempts} attempts. */
    public boolean canRetry(int attempts) {
        return attempts <= maxRetries;
    }
}
