package com.condortrader.feed;

import java.time.Duration;
import java.time.LocalDateTime;
import lombok.Getter;

/**
 * Reconnect schedule held as explicit state and advanced by the timer, so reconnects are
 * deterministic under a simulated clock.
 *
 * <p>Backoff for attempt n: min(initial * 2^(n-1), max). Once {@code maxAttempts}
 * reconnects have failed the policy is exhausted and the feed reports itself unavailable.
 */
@Getter
public class ReconnectPolicy {

    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final int maxAttempts;

    private int attempts;
    private LocalDateTime nextAttemptAt;

    public ReconnectPolicy(Duration initialBackoff, Duration maxBackoff, int maxAttempts) {
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Schedules the next attempt after a failure observed at {@code now}.
     *
     * @return false when the attempt budget is spent
     */
    public boolean scheduleNext(LocalDateTime now) {
        if (attempts >= maxAttempts) {
            nextAttemptAt = null;
            return false;
        }
        attempts++;
        nextAttemptAt = now.plus(backoff(attempts));
        return true;
    }

    public boolean isDue(LocalDateTime now) {
        return nextAttemptAt != null && !now.isBefore(nextAttemptAt);
    }

    /** Marks the scheduled attempt as started. */
    public void attemptStarted() {
        nextAttemptAt = null;
    }

    public boolean isExhausted() {
        return attempts >= maxAttempts && nextAttemptAt == null;
    }

    public void reset() {
        attempts = 0;
        nextAttemptAt = null;
    }

    public Duration backoff(int attempt) {
        long shift = Math.min(attempt - 1, 30);
        Duration candidate = initialBackoff.multipliedBy(1L << shift);
        return candidate.compareTo(maxBackoff) > 0 ? maxBackoff : candidate;
    }
}
