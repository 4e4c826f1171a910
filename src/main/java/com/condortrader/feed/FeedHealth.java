package com.condortrader.feed;

import com.condortrader.domain.enums.FeedState;
import com.condortrader.domain.model.FeedStatus;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Health handle of one feed connection. Created by {@link MarketDataFeed#connect} and closed
 * when the feed is torn down; the decision loop reads it through {@link #status}.
 *
 * <p>Written by the feed's socket thread, read by the decision thread and the metrics
 * scraper, hence the volatile fields.
 */
public class FeedHealth {

    private volatile FeedState state;
    private volatile LocalDateTime lastMessageAt;
    private volatile boolean closed;

    public FeedHealth(FeedState initialState) {
        this.state = initialState;
    }

    /**
     * Health as seen at {@code now}. The feed is stale when it is not connected, has not
     * delivered anything yet, or has been silent for longer than {@code staleThreshold}.
     */
    public FeedStatus status(LocalDateTime now, Duration staleThreshold) {
        FeedState current = closed ? FeedState.CLOSED : state;
        LocalDateTime last = lastMessageAt;
        boolean stale = current != FeedState.CONNECTED
                || last == null
                || Duration.between(last, now).compareTo(staleThreshold) > 0;
        return new FeedStatus(current, last, stale);
    }

    public void recordMessage(LocalDateTime at) {
        LocalDateTime last = lastMessageAt;
        if (last == null || at.isAfter(last)) {
            lastMessageAt = at;
        }
    }

    public void transition(FeedState newState) {
        if (!closed) {
            state = newState;
        }
    }

    public void close() {
        closed = true;
        state = FeedState.CLOSED;
    }

    public FeedState getState() {
        return state;
    }

    public LocalDateTime getLastMessageAt() {
        return lastMessageAt;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isConnected() {
        return !closed && state == FeedState.CONNECTED;
    }
}
