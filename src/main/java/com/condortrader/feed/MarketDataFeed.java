package com.condortrader.feed;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Set;

/**
 * Source of market data for the decision loop. The live Kite ticker and the historical
 * replay both implement it, so the loop cannot tell them apart.
 */
public interface MarketDataFeed {

    /**
     * Opens the stream for the given instruments.
     *
     * @return the health handle of this connection, valid until {@link #disconnect()}
     * @throws com.condortrader.exception.ConnectionException when the handshake fails
     */
    FeedHealth connect(Set<Long> instruments, FeedListener listener);

    void subscribe(Collection<Long> instruments);

    void unsubscribe(Collection<Long> instruments);

    /** Fetches a quote snapshot of every subscribed instrument and delivers it as ticks. */
    void requestSnapshot();

    /**
     * Timer step: heartbeat watchdog and due reconnect attempts.
     *
     * @throws com.condortrader.exception.FeedUnavailableException once reconnecting has failed
     *         for the whole attempt budget
     */
    void onTimer(LocalDateTime now);

    void disconnect();
}
