package com.condortrader.feed;

import com.condortrader.domain.enums.FeedState;
import com.condortrader.domain.model.Tick;
import java.time.LocalDateTime;

/**
 * Receives normalized market data from a {@link MarketDataFeed}. Live feeds call it from the
 * socket thread; implementations hand the work over to the decision thread.
 */
public interface FeedListener {

    void onTick(Tick tick);

    /** The stream was re-established after a gap; ticks in between were lost. */
    default void onResync(LocalDateTime at) {}

    default void onStateChange(FeedState state, LocalDateTime at) {}
}
