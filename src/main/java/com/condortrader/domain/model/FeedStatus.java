package com.condortrader.domain.model;

import com.condortrader.domain.enums.FeedState;
import java.time.LocalDateTime;
import lombok.Value;

/**
 * Point-in-time reading of feed health, handed to the risk checks. Immutable.
 */
@Value
public class FeedStatus {

    FeedState state;
    LocalDateTime lastMessageAt;
    boolean stale;

    public static FeedStatus healthy(LocalDateTime at) {
        return new FeedStatus(FeedState.CONNECTED, at, false);
    }
}
