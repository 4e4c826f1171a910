package com.condortrader.exception;

import java.util.Map;

/** Fatal: the market data feed could not be restored within the reconnect budget. */
public class FeedUnavailableException extends BaseException {

    public FeedUnavailableException(String message, int attempts) {
        super(ErrorCode.FEED_UNAVAILABLE, message, Map.of("attempts", attempts), null);
    }

    public FeedUnavailableException(String message, Throwable cause) {
        super(ErrorCode.FEED_UNAVAILABLE, message, cause);
    }
}
