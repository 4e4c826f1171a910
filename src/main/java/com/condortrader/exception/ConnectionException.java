package com.condortrader.exception;

/**
 * Feed handshake or reconnect failure. Recovered locally with backoff; escalates to
 * {@link FeedUnavailableException} once the reconnect budget is spent.
 */
public class ConnectionException extends BaseException {

    public ConnectionException(String message) {
        super(ErrorCode.FEED_CONNECTION, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(ErrorCode.FEED_CONNECTION, message, cause);
    }
}
