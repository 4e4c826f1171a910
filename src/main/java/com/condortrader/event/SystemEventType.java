package com.condortrader.event;

/**
 * Classifies the process or connection event behind a {@link SystemEvent}.
 */
public enum SystemEventType {

    /** Startup recovery finished and the feed is being connected. */
    APPLICATION_READY,

    FEED_CONNECTED,

    /** Connection lost; reconnect attempts follow with backoff. */
    FEED_DISCONNECTED,

    /** Connection restored and a quote snapshot requested to fill the gap. */
    FEED_RESYNC,

    /** Reconnect budget exhausted. The process exits with code 2. */
    FEED_UNAVAILABLE,

    /** Graceful shutdown started: state is being persisted. */
    SHUTTING_DOWN,

    /** The strategy gave up on an order it cannot complete; an operator has to act. */
    MANUAL_INTERVENTION,

    /** A fatal error is terminating the process. */
    FATAL
}
