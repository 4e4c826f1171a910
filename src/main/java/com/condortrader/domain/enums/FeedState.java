package com.condortrader.domain.enums;

/** Connection state of the market data feed. */
public enum FeedState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    UNAVAILABLE,
    CLOSED
}
