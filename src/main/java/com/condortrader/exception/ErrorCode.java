package com.condortrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy of the trading core. Each code carries the process exit code used when
 * the error is fatal and terminates the application.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONFIG_INVALID("CONFIG_INVALID", 4),
    FEED_CONNECTION("FEED_CONNECTION", 2),
    FEED_UNAVAILABLE("FEED_UNAVAILABLE", 2),
    AUTH_EXPIRED("AUTH_EXPIRED", 3),
    ORDER_REJECTED("ORDER_REJECTED", 1),
    BROKER_ERROR("BROKER_ERROR", 1),
    RECONCILIATION_CONFLICT("RECONCILIATION_CONFLICT", 1),
    INTERNAL_ERROR("INTERNAL_ERROR", 1);

    private final String code;
    private final int exitCode;
}
