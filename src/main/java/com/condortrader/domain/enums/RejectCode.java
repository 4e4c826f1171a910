package com.condortrader.domain.enums;

/**
 * Classification of broker-side failures. Retryable codes are transient and go back to
 * PENDING with backoff; the others make the order REJECTED immediately.
 */
public enum RejectCode {
    TIMEOUT(true),
    ACK_TIMEOUT(true),
    NETWORK(true),
    RATE_LIMITED(true),
    MARGIN_INSUFFICIENT(false),
    INVALID_ORDER(false),
    AUTH_EXPIRED(false),
    BROKER_REJECTED(false),
    RETRIES_EXHAUSTED(false);

    private final boolean retryable;

    RejectCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
