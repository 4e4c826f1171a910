package com.condortrader.domain.enums;

/** Transitions recorded in the append-only order-event log. */
public enum OrderEventType {
    CREATED,
    SENT,
    RETRY_SCHEDULED,
    ACKNOWLEDGED,
    FILL,
    CANCEL_REQUESTED,
    CANCELLED,
    REJECTED
}
