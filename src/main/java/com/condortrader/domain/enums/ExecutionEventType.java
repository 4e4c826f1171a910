package com.condortrader.domain.enums;

/** Feedback emitted by the execution layer towards the strategy. */
public enum ExecutionEventType {
    ACKNOWLEDGED,
    FILL,
    REJECTED,
    CANCELLED
}
