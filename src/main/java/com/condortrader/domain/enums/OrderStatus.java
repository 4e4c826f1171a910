package com.condortrader.domain.enums;

/**
 * Lifecycle status of an order.
 *
 * <p>PENDING covers everything before the broker acknowledged the order, including the
 * waits between placement attempts. FILLED, REJECTED and CANCELLED are terminal.
 */
public enum OrderStatus {
    PENDING,
    PLACED,
    PARTIALLY_FILLED,
    FILLED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FILLED || this == REJECTED || this == CANCELLED;
    }
}
