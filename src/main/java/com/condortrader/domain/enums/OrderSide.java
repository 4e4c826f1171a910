package com.condortrader.domain.enums;

/** Buy or sell side of an order. Maps to Kite API's transaction_type field. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the side that flattens a leg opened on this side. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** +1 for BUY, -1 for SELL. Multiplies quantities into signed exposure. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
