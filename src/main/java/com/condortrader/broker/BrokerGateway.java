package com.condortrader.broker;

import java.util.List;
import java.util.function.Consumer;

/**
 * Broker operations used by the live execution manager. Every order placed by the system
 * goes through this interface, never through the Kite SDK directly.
 *
 * <p>Calls are blocking network I/O and must not run on the decision thread. Failures are
 * thrown as {@link com.condortrader.exception.BrokerException} carrying a
 * {@link com.condortrader.domain.enums.RejectCode} that tells transient failures from
 * permanent ones.
 */
public interface BrokerGateway {

    /**
     * Places a new order.
     *
     * @return the broker-assigned order id
     */
    String place(BrokerOrderRequest request);

    void cancel(String brokerOrderId);

    /** Changes price or quantity of an open order. */
    void modify(String brokerOrderId, BrokerOrderRequest request);

    /** Every order of the trading day, as last known by the broker. */
    List<BrokerOrderUpdate> fetchOrderBook();

    /**
     * Registers the receiver of pushed order updates. Updates may arrive on any thread.
     */
    void setOrderUpdateListener(Consumer<BrokerOrderUpdate> listener);
}
