package com.condortrader.execution;

import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.Order;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Turns strategy leg actions into orders and reports what happened to them.
 *
 * <p>Called on the decision thread only. Nothing is reported through callbacks: all
 * feedback is collected and returned by {@link #reconcile}, which the decision loop calls
 * on every tick and every timer step. Retry, acknowledgment timeout and polling are all
 * evaluated there against the supplied time, so a simulated clock drives them the same way
 * as the wall clock.
 */
public interface ExecutionManager {

    Order submit(LegAction action, LocalDateTime now);

    void cancel(Order order, LocalDateTime now);

    Optional<Order> order(String orderId);

    /** Orders not yet FILLED, REJECTED or CANCELLED. */
    Collection<Order> openOrders();

    /** Advances retries and timeouts and returns the events observed since the last call. */
    List<ExecutionEvent> reconcile(LocalDateTime now);

    /** Re-adopts orders rebuilt from the order-event log after a restart. */
    void restore(Collection<Order> orders);
}
