package com.condortrader.event;

import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an order is created or changes state (acknowledged, filled, cancelled,
 * rejected).
 *
 * <p>Carries a copy of the order taken on the decision thread, so listeners may read it
 * from any thread. Listeners:
 * <ul>
 *   <li>TradingMetrics counts placed and rejected orders</li>
 *   <li>DecisionLogger writes rejections to the decision log</li>
 * </ul>
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;

    public OrderEvent(Object source, Order order, OrderEventType eventType) {
        super(source);
        this.order = order;
        this.eventType = eventType;
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }
}
