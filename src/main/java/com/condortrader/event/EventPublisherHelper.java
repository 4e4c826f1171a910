package com.condortrader.event;

import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.model.Order;
import com.condortrader.domain.model.Position;
import com.condortrader.risk.RiskDecision;
import java.time.LocalDateTime;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the trading events.
 *
 * <p>Delivery is synchronous ({@code @EventListener} without {@code @Async}): listeners run
 * on the publishing thread, which for order, position, risk and decision events is the
 * decision thread. Listeners must therefore stay cheap and must not block.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderEvent(Object source, Order order, OrderEventType eventType) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, eventType));
    }

    // ---- Position ----

    public void publishPositionEvent(
            Object source, Position position, PositionEventType eventType, LocalDateTime occurredAt) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, eventType, occurredAt));
    }

    // ---- Risk ----

    public void publishRiskEvent(Object source, String positionId, RiskDecision decision, LocalDateTime occurredAt) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, positionId, decision, occurredAt));
    }

    // ---- System ----

    public void publishSystemEvent(Object source, SystemEventType eventType, String message) {
        applicationEventPublisher.publishEvent(new SystemEvent(source, eventType, message));
    }

    public void publishSystemEvent(
            Object source, SystemEventType eventType, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new SystemEvent(source, eventType, message, details));
    }

    // ---- Decision ----

    public void publishDecision(
            Object source,
            String category,
            String message,
            String positionId,
            Map<String, Object> context,
            LocalDateTime occurredAt) {
        applicationEventPublisher.publishEvent(
                new DecisionEvent(source, category, message, positionId, context, occurredAt));
    }
}
