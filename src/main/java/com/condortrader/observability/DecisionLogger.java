package com.condortrader.observability;

import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.model.Position;
import com.condortrader.event.DecisionEvent;
import com.condortrader.event.OrderEvent;
import com.condortrader.event.PositionEvent;
import com.condortrader.event.RiskEvent;
import com.condortrader.event.SystemEvent;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Writes the audit trail of the trading core to the dedicated {@code DECISION} logger.
 *
 * <p>One line per strategy decision, risk verdict, position transition, order rejection and
 * system event. Lines carry the decision time of the step (tick time), not the time the line
 * was written, so a backtest log reads like the live one. Routing and format of the
 * {@code DECISION} logger are set in {@code logback-spring.xml}.
 */
@Service
public class DecisionLogger {

    static final String DECISION_LOGGER = "DECISION";

    private static final Logger decisions = LoggerFactory.getLogger(DECISION_LOGGER);

    @EventListener
    @Order(10)
    public void onDecision(DecisionEvent event) {
        decisions.info(
                "[{}] {} position={} {}{}",
                event.getOccurredAt(),
                event.getCategory(),
                event.getPositionId(),
                event.getMessage(),
                format(event.getContext()));
    }

    @EventListener
    @Order(10)
    public void onRisk(RiskEvent event) {
        decisions.warn("[{}] RISK position={} {}", event.getOccurredAt(), event.getPositionId(), event.getDecision());
    }

    @EventListener
    @Order(10)
    public void onPosition(PositionEvent event) {
        Position position = event.getPosition();
        decisions.info(
                "[{}] POSITION {} id={} state={} realizedPnl={} unrealizedPnl={}",
                event.getOccurredAt(),
                event.getEventType(),
                position.getId(),
                position.getState(),
                position.getRealizedPnl(),
                position.getUnrealizedPnl());
    }

    @EventListener
    @Order(10)
    public void onOrder(OrderEvent event) {
        if (event.getEventType() != OrderEventType.REJECTED) {
            return;
        }
        com.condortrader.domain.model.Order order = event.getOrder();
        decisions.warn(
                "[{}] ORDER REJECTED id={} symbol={} code={} reason={}",
                order.getUpdatedAt(),
                order.getId(),
                order.getTradingSymbol(),
                order.getRejectCode(),
                order.getRejectReason());
    }

    @EventListener
    @Order(10)
    public void onSystem(SystemEvent event) {
        decisions.info("SYSTEM {} {}{}", event.getEventType(), event.getMessage(), format(event.getDetails()));
    }

    private static String format(Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return "";
        }
        return context.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", " {", "}"));
    }
}
