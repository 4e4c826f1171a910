package com.condortrader.event;

import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.enums.PositionState;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.Order;
import com.condortrader.domain.model.Position;
import com.condortrader.engine.DecisionObserver;
import com.condortrader.engine.StepSummary;
import com.condortrader.execution.ExecutionManager;
import com.condortrader.risk.RiskDecision;
import com.condortrader.strategy.StrategyContext;
import com.condortrader.strategy.StrategyDecision;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns what the decision loop observes into Spring application events: order and position
 * lifecycle, non-Continue risk verdicts, and one decision event per strategy note.
 *
 * <p>Position transitions that happen inside the strategy (ENTERED, ADJUSTING, EXITING) are
 * detected by comparing the state at the end of each step with the previous one.
 */
public class EventPublishingObserver implements DecisionObserver {

    private final EventPublisherHelper eventPublisherHelper;
    private final ExecutionManager execution;

    private String lastPositionId;
    private PositionState lastState;

    public EventPublishingObserver(EventPublisherHelper eventPublisherHelper, ExecutionManager execution) {
        this.eventPublisherHelper = eventPublisherHelper;
        this.execution = execution;
    }

    @Override
    public void onDecision(StrategyDecision decision, StrategyContext context, LocalDateTime at) {
        String positionId = positionId(decision);
        RiskDecision risk = decision.getRiskDecision();
        if (risk != null && risk.getType() != RiskDecision.Type.CONTINUE) {
            eventPublisherHelper.publishRiskEvent(this, positionId, risk, at);
        }
        for (String alert : decision.getAlerts()) {
            eventPublisherHelper.publishSystemEvent(this, SystemEventType.MANUAL_INTERVENTION, alert);
        }
        if (decision.getNotes().isEmpty()) {
            return;
        }
        String category = category(decision);
        Map<String, Object> details = details(context);
        for (String note : decision.getNotes()) {
            eventPublisherHelper.publishDecision(this, category, note, positionId, details, at);
        }
    }

    @Override
    public void onOrderSubmitted(Order order, LegAction action, LocalDateTime at) {
        eventPublisherHelper.publishOrderEvent(this, order.toBuilder().build(), OrderEventType.CREATED);
    }

    @Override
    public void onExecutionEvent(ExecutionEvent event) {
        OrderEventType type =
                switch (event.getType()) {
                    case ACKNOWLEDGED -> OrderEventType.ACKNOWLEDGED;
                    case FILL -> OrderEventType.FILL;
                    case REJECTED -> OrderEventType.REJECTED;
                    case CANCELLED -> OrderEventType.CANCELLED;
                };
        execution
                .order(event.getOrderId())
                .ifPresent(order -> eventPublisherHelper.publishOrderEvent(this, order.toBuilder().build(), type));
    }

    @Override
    public void onPositionOpened(Position position, LocalDateTime at) {
        eventPublisherHelper.publishPositionEvent(this, position, PositionEventType.OPENED, at);
        lastPositionId = position.getId();
        lastState = position.getState();
    }

    @Override
    public void onPositionClosed(Position position, LocalDateTime at) {
        eventPublisherHelper.publishPositionEvent(this, position, PositionEventType.CLOSED, at);
        lastPositionId = null;
        lastState = null;
    }

    @Override
    public void onStepCompleted(LocalDateTime at, StepSummary summary) {
        Position position = summary.position();
        if (position == null) {
            return;
        }
        PositionState state = position.getState();
        if (position.getId().equals(lastPositionId) && state != lastState) {
            PositionEventType type =
                    switch (state) {
                        case ENTERED -> PositionEventType.ENTERED;
                        case ADJUSTING -> PositionEventType.ADJUSTED;
                        case EXITING -> PositionEventType.EXITING;
                        default -> null;
                    };
            if (type != null) {
                eventPublisherHelper.publishPositionEvent(this, position, type, at);
            }
        }
        lastPositionId = position.getId();
        lastState = state;
    }

    @Override
    public void onStepFailed(LocalDateTime at, RuntimeException failure) {
        eventPublisherHelper.publishDecision(
                this, "SYSTEM", "Step failed: " + failure.getMessage(), lastPositionId, null, at);
    }

    private static String positionId(StrategyDecision decision) {
        if (decision.getOpenedPosition() != null) {
            return decision.getOpenedPosition().getId();
        }
        if (decision.getClosedPosition() != null) {
            return decision.getClosedPosition().getId();
        }
        return decision.getActions().isEmpty()
                ? null
                : decision.getActions().get(0).getPositionId();
    }

    private static String category(StrategyDecision decision) {
        if (decision.getOpenedPosition() != null) {
            return "ENTRY";
        }
        if (decision.getClosedPosition() != null) {
            return "EXIT";
        }
        RiskDecision risk = decision.getRiskDecision();
        if (risk != null && risk.getType() == RiskDecision.Type.HEDGE) {
            return "ADJUSTMENT";
        }
        if (risk != null && risk.getType() == RiskDecision.Type.FORCE_EXIT) {
            return "RISK";
        }
        return decision.getActions().isEmpty() ? "STRATEGY" : "ORDER";
    }

    private static Map<String, Object> details(StrategyContext context) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (context == null) {
            return details;
        }
        if (context.getSnapshot() != null && context.getSnapshot().hasSpot()) {
            details.put("spot", context.getSnapshot().getSpot());
        }
        if (context.getIvRank() != null) {
            details.put("ivRank", context.getIvRank());
        }
        if (context.getFeedStatus() != null) {
            details.put("feed", context.getFeedStatus().getState());
        }
        return details;
    }
}
