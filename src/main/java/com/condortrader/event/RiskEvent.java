package com.condortrader.event;

import com.condortrader.risk.RiskDecision;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a risk evaluation returns anything other than Continue: a hedge
 * (roll) request or a forced exit.
 */
public class RiskEvent extends ApplicationEvent {

    private final String positionId;
    private final RiskDecision decision;
    private final LocalDateTime occurredAt;

    public RiskEvent(Object source, String positionId, RiskDecision decision, LocalDateTime occurredAt) {
        super(source);
        this.positionId = positionId;
        this.decision = decision;
        this.occurredAt = occurredAt;
    }

    /** Null when the verdict blocked an entry and no position exists yet. */
    public String getPositionId() {
        return positionId;
    }

    public RiskDecision getDecision() {
        return decision;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
