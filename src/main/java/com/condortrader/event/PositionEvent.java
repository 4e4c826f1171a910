package com.condortrader.event;

import com.condortrader.domain.model.Position;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an iron condor position moves through its lifecycle.
 *
 * <p>{@code occurredAt} is the decision time of the step (tick time, not wall-clock time),
 * so events from a replay carry the market time they happened at.
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;
    private final LocalDateTime occurredAt;

    public PositionEvent(Object source, Position position, PositionEventType eventType, LocalDateTime occurredAt) {
        super(source);
        this.position = position;
        this.eventType = eventType;
        this.occurredAt = occurredAt;
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
