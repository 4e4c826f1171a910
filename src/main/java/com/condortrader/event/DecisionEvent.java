package com.condortrader.event;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every notable decision of the trading core, for the audit trail.
 *
 * <p>Decision events capture why something happened:
 * <ul>
 *   <li>"Entry: IV rank 85.00 >= 50, shorts 22300CE/21700PE, hedges 22500CE/21500PE"</li>
 *   <li>"Roll SHORT_CALL: delta 0.35 above 0.30"</li>
 *   <li>"ForceExit(STOP_LOSS_BREACHED): unrealized -5200.00"</li>
 * </ul>
 * {@link com.condortrader.observability.DecisionLogger} writes them to the DECISION log.
 */
public class DecisionEvent extends ApplicationEvent {

    private final String category;
    private final String message;
    private final String positionId;
    private final Map<String, Object> context;
    private final LocalDateTime occurredAt;

    /**
     * @param source     the component that made the decision
     * @param category   classification: ENTRY, ADJUSTMENT, EXIT, RISK, ORDER or SYSTEM
     * @param message    human-readable description of the decision
     * @param positionId the related position, or null for process-wide decisions
     * @param context    additional structured data
     * @param occurredAt decision time (tick time during a step)
     */
    public DecisionEvent(
            Object source,
            String category,
            String message,
            String positionId,
            Map<String, Object> context,
            LocalDateTime occurredAt) {
        super(source);
        this.category = category;
        this.message = message;
        this.positionId = positionId;
        this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        this.occurredAt = occurredAt;
    }

    public String getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public String getPositionId() {
        return positionId;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
