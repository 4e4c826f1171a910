package com.condortrader.strategy;

import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.Position;
import com.condortrader.risk.RiskDecision;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * What a strategy wants done after one step: orders to submit, orders to cancel, and the
 * position transitions the decision loop has to publish. Immutable.
 */
@Value
@Builder(toBuilder = true)
public class StrategyDecision {

    private static final StrategyDecision NONE = StrategyDecision.builder().build();

    /** Orders in submission order. */
    @Singular
    List<LegAction> actions;

    @Singular("cancel")
    List<String> cancelOrderIds;

    /** Risk verdict the step was taken under, null when risk was not consulted. */
    RiskDecision riskDecision;

    /** Set on the step that created a Position. */
    Position openedPosition;

    /** Set on the step that moved a Position to CLOSED. */
    Position closedPosition;

    /** Human-readable reasons, one per decision taken. */
    @Singular
    List<String> notes;

    /** Conditions the strategy cannot resolve on its own and an operator has to handle. */
    @Singular
    List<String> alerts;

    /** History the strategy wants for its net credit VWAP, null when none. */
    VwapSeedRequest vwapSeedRequest;

    public static StrategyDecision none() {
        return NONE;
    }

    public boolean hasWork() {
        return !actions.isEmpty() || !cancelOrderIds.isEmpty();
    }
}
