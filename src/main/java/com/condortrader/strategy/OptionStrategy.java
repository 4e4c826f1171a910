package com.condortrader.strategy;

import com.condortrader.domain.enums.PositionState;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.Position;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Contract for option strategies driven by the decision loop.
 *
 * <p>All methods are called on the decision thread only. A strategy owns its Position:
 * nothing else mutates it, and it hands out work (orders, cancels) through the returned
 * {@link StrategyDecision} instead of calling the broker.
 */
public interface OptionStrategy {

    String getName();

    /** Evaluate entry, risk, adjustments and exits against the current chain. */
    StrategyDecision evaluate(StrategyContext context);

    /** Apply an execution event of one of this strategy's orders. */
    StrategyDecision onExecutionEvent(ExecutionEvent event, LocalDateTime now);

    /** Adopt a Position rebuilt from persisted state at startup. */
    void resume(Position position);

    /** Restores how many positions were already entered on the given trading day. */
    void restoreDailyEntries(LocalDate tradingDay, int entries);

    /** Delivers the history asked for by a {@link StrategyDecision#getVwapSeedRequest()}. */
    default void seedNetCreditVwap(VwapSeedRequest request, List<NetCreditBar> bars) {}

    PositionState currentState();

    Optional<Position> activePosition();
}
