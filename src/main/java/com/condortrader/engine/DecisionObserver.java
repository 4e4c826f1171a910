package com.condortrader.engine;

import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.Order;
import com.condortrader.domain.model.Position;
import com.condortrader.strategy.StrategyContext;
import com.condortrader.strategy.StrategyDecision;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Side channel of the decision loop: everything it decides and observes, for logging,
 * events, metrics and backtest trajectories. Called synchronously on the decision thread;
 * implementations must not mutate what they are handed.
 */
public interface DecisionObserver {

    DecisionObserver NONE = new DecisionObserver() {};

    /** A decision with work or notes; {@code context} is null for decisions taken on a fill. */
    default void onDecision(StrategyDecision decision, StrategyContext context, LocalDateTime at) {}

    default void onOrderSubmitted(Order order, LegAction action, LocalDateTime at) {}

    default void onExecutionEvent(ExecutionEvent event) {}

    default void onPositionOpened(Position position, LocalDateTime at) {}

    default void onPositionClosed(Position position, LocalDateTime at) {}

    /** End of a step, with the strategy's view after all decisions were applied. */
    default void onStepCompleted(LocalDateTime at, StepSummary summary) {}

    default void onStepFailed(LocalDateTime at, RuntimeException failure) {}

    static DecisionObserver composite(List<DecisionObserver> observers) {
        List<DecisionObserver> copy = List.copyOf(observers);
        return new DecisionObserver() {
            @Override
            public void onDecision(StrategyDecision decision, StrategyContext context, LocalDateTime at) {
                copy.forEach(o -> o.onDecision(decision, context, at));
            }

            @Override
            public void onOrderSubmitted(Order order, LegAction action, LocalDateTime at) {
                copy.forEach(o -> o.onOrderSubmitted(order, action, at));
            }

            @Override
            public void onExecutionEvent(ExecutionEvent event) {
                copy.forEach(o -> o.onExecutionEvent(event));
            }

            @Override
            public void onPositionOpened(Position position, LocalDateTime at) {
                copy.forEach(o -> o.onPositionOpened(position, at));
            }

            @Override
            public void onPositionClosed(Position position, LocalDateTime at) {
                copy.forEach(o -> o.onPositionClosed(position, at));
            }

            @Override
            public void onStepCompleted(LocalDateTime at, StepSummary summary) {
                copy.forEach(o -> o.onStepCompleted(at, summary));
            }

            @Override
            public void onStepFailed(LocalDateTime at, RuntimeException failure) {
                copy.forEach(o -> o.onStepFailed(at, failure));
            }
        };
    }
}
