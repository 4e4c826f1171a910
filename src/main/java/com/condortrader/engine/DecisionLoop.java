package com.condortrader.engine;

import com.condortrader.chain.IvRankTracker;
import com.condortrader.chain.OptionChain;
import com.condortrader.domain.enums.FeedState;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.FeedStatus;
import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.OptionChainSnapshot;
import com.condortrader.domain.model.Order;
import com.condortrader.domain.model.Position;
import com.condortrader.domain.model.Tick;
import com.condortrader.execution.ExecutionManager;
import com.condortrader.feed.FeedHealth;
import com.condortrader.persistence.PositionStore;
import com.condortrader.risk.RiskLimits;
import com.condortrader.strategy.OptionStrategy;
import com.condortrader.strategy.StrategyContext;
import com.condortrader.strategy.StrategyDecision;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single-threaded core shared by live trading and backtests.
 *
 * <p>One step, on a tick or on the timer:
 * <ol>
 *   <li>apply the tick to the option chain (tick steps only)</li>
 *   <li>reconcile the execution manager and feed each event to the strategy</li>
 *   <li>sample the ATM IV for the IV rank</li>
 *   <li>evaluate the strategy and carry out its decision: cancels, then new orders</li>
 *   <li>claim or release instruments, snapshot or archive the position</li>
 * </ol>
 *
 * <p>The decision time is the newest tick timestamp on tick steps and the caller's clock on
 * timer steps; nothing in here reads the wall clock. A failing step is logged and the loop
 * carries on with the next one.
 *
 * <p>Not thread-safe: every call must come from the decision thread.
 */
public class DecisionLoop {

    private static final Logger log = LoggerFactory.getLogger(DecisionLoop.class);

    static final String STEP_TICK = "TICK";
    static final String STEP_TIMER = "TIMER";

    private final OptionChain chain;
    private final OptionStrategy strategy;
    private final ExecutionManager execution;
    private final PositionBook positionBook;
    private final PositionStore positionStore;
    private final IvRankTracker ivRankTracker;
    private final RiskLimits riskLimits;
    private final Duration staleThreshold;
    private final DecisionObserver observer;

    private FeedHealth feedHealth;
    private LocalDateTime lastStepAt;
    private long failedSteps;

    public DecisionLoop(
            OptionChain chain,
            OptionStrategy strategy,
            ExecutionManager execution,
            PositionBook positionBook,
            PositionStore positionStore,
            IvRankTracker ivRankTracker,
            RiskLimits riskLimits,
            Duration staleThreshold,
            DecisionObserver observer) {
        this.chain = chain;
        this.strategy = strategy;
        this.execution = execution;
        this.positionBook = positionBook;
        this.positionStore = positionStore;
        this.ivRankTracker = ivRankTracker;
        this.riskLimits = riskLimits;
        this.staleThreshold = staleThreshold;
        this.observer = observer != null ? observer : DecisionObserver.NONE;
    }

    /** Binds the health handle of the current feed connection. */
    public void attachFeed(FeedHealth health) {
        this.feedHealth = health;
    }

    /** Puts orders rebuilt from the order-event log back under execution management. */
    public void restoreOrders(Collection<Order> openOrders) {
        execution.restore(openOrders);
    }

    /**
     * Adopts a position rebuilt at startup: the strategy resumes it, its instruments are
     * claimed, and fills logged after its last snapshot are applied again. Fills the
     * snapshot already holds are ignored by the strategy's fill dedupe.
     */
    public void resume(Position position, List<ExecutionEvent> missedFills, LocalDateTime now) {
        strategy.resume(position);
        positionBook.claim(position);
        log.info(
                "Resumed position {} in state {}, replaying {} fills",
                position.getId(),
                position.getState(),
                missedFills.size());
        for (ExecutionEvent fill : missedFills) {
            apply(strategy.onExecutionEvent(fill, now), null, now);
        }
        strategy.activePosition().ifPresent(active -> positionStore.snapshot(active, now));
    }

    public void onTick(Tick tick) {
        long versionBefore = chain.getVersion();
        try {
            chain.apply(tick);
        } catch (RuntimeException e) {
            failed(tick.getTimestamp(), e);
            return;
        }
        if (chain.getVersion() == versionBefore) {
            return;
        }
        LocalDateTime now = chain.snapshot().getAsOf();
        step(later(now), true, STEP_TICK);
    }

    /** Timer step: reconciles orders and re-evaluates time and staleness rules without a tick. */
    public void onTimer(LocalDateTime now) {
        step(later(now), false, STEP_TIMER);
    }

    public void onResync(LocalDateTime at) {
        log.warn("Market data resync at {}: quotes between the gap and the snapshot are lost", at);
    }

    public OptionStrategy getStrategy() {
        return strategy;
    }

    public ExecutionManager getExecution() {
        return execution;
    }

    public OptionChain getChain() {
        return chain;
    }

    public long getFailedSteps() {
        return failedSteps;
    }

    public LocalDateTime getLastStepAt() {
        return lastStepAt;
    }

    // ---- Step ----

    private void step(LocalDateTime now, boolean chainUpdated, String kind) {
        lastStepAt = now;
        try {
            for (ExecutionEvent event : execution.reconcile(now)) {
                observer.onExecutionEvent(event);
                apply(strategy.onExecutionEvent(event, now), null, now);
            }

            OptionChainSnapshot snapshot = chain.snapshot();
            Optional<BigDecimal> atmIv = snapshot.atmImpliedVolatility();
            if (chainUpdated) {
                atmIv.ifPresent(iv -> ivRankTracker.observe(iv, now));
            }

            StrategyContext context = StrategyContext.builder()
                    .snapshot(snapshot)
                    .now(now)
                    .feedStatus(feedStatus(now))
                    .riskLimits(riskLimits)
                    .ivRank(atmIv.flatMap(ivRankTracker::ivRank).orElse(null))
                    .openPositions(positionBook.openCount())
                    .claimedInstruments(positionBook.claimedExcept(
                            strategy.activePosition().map(Position::getId).orElse(null)))
                    .build();
            apply(strategy.evaluate(context), context, now);

            observer.onStepCompleted(
                    now, new StepSummary(strategy.currentState(), strategy.activePosition().orElse(null), kind));
        } catch (RuntimeException e) {
            failed(now, e);
        }
    }

    private void apply(StrategyDecision decision, StrategyContext context, LocalDateTime now) {
        if (decision == null) {
            return;
        }
        if (!decision.getNotes().isEmpty()
                || !decision.getAlerts().isEmpty()
                || decision.hasWork()
                || decision.getRiskDecision() != null
                || decision.getVwapSeedRequest() != null) {
            observer.onDecision(decision, context, now);
        }

        Position opened = decision.getOpenedPosition();
        if (opened != null) {
            positionBook.claim(opened);
            observer.onPositionOpened(opened, now);
        }

        for (String orderId : decision.getCancelOrderIds()) {
            Optional<Order> order = execution.order(orderId);
            if (order.isPresent()) {
                execution.cancel(order.get(), now);
            } else {
                log.warn("Cancel requested for unknown order {}", orderId);
            }
        }

        for (LegAction action : decision.getActions()) {
            if (execution.order(action.getClientOrderId()).isPresent()) {
                // replayed after a restart, the order already exists
                log.warn("Order {} already submitted, skipping", action.getClientOrderId());
                continue;
            }
            Order order = execution.submit(action, now);
            observer.onOrderSubmitted(order, action, now);
        }

        Position closed = decision.getClosedPosition();
        if (closed != null) {
            positionBook.release(closed.getId());
            positionStore.archive(closed, now);
            observer.onPositionClosed(closed, now);
            return;
        }

        if (decision.hasWork() || opened != null) {
            Optional<Position> active = strategy.activePosition();
            if (active.isPresent()) {
                positionBook.claim(active.get());
                positionStore.snapshot(active.get(), now);
            }
        }
    }

    private FeedStatus feedStatus(LocalDateTime now) {
        if (feedHealth == null) {
            return new FeedStatus(FeedState.DISCONNECTED, null, true);
        }
        return feedHealth.status(now, staleThreshold);
    }

    private LocalDateTime later(LocalDateTime candidate) {
        if (lastStepAt != null && candidate.isBefore(lastStepAt)) {
            return lastStepAt;
        }
        return candidate;
    }

    private void failed(LocalDateTime at, RuntimeException e) {
        failedSteps++;
        log.error("Decision step at {} failed: {}", at, e.getMessage(), e);
        observer.onStepFailed(at, e);
    }
}
