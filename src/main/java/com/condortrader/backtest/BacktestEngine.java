package com.condortrader.backtest;

import com.condortrader.chain.GreeksCalculator;
import com.condortrader.chain.InstrumentRegistry;
import com.condortrader.chain.IvRankTracker;
import com.condortrader.chain.OptionChain;
import com.condortrader.config.TradingProperties;
import com.condortrader.domain.model.OptionContract;
import com.condortrader.domain.model.Position;
import com.condortrader.domain.model.Tick;
import com.condortrader.engine.DecisionLoop;
import com.condortrader.engine.DecisionObserver;
import com.condortrader.engine.PositionBook;
import com.condortrader.execution.InMemoryOrderEventLog;
import com.condortrader.execution.SimulatedExecutionManager;
import com.condortrader.feed.FeedHealth;
import com.condortrader.feed.HistoricalReplayFeed;
import com.condortrader.persistence.InMemoryPositionStore;
import com.condortrader.risk.RiskLimits;
import com.condortrader.risk.RiskManager;
import com.condortrader.strategy.IronCondorConfig;
import com.condortrader.strategy.IronCondorStrategy;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Replays a recorded tick sequence through the same decision loop and strategy the live
 * session runs, with a {@link SimulatedExecutionManager} in place of the broker.
 *
 * <p>Each run builds its own chain, strategy, order log and position store, so runs are
 * independent and repeatable: the same ticks always give the same trajectory. Time comes
 * from the ticks only. After the last tick one timer step reconciles the orders still
 * pending.
 */
@Service
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    private final TradingProperties tradingProperties;
    private final IronCondorConfig ironCondorConfig;
    private final RiskManager riskManager;
    private final GreeksCalculator greeksCalculator;
    private final RiskLimits riskLimits;

    public BacktestEngine(
            TradingProperties tradingProperties,
            IronCondorConfig ironCondorConfig,
            RiskManager riskManager,
            GreeksCalculator greeksCalculator,
            RiskLimits riskLimits) {
        this.tradingProperties = tradingProperties;
        this.ironCondorConfig = ironCondorConfig;
        this.riskManager = riskManager;
        this.greeksCalculator = greeksCalculator;
        this.riskLimits = riskLimits;
    }

    public BacktestResult run(List<OptionContract> contracts, List<Tick> ticks) {
        return run(contracts, ticks, DecisionObserver.NONE);
    }

    /**
     * Runs one backtest.
     *
     * @param contracts instruments of the recorded session
     * @param ticks     recorded ticks, any order (replayed by timestamp)
     * @param observer  extra observer of the run, e.g. for event publishing
     * @throws IllegalArgumentException when there are no ticks or no contract for the tick date
     */
    public BacktestResult run(List<OptionContract> contracts, List<Tick> ticks, DecisionObserver observer) {
        HistoricalReplayFeed feed = new HistoricalReplayFeed(ticks);
        if (feed.size() == 0) {
            throw new IllegalArgumentException("Backtest needs at least one tick");
        }
        InstrumentRegistry registry = InstrumentRegistry.forNearestExpiry(
                tradingProperties.getIndex(), contracts, feed.firstTimestamp().toLocalDate());

        TradingProperties.Backtest backtest = tradingProperties.getBacktest();
        TradingProperties.IvRank ivRank = tradingProperties.getIvRank();

        OptionChain chain = new OptionChain(registry, greeksCalculator);
        IvRankTracker ivRankTracker =
                new IvRankTracker(ivRank.getLookback(), ivRank.getMinSamples(), ivRank.getSampleInterval());
        ivRankTracker.seed(ivRank.getSeed());
        SimulatedExecutionManager execution = new SimulatedExecutionManager(
                chain::snapshot,
                new InMemoryOrderEventLog(),
                BigDecimal.valueOf(backtest.getSlippageBps()),
                backtest.getLatency());
        IronCondorStrategy strategy = new IronCondorStrategy(ironCondorConfig, riskManager);
        TrajectoryRecorder recorder = new TrajectoryRecorder();

        DecisionLoop loop = new DecisionLoop(
                chain,
                strategy,
                execution,
                new PositionBook(),
                new InMemoryPositionStore(),
                ivRankTracker,
                riskLimits,
                tradingProperties.getFeed().getStaleThreshold(),
                DecisionObserver.composite(List.of(recorder, observer)));

        log.info(
                "Backtest started: index={}, expiry={}, ticks={}, from={} to={}",
                registry.getIndex(),
                registry.getExpiry(),
                feed.size(),
                feed.firstTimestamp(),
                feed.lastTimestamp());

        FeedHealth health = feed.connect(registry.subscriptionTokens(), loop::onTick);
        loop.attachFeed(health);
        int delivered = feed.replay();

        LocalDateTime end = feed.lastTimestamp().plus(backtest.getLatency());
        loop.onTimer(end);
        feed.disconnect();

        if (!execution.openOrders().isEmpty()) {
            log.warn("Backtest ended with {} open orders", execution.openOrders().size());
        }

        Optional<Position> open = strategy.activePosition();
        BigDecimal closedPnl = recorder.getClosedPositions().stream()
                .map(Position::getRealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal total = closedPnl.add(open.map(Position::getRealizedPnl).orElse(BigDecimal.ZERO));

        BacktestResult result = BacktestResult.builder()
                .index(registry.getIndex())
                .expiry(registry.getExpiry())
                .firstTick(feed.firstTimestamp())
                .lastTick(feed.lastTimestamp())
                .ticksReplayed(delivered)
                .ordersSubmitted(recorder.getOrdersSubmitted())
                .failedSteps(loop.getFailedSteps())
                .trajectory(new ArrayList<>(recorder.getPoints()))
                .closedPositions(new ArrayList<>(recorder.getClosedPositions()))
                .openPosition(open.orElse(null))
                .totalRealizedPnl(total)
                .build();

        log.info(
                "Backtest finished: ticks={}, orders={}, closedPositions={}, realizedPnl={}, failedSteps={}",
                delivered,
                result.getOrdersSubmitted(),
                result.getClosedPositions().size(),
                total,
                result.getFailedSteps());
        return result;
    }
}
