package com.condortrader.engine;

import com.condortrader.broker.KiteBrokerGateway;
import com.condortrader.broker.KiteCandleLoader;
import com.condortrader.broker.KiteInstrumentLoader;
import com.condortrader.chain.GreeksCalculator;
import com.condortrader.chain.InstrumentRegistry;
import com.condortrader.chain.IvRankTracker;
import com.condortrader.chain.OptionChain;
import com.condortrader.config.TradingProperties;
import com.condortrader.domain.enums.ExecutionEventType;
import com.condortrader.domain.enums.FeedState;
import com.condortrader.domain.enums.RejectCode;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.OptionContract;
import com.condortrader.domain.model.Tick;
import com.condortrader.event.EventPublisherHelper;
import com.condortrader.event.EventPublishingObserver;
import com.condortrader.event.SystemEventType;
import com.condortrader.exception.ConnectionException;
import com.condortrader.exception.FeedUnavailableException;
import com.condortrader.exception.OrderRejectedException;
import com.condortrader.execution.BrokerExecutionManager;
import com.condortrader.execution.OrderEventLog;
import com.condortrader.execution.RetryPolicy;
import com.condortrader.feed.FeedHealth;
import com.condortrader.feed.FeedListener;
import com.condortrader.feed.KiteMarketDataFeed;
import com.condortrader.feed.ReconnectPolicy;
import com.condortrader.feed.TickRecorder;
import com.condortrader.observability.FeedHealthHolder;
import com.condortrader.persistence.PositionStore;
import com.condortrader.recovery.FatalShutdownHandler;
import com.condortrader.recovery.RecoveryResult;
import com.condortrader.recovery.ShutdownParticipant;
import com.condortrader.recovery.StartupRecoveryService;
import com.condortrader.risk.RiskLimits;
import com.condortrader.risk.RiskManager;
import com.condortrader.strategy.IronCondorConfig;
import com.condortrader.strategy.IronCondorStrategy;
import com.condortrader.strategy.NetCreditBar;
import com.condortrader.strategy.StrategyContext;
import com.condortrader.strategy.StrategyDecision;
import com.condortrader.strategy.VwapSeedRequest;
import com.zerodhatech.kiteconnect.KiteConnect;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Runs the trading session against Kite.
 *
 * <p>Startup, once the application is ready:
 * <ol>
 *   <li>Download the option contracts of the index and build the chain for the nearest
 *       expiry</li>
 *   <li>Build the strategy, the broker execution manager and the decision loop</li>
 *   <li>Run startup recovery on the decision thread</li>
 *   <li>Start the tick recorder (when enabled) and connect the ticker</li>
 * </ol>
 *
 * <p><b>Threading:</b> all trading state is owned by one single-thread executor, the
 * decision thread. The ticker thread only records ticks and posts them; the scheduler only
 * posts timer steps, and never more than one at a time. Broker calls run on the
 * {@code brokerIoExecutor} pool, inside the execution manager and the feed (reconnects and
 * quote snapshots).
 */
@Service
@ConditionalOnProperty(prefix = "condortrader", name = "mode", havingValue = "LIVE", matchIfMissing = true)
public class LiveTradingService implements ShutdownParticipant {

    private static final Logger log = LoggerFactory.getLogger(LiveTradingService.class);

    private static final long PERSIST_TIMEOUT_SECONDS = 5;

    private final TradingProperties tradingProperties;
    private final Clock clock;
    private final KiteConnect kiteConnect;
    private final KiteInstrumentLoader kiteInstrumentLoader;
    private final KiteCandleLoader kiteCandleLoader;
    private final KiteBrokerGateway kiteBrokerGateway;
    private final GreeksCalculator greeksCalculator;
    private final RiskManager riskManager;
    private final IronCondorConfig ironCondorConfig;
    private final RiskLimits riskLimits;
    private final OrderEventLog orderEventLog;
    private final PositionStore positionStore;
    private final StartupRecoveryService startupRecoveryService;
    private final EventPublisherHelper eventPublisherHelper;
    private final FatalShutdownHandler fatalShutdownHandler;
    private final FeedHealthHolder feedHealthHolder;
    private final Executor brokerIoExecutor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicBoolean timerPending = new AtomicBoolean(false);

    private volatile ExecutorService decisionExecutor;
    private volatile Thread decisionThread;
    private volatile DecisionLoop loop;
    private volatile KiteMarketDataFeed feed;
    private volatile TickRecorder tickRecorder;

    public LiveTradingService(
            TradingProperties tradingProperties,
            Clock clock,
            KiteConnect kiteConnect,
            KiteInstrumentLoader kiteInstrumentLoader,
            KiteCandleLoader kiteCandleLoader,
            KiteBrokerGateway kiteBrokerGateway,
            GreeksCalculator greeksCalculator,
            RiskManager riskManager,
            IronCondorConfig ironCondorConfig,
            RiskLimits riskLimits,
            OrderEventLog orderEventLog,
            PositionStore positionStore,
            StartupRecoveryService startupRecoveryService,
            EventPublisherHelper eventPublisherHelper,
            FatalShutdownHandler fatalShutdownHandler,
            FeedHealthHolder feedHealthHolder,
            @Qualifier("brokerIoExecutor") Executor brokerIoExecutor) {
        this.tradingProperties = tradingProperties;
        this.clock = clock;
        this.kiteConnect = kiteConnect;
        this.kiteInstrumentLoader = kiteInstrumentLoader;
        this.kiteCandleLoader = kiteCandleLoader;
        this.kiteBrokerGateway = kiteBrokerGateway;
        this.greeksCalculator = greeksCalculator;
        this.riskManager = riskManager;
        this.ironCondorConfig = ironCondorConfig;
        this.riskLimits = riskLimits;
        this.orderEventLog = orderEventLog;
        this.positionStore = positionStore;
        this.startupRecoveryService = startupRecoveryService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.fatalShutdownHandler = fatalShutdownHandler;
        this.feedHealthHolder = feedHealthHolder;
        this.brokerIoExecutor = brokerIoExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate tradingDay = now.toLocalDate();
        TradingProperties.Feed feedProperties = tradingProperties.getFeed();
        log.info("Starting live trading session: index={}, day={}", tradingProperties.getIndex(), tradingDay);

        decisionExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "decision");
            decisionThread = thread;
            return thread;
        });

        List<OptionContract> contracts =
                kiteInstrumentLoader.loadOptions(tradingProperties.getIndex(), feedProperties.getStrikeWindow());
        InstrumentRegistry registry =
                InstrumentRegistry.forNearestExpiry(tradingProperties.getIndex(), contracts, tradingDay);

        loop = buildLoop(registry);
        RecoveryResult recovery = onDecisionThread(() -> startupRecoveryService.recover(loop, tradingDay, now));

        if (tradingProperties.getRecorder().isEnabled()) {
            TradingProperties.Recorder recorder = tradingProperties.getRecorder();
            tickRecorder = new TickRecorder(
                    Path.of(recorder.getDirectory()), recorder.getBufferFlushSize(), recorder.isCompressOnStop());
            tickRecorder.start(tradingDay, registry.contracts());
        }

        feed = new KiteMarketDataFeed(
                tradingProperties.getKite().getApiKey(),
                tradingProperties.getKite().getAccessToken(),
                kiteConnect,
                registry,
                new ReconnectPolicy(
                        feedProperties.getReconnectInitialBackoff(),
                        feedProperties.getReconnectMaxBackoff(),
                        feedProperties.getReconnectMaxAttempts()),
                feedProperties.getHeartbeatTimeout(),
                clock,
                kiteBrokerGateway::onKiteOrderUpdate,
                brokerIoExecutor);

        FeedHealth health;
        try {
            health = feed.connect(registry.subscriptionTokens(), new SessionFeedListener());
        } catch (ConnectionException e) {
            fatalShutdownHandler.terminate(new FeedUnavailableException("Initial ticker connection failed", e));
            return;
        }
        feedHealthHolder.set(health);
        post(() -> loop.attachFeed(health));
        started.set(true);

        eventPublisherHelper.publishSystemEvent(
                this,
                SystemEventType.APPLICATION_READY,
                "Live trading started",
                Map.of(
                        "expiry", registry.getExpiry(),
                        "instruments", registry.subscriptionTokens().size(),
                        "positionsResumed", recovery.getPositionsResumed().size(),
                        "ordersRestored", recovery.getOrdersRestored()));
    }

    /** Timer step: feed watchdog and reconnects, then order reconciliation and time rules. */
    @Scheduled(fixedDelayString = "${condortrader.timer-interval:PT1S}")
    public void onTimer() {
        if (!started.get() || stopping.get() || !timerPending.compareAndSet(false, true)) {
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        post(() -> {
            timerPending.set(false);
            timerStep(now);
        });
    }

    @Override
    public void persistState() {
        DecisionLoop current = loop;
        if (current == null) {
            return;
        }
        Runnable persist = () -> {
            orderEventLog.flush();
            LocalDateTime at = current.getLastStepAt() != null ? current.getLastStepAt() : LocalDateTime.now(clock);
            current.getStrategy().activePosition().ifPresent(position -> positionStore.snapshot(position, at));
            TickRecorder recorder = tickRecorder;
            if (recorder != null) {
                recorder.flush();
            }
            log.info("Trading state persisted");
        };

        if (Thread.currentThread() == decisionThread || decisionExecutor.isShutdown()) {
            persist.run();
            return;
        }
        Future<?> future = decisionExecutor.submit(persist);
        try {
            future.get(PERSIST_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while persisting trading state");
        } catch (ExecutionException e) {
            log.error("Failed to persist trading state", e.getCause());
        } catch (TimeoutException e) {
            log.error("Decision thread did not persist state within {}s", PERSIST_TIMEOUT_SECONDS);
        }
    }

    @Override
    public void shutdown() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        started.set(false);
        log.info("Stopping live trading session...");
        persistState();

        KiteMarketDataFeed currentFeed = feed;
        if (currentFeed != null) {
            currentFeed.disconnect();
        }
        feedHealthHolder.clear();

        TickRecorder recorder = tickRecorder;
        if (recorder != null) {
            recorder.stop();
        }

        ExecutorService executor = decisionExecutor;
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(PERSIST_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Decision thread still busy after {}s, abandoning pending steps", PERSIST_TIMEOUT_SECONDS);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
        log.info("Live trading session stopped");
    }

    DecisionLoop getLoop() {
        return loop;
    }

    private DecisionLoop buildLoop(InstrumentRegistry registry) {
        TradingProperties.Execution execution = tradingProperties.getExecution();
        TradingProperties.IvRank ivRank = tradingProperties.getIvRank();

        OptionChain chain = new OptionChain(registry, greeksCalculator);
        IvRankTracker ivRankTracker =
                new IvRankTracker(ivRank.getLookback(), ivRank.getMinSamples(), ivRank.getSampleInterval());
        ivRankTracker.seed(ivRank.getSeed());

        BrokerExecutionManager executionManager = new BrokerExecutionManager(
                kiteBrokerGateway,
                brokerIoExecutor,
                orderEventLog,
                new RetryPolicy(execution.getMaxRetries(), execution.getInitialBackoff(), execution.getMaxBackoff()),
                execution.getAckTimeout(),
                execution.getPollInterval());

        return new DecisionLoop(
                chain,
                new IronCondorStrategy(ironCondorConfig, riskManager),
                executionManager,
                new PositionBook(),
                positionStore,
                ivRankTracker,
                riskLimits,
                tradingProperties.getFeed().getStaleThreshold(),
                DecisionObserver.composite(List.of(
                        new EventPublishingObserver(eventPublisherHelper, executionManager),
                        new DecisionObserver() {
                            @Override
                            public void onDecision(StrategyDecision decision, StrategyContext context, LocalDateTime at) {
                                if (decision.getVwapSeedRequest() != null) {
                                    prefillVwap(decision.getVwapSeedRequest());
                                }
                            }

                            @Override
                            public void onExecutionEvent(ExecutionEvent event) {
                                onRejection(event);
                            }
                        })));
    }

    /** An expired broker session rejects every order that follows; stop trading instead. */
    private void onRejection(ExecutionEvent event) {
        if (event.getType() != ExecutionEventType.REJECTED || event.getRejectCode() != RejectCode.AUTH_EXPIRED) {
            return;
        }
        fatalShutdownHandler.terminate(
                new OrderRejectedException(event.getOrderId(), event.getRejectCode(), event.getMessage()));
    }

    /** Loads the candidate's candles on the I/O pool and hands the bars to the decision thread. */
    private void prefillVwap(VwapSeedRequest request) {
        try {
            brokerIoExecutor.execute(() -> {
                List<NetCreditBar> bars = kiteCandleLoader.netCreditBars(request);
                if (!bars.isEmpty()) {
                    post(() -> loop.getStrategy().seedNetCreditVwap(request, bars));
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Net credit history not requested, I/O executor rejected it: {}", e.getMessage());
        }
    }

    private void timerStep(LocalDateTime now) {
        if (fatalShutdownHandler.isTerminating()) {
            return;
        }
        try {
            feed.onTimer(now);
        } catch (FeedUnavailableException e) {
            fatalShutdownHandler.terminate(e);
            return;
        } catch (RuntimeException e) {
            log.error("Feed watchdog failed at {}: {}", now, e.getMessage(), e);
        }
        loop.onTimer(now);
    }

    private void post(Runnable task) {
        try {
            decisionExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Decision thread stopped, dropping task: {}", e.getMessage());
        }
    }

    private <T> T onDecisionThread(Callable<T> task) {
        Future<T> future = decisionExecutor.submit(task);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the decision thread", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Decision thread task failed", e.getCause());
        }
    }

    /** Runs on the ticker thread: records, then hands over to the decision thread. */
    private final class SessionFeedListener implements FeedListener {

        @Override
        public void onTick(Tick tick) {
            TickRecorder recorder = tickRecorder;
            if (recorder != null) {
                recorder.record(tick);
            }
            post(() -> loop.onTick(tick));
        }

        @Override
        public void onResync(LocalDateTime at) {
            post(() -> loop.onResync(at));
            eventPublisherHelper.publishSystemEvent(
                    LiveTradingService.this, SystemEventType.FEED_RESYNC, "Ticker reconnected, requesting snapshot");
        }

        @Override
        public void onStateChange(FeedState state, LocalDateTime at) {
            SystemEventType type =
                    switch (state) {
                        case CONNECTED -> SystemEventType.FEED_CONNECTED;
                        case RECONNECTING, DISCONNECTED -> SystemEventType.FEED_DISCONNECTED;
                        case UNAVAILABLE -> SystemEventType.FEED_UNAVAILABLE;
                        default -> null;
                    };
            if (type != null) {
                eventPublisherHelper.publishSystemEvent(
                        LiveTradingService.this, type, "Feed " + state + " at " + at);
            }
        }
    }
}
