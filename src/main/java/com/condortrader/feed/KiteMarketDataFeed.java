package com.condortrader.feed;

import com.condortrader.chain.InstrumentRegistry;
import com.condortrader.domain.enums.FeedState;
import com.condortrader.domain.model.OptionContract;
import com.condortrader.domain.model.Tick;
import com.condortrader.exception.ConnectionException;
import com.condortrader.exception.FeedUnavailableException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Depth;
import com.zerodhatech.models.Quote;
import com.zerodhatech.ticker.KiteTicker;
import com.zerodhatech.ticker.OnError;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Market data from the Kite WebSocket ticker.
 *
 * <p>The SDK's own reconnection is switched off. Reconnecting is driven by {@link #onTimer}
 * from the decision loop's timer through a {@link ReconnectPolicy}, and a connection that
 * has been silent for {@code heartbeatTimeout} is treated as dead. After a successful
 * reconnect the listener gets {@link FeedListener#onResync} and a REST quote snapshot of
 * every subscribed instrument is delivered as ticks.
 *
 * <p>{@code onTimer} runs on the decision thread, so it never blocks on the network: the
 * reconnect handshake and the REST snapshot run on the I/O executor. Their outcome reaches
 * the decision thread through the {@link FeedListener} callbacks and the shared
 * {@link FeedHealth}.
 *
 * <p>Order updates travel over the same socket and are forwarded to the order-update sink
 * (the broker gateway).
 */
public class KiteMarketDataFeed implements MarketDataFeed {

    private static final Logger log = LoggerFactory.getLogger(KiteMarketDataFeed.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    /** Kite accepts up to 500 instruments per quote call. */
    static final int QUOTE_BATCH_SIZE = 500;

    private final String apiKey;
    private final String accessToken;
    private final KiteConnect kiteConnect;
    private final InstrumentRegistry registry;
    private final ReconnectPolicy reconnectPolicy;
    private final Duration heartbeatTimeout;
    private final Clock clock;
    private final Consumer<com.zerodhatech.models.Order> orderUpdateSink;
    private final Executor ioExecutor;

    private final Set<Long> subscribedTokens = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean reconnectInFlight = new AtomicBoolean(false);

    private volatile KiteTicker kiteTicker;
    private volatile FeedHealth health;
    private volatile FeedListener listener;
    private volatile boolean everConnected;
    private volatile boolean tornDown;

    public KiteMarketDataFeed(
            String apiKey,
            String accessToken,
            KiteConnect kiteConnect,
            InstrumentRegistry registry,
            ReconnectPolicy reconnectPolicy,
            Duration heartbeatTimeout,
            Clock clock,
            Consumer<com.zerodhatech.models.Order> orderUpdateSink,
            Executor ioExecutor) {
        this.apiKey = apiKey;
        this.accessToken = accessToken;
        this.kiteConnect = kiteConnect;
        this.registry = registry;
        this.reconnectPolicy = reconnectPolicy;
        this.heartbeatTimeout = heartbeatTimeout;
        this.clock = clock;
        this.orderUpdateSink = orderUpdateSink;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public FeedHealth connect(Set<Long> instruments, FeedListener feedListener) {
        synchronized (this) {
            this.listener = feedListener;
            this.subscribedTokens.addAll(instruments);
            this.health = new FeedHealth(FeedState.CONNECTING);
            this.tornDown = false;
        }

        log.info("Connecting to Kite ticker: instruments={}", instruments.size());
        openTicker();
        if (kiteTicker == null || !kiteTicker.isConnectionOpen()) {
            health.close();
            throw new ConnectionException("Kite ticker handshake failed");
        }
        return health;
    }

    @Override
    public void subscribe(Collection<Long> instruments) {
        subscribedTokens.addAll(instruments);
        KiteTicker ticker = kiteTicker;
        if (ticker != null && health != null && health.isConnected()) {
            ArrayList<Long> tokens = new ArrayList<>(instruments);
            ticker.subscribe(tokens);
            ticker.setMode(tokens, KiteTicker.modeFull);
            log.info("Subscribed {} instruments (total: {})", tokens.size(), subscribedTokens.size());
        }
    }

    @Override
    public void unsubscribe(Collection<Long> instruments) {
        subscribedTokens.removeAll(instruments);
        KiteTicker ticker = kiteTicker;
        if (ticker != null && health != null && health.isConnected()) {
            ticker.unsubscribe(new ArrayList<>(instruments));
            log.info("Unsubscribed {} instruments (total: {})", instruments.size(), subscribedTokens.size());
        }
    }

    /** Fetches the quotes on the I/O executor; they arrive at the listener as ticks. */
    @Override
    public void requestSnapshot() {
        try {
            ioExecutor.execute(this::deliverSnapshot);
        } catch (RejectedExecutionException e) {
            log.warn("Quote snapshot not requested, I/O executor rejected it: {}", e.getMessage());
        }
    }

    /** Creates the SDK ticker (overridden in tests). */
    protected KiteTicker createTicker() {
        // KiteTicker constructor order: (accessToken, apiKey)
        return new KiteTicker(accessToken, apiKey);
    }

    private void deliverSnapshot() {
        Map<String, Long> keyToToken = new HashMap<>();
        for (Long token : subscribedTokens) {
            quoteKey(token).ifPresent(key -> keyToToken.put(key, token));
        }
        if (keyToToken.isEmpty()) {
            return;
        }

        String[] keys = keyToToken.keySet().toArray(String[]::new);
        int delivered = 0;
        for (int i = 0; i < keys.length; i += QUOTE_BATCH_SIZE) {
            String[] batch = Arrays.copyOfRange(keys, i, Math.min(i + QUOTE_BATCH_SIZE, keys.length));
            for (Map.Entry<String, Quote> entry : fetchQuotes(batch).entrySet()) {
                Long token = keyToToken.get(entry.getKey());
                Tick tick = mapQuote(entry.getValue(), token != null ? token : entry.getValue().instrumentToken);
                deliver(tick);
                delivered++;
            }
        }
        log.info("Quote snapshot delivered: instruments={}", delivered);
    }

    @Override
    public void onTimer(LocalDateTime now) {
        FeedHealth current = health;
        if (tornDown || current == null) {
            return;
        }

        switch (current.getState()) {
            case UNAVAILABLE -> throw new FeedUnavailableException(
                    "Kite ticker could not reconnect after " + reconnectPolicy.getAttempts() + " attempts",
                    reconnectPolicy.getAttempts());
            case CONNECTED -> checkHeartbeat(current, now);
            case RECONNECTING -> attemptReconnect(now);
            default -> {}
        }
    }

    @Override
    public void disconnect() {
        tornDown = true;
        closeTicker();
        FeedHealth current = health;
        if (current != null) {
            current.close();
        }
        log.info("Kite ticker disconnected");
    }

    public Set<Long> getSubscribedTokens() {
        return Set.copyOf(subscribedTokens);
    }

    void handleConnected() {
        LocalDateTime now = LocalDateTime.now(clock);
        boolean resync;
        synchronized (this) {
            resync = everConnected;
            everConnected = true;
            reconnectPolicy.reset();
            health.transition(FeedState.CONNECTED);
            health.recordMessage(now);
        }
        log.info("Kite ticker connected");
        resubscribe();
        notifyState(FeedState.CONNECTED, now);

        if (resync) {
            log.info("Feed resynced after a gap, requesting quote snapshot");
            listener.onResync(now);
            requestSnapshot();
        }
    }

    void handleDisconnected() {
        if (tornDown) {
            return;
        }
        FeedState state = health.getState();
        if (state != FeedState.CONNECTED && state != FeedState.CONNECTING) {
            return;
        }
        log.warn("Kite ticker disconnected");
        scheduleReconnect(LocalDateTime.now(clock));
    }

    void handleTicks(List<com.zerodhatech.models.Tick> kiteTicks) {
        if (kiteTicks == null) {
            return;
        }
        for (com.zerodhatech.models.Tick kiteTick : kiteTicks) {
            deliver(mapTick(kiteTick));
        }
    }

    void handleOrderUpdate(com.zerodhatech.models.Order kiteOrder) {
        health.recordMessage(LocalDateTime.now(clock));
        try {
            orderUpdateSink.accept(kiteOrder);
        } catch (RuntimeException e) {
            log.error(
                    "Error processing order update for orderId={}: {}",
                    kiteOrder != null ? kiteOrder.orderId : "null",
                    e.getMessage(),
                    e);
        }
    }

    Tick mapTick(com.zerodhatech.models.Tick kiteTick) {
        Map<String, ArrayList<Depth>> depth = kiteTick.getMarketDepth();
        return Tick.builder()
                .instrumentToken(kiteTick.getInstrumentToken())
                .lastPrice(BigDecimal.valueOf(kiteTick.getLastTradedPrice()))
                .bid(depth != null ? bestPrice(depth.get("buy")) : null)
                .ask(depth != null ? bestPrice(depth.get("sell")) : null)
                .volume((long) kiteTick.getVolumeTradedToday())
                .timestamp(toLocalDateTime(kiteTick.getTickTimestamp()))
                .build();
    }

    Tick mapQuote(Quote quote, long token) {
        return Tick.builder()
                .instrumentToken(token)
                .lastPrice(BigDecimal.valueOf(quote.lastPrice))
                .bid(quote.depth != null ? bestPrice(quote.depth.buy) : null)
                .ask(quote.depth != null ? bestPrice(quote.depth.sell) : null)
                .volume((long) quote.volumeTradedToday)
                .timestamp(toLocalDateTime(quote.timestamp))
                .build();
    }

    // ---- Private helpers ----

    private void openTicker() {
        KiteTicker ticker = createTicker();
        ticker.setOnConnectedListener(this::handleConnected);
        ticker.setOnDisconnectedListener(this::handleDisconnected);
        ticker.setOnTickerArrivalListener(this::handleTicks);
        ticker.setOnOrderUpdateListener(this::handleOrderUpdate);
        ticker.setOnErrorListener(new OnError() {
            @Override
            public void onError(Exception exception) {
                log.error("Kite ticker error: {}", exception.getMessage());
            }

            @Override
            public void onError(KiteException kiteException) {
                log.error("Kite ticker KiteException: {}", kiteException.message);
            }

            @Override
            public void onError(String error) {
                log.error("Kite ticker error: {}", error);
            }
        });
        ticker.setTryReconnection(false);
        kiteTicker = ticker;
        ticker.connect();
    }

    private void closeTicker() {
        KiteTicker ticker = kiteTicker;
        if (ticker == null) {
            return;
        }
        try {
            ticker.disconnect();
        } catch (RuntimeException e) {
            log.warn("Error disconnecting ticker: {}", e.getMessage());
        }
    }

    private void checkHeartbeat(FeedHealth current, LocalDateTime now) {
        LocalDateTime last = current.getLastMessageAt();
        if (last == null || Duration.between(last, now).compareTo(heartbeatTimeout) <= 0) {
            return;
        }
        log.warn("No market data since {} (timeout {}), dropping the connection", last, heartbeatTimeout);
        scheduleReconnect(now);
        closeTicker();
    }

    private void attemptReconnect(LocalDateTime now) {
        synchronized (this) {
            if (reconnectInFlight.get() || !reconnectPolicy.isDue(now)) {
                return;
            }
            reconnectPolicy.attemptStarted();
            reconnectInFlight.set(true);
        }
        int attempt = reconnectPolicy.getAttempts();
        log.info("Reconnect attempt {}/{}", attempt, reconnectPolicy.getMaxAttempts());
        try {
            ioExecutor.execute(() -> reconnect(attempt, now));
        } catch (RejectedExecutionException e) {
            reconnectInFlight.set(false);
            log.warn("Reconnect attempt {} not started: {}", attempt, e.getMessage());
            scheduleReconnect(now);
        }
    }

    /** Runs on the I/O executor; a failed handshake schedules the next attempt. */
    private void reconnect(int attempt, LocalDateTime scheduledAt) {
        try {
            if (tornDown) {
                return;
            }
            try {
                openTicker();
            } catch (RuntimeException e) {
                log.warn("Reconnect attempt {} failed: {}", attempt, e.getMessage());
            }
            if (tornDown) {
                closeTicker();
                return;
            }
            KiteTicker ticker = kiteTicker;
            if (health.getState() != FeedState.CONNECTED && (ticker == null || !ticker.isConnectionOpen())) {
                LocalDateTime now = LocalDateTime.now(clock);
                scheduleReconnect(now.isBefore(scheduledAt) ? scheduledAt : now);
            }
        } finally {
            reconnectInFlight.set(false);
        }
    }

    private void scheduleReconnect(LocalDateTime now) {
        FeedState next;
        synchronized (this) {
            if (reconnectPolicy.scheduleNext(now)) {
                next = FeedState.RECONNECTING;
                log.info(
                        "Reconnect {} of {} scheduled at {}",
                        reconnectPolicy.getAttempts(),
                        reconnectPolicy.getMaxAttempts(),
                        reconnectPolicy.getNextAttemptAt());
            } else {
                next = FeedState.UNAVAILABLE;
                log.error(
                        "Kite ticker failed to reconnect after {} attempts, feed unavailable",
                        reconnectPolicy.getAttempts());
            }
            health.transition(next);
        }
        notifyState(next, now);
    }

    private void resubscribe() {
        KiteTicker ticker = kiteTicker;
        if (!subscribedTokens.isEmpty() && ticker != null) {
            ArrayList<Long> tokens = new ArrayList<>(subscribedTokens);
            ticker.subscribe(tokens);
            ticker.setMode(tokens, KiteTicker.modeFull);
            log.info("Subscribed {} instruments", tokens.size());
        }
    }

    private void deliver(Tick tick) {
        health.recordMessage(LocalDateTime.now(clock));
        listener.onTick(tick);
    }

    private void notifyState(FeedState state, LocalDateTime at) {
        FeedListener current = listener;
        if (current != null) {
            current.onStateChange(state, at);
        }
    }

    private Optional<String> quoteKey(long token) {
        if (registry.isSpot(token)) {
            return Optional.of(registry.getIndex().getSpotSymbol());
        }
        return registry.contract(token).map(KiteMarketDataFeed::quoteKey);
    }

    private static String quoteKey(OptionContract contract) {
        return contract.getExchange() + ":" + contract.getTradingSymbol();
    }

    private Map<String, Quote> fetchQuotes(String[] keys) {
        try {
            return kiteConnect.getQuote(keys);
        } catch (KiteException e) {
            log.error("Failed to fetch quote snapshot from Kite: {}", e.message);
            return Map.of();
        } catch (JSONException | IOException e) {
            log.error("Failed to fetch quote snapshot from Kite", e);
            return Map.of();
        }
    }

    private static BigDecimal bestPrice(List<Depth> levels) {
        if (levels == null || levels.isEmpty() || levels.get(0) == null) {
            return null;
        }
        double price = levels.get(0).getPrice();
        return price > 0 ? BigDecimal.valueOf(price) : null;
    }

    private LocalDateTime toLocalDateTime(Date date) {
        if (date == null) {
            return LocalDateTime.now(clock);
        }
        return date.toInstant().atZone(IST).toLocalDateTime();
    }
}
