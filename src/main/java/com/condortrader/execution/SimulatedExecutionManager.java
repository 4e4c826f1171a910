package com.condortrader.execution;

import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.OptionChainEntry;
import com.condortrader.domain.model.OptionChainSnapshot;
import com.condortrader.domain.model.Order;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Execution manager for backtests: fills every order at the quote, without a broker.
 *
 * <p>Fill price: ask for buys, bid for sells, falling back to the last traded price, then to
 * the order's reference price; adjusted by {@code slippageBps} against the order. Without
 * latency the quote is the one at submission; with latency the quote at the fill time.
 *
 * <p>Fills are reported on the first {@link #reconcile} at or after submission + latency,
 * never inside {@link #submit}, which matches the live pipeline where broker results are
 * picked up on the next reconcile.
 */
public class SimulatedExecutionManager extends AbstractExecutionManager {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExecutionManager.class);

    private static final BigDecimal BPS = BigDecimal.valueOf(10_000);

    private final Supplier<OptionChainSnapshot> quotes;
    private final BigDecimal slippageBps;
    private final Duration latency;

    private final Map<String, PendingFill> pendingFills = new HashMap<>();
    private long brokerSequence;

    public SimulatedExecutionManager(
            Supplier<OptionChainSnapshot> quotes, OrderEventLog orderEventLog, BigDecimal slippageBps, Duration latency) {
        super(orderEventLog);
        this.quotes = quotes;
        this.slippageBps = slippageBps != null ? slippageBps : BigDecimal.ZERO;
        this.latency = latency != null ? latency : Duration.ZERO;
    }

    @Override
    public Order submit(LegAction action, LocalDateTime now) {
        Order order = createOrder(action, now);
        order.setAttempts(1);
        BigDecimal quoted = latency.isZero() ? quotePrice(order).orElse(null) : null;
        pendingFills.put(order.getId(), new PendingFill(now.plus(latency), quoted));
        return order;
    }

    @Override
    public void cancel(Order order, LocalDateTime now) {
        if (order.getStatus().isTerminal()) {
            return;
        }
        order.setCancelRequested(true);
        pendingFills.remove(order.getId());
        recordCancelled(order, now);
    }

    @Override
    public List<ExecutionEvent> reconcile(LocalDateTime now) {
        for (Order order : new ArrayList<>(orders.values())) {
            PendingFill pending = pendingFills.get(order.getId());
            if (pending == null || now.isBefore(pending.dueAt())) {
                continue;
            }
            Optional<BigDecimal> price =
                    pending.quotedPrice() != null ? Optional.of(pending.quotedPrice()) : quotePrice(order);
            if (price.isEmpty()) {
                log.debug("No quote to fill simulated order {}, waiting", order.getId());
                continue;
            }
            pendingFills.remove(order.getId());
            recordAcknowledged(order, "SIM-" + (++brokerSequence), now);
            recordCumulativeFill(order, order.getQuantity(), withSlippage(price.get(), order.getSide()), now);
        }
        return drainEvents();
    }

    @Override
    public void restore(Collection<Order> restored) {
        restored.forEach(order -> orders.put(order.getId(), order));
    }

    private Optional<BigDecimal> quotePrice(Order order) {
        OptionChainSnapshot snapshot = quotes.get();
        Optional<OptionChainEntry> entry =
                snapshot != null ? snapshot.entryByToken(order.getInstrumentToken()) : Optional.empty();
        if (entry.isPresent()) {
            BigDecimal touch = order.getSide() == OrderSide.BUY ? entry.get().getAsk() : entry.get().getBid();
            if (touch != null && touch.signum() > 0) {
                return Optional.of(touch);
            }
            if (entry.get().getPrice() != null) {
                return Optional.of(entry.get().getPrice());
            }
        }
        return Optional.ofNullable(order.getPrice());
    }

    private BigDecimal withSlippage(BigDecimal price, OrderSide side) {
        if (slippageBps.signum() == 0) {
            return price;
        }
        BigDecimal factor = BigDecimal.ONE.add(
                slippageBps.multiply(BigDecimal.valueOf(side.sign())).divide(BPS, 8, RoundingMode.HALF_UP));
        return price.multiply(factor).setScale(2, RoundingMode.HALF_UP);
    }

    private record PendingFill(LocalDateTime dueAt, BigDecimal quotedPrice) {}
}
