package com.condortrader.observability;

import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.event.OrderEvent;
import com.condortrader.event.PositionEvent;
import com.condortrader.event.PositionEventType;
import com.condortrader.feed.FeedHealth;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the Micrometer metrics of the trading core:
 * <ul>
 *   <li><b>condortrader.orders.placed</b> (counter): orders acknowledged by the venue</li>
 *   <li><b>condortrader.orders.rejected</b> (counter): orders ending REJECTED</li>
 *   <li><b>condortrader.positions.closed</b> (counter): positions that reached CLOSED</li>
 *   <li><b>condortrader.feed.connected</b> (gauge 0/1): market data connection state</li>
 *   <li><b>condortrader.feed.last.message.age</b> (gauge, seconds): silence of the feed,
 *       -1 before the first message</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily on scrape from the {@link FeedHealthHolder}; counters are
 * incremented from application event listeners.
 */
@Service
public class TradingMetrics {

    private final Counter ordersPlacedCounter;
    private final Counter ordersRejectedCounter;
    private final Counter positionsClosedCounter;
    private final FeedHealthHolder feedHealthHolder;
    private final Clock clock;

    public TradingMetrics(MeterRegistry meterRegistry, FeedHealthHolder feedHealthHolder, Clock clock) {
        this.feedHealthHolder = feedHealthHolder;
        this.clock = clock;

        this.ordersPlacedCounter = Counter.builder("condortrader.orders.placed")
                .description("Orders acknowledged by the broker or the simulator")
                .register(meterRegistry);

        this.ordersRejectedCounter = Counter.builder("condortrader.orders.rejected")
                .description("Orders that ended REJECTED")
                .register(meterRegistry);

        this.positionsClosedCounter = Counter.builder("condortrader.positions.closed")
                .description("Iron condor positions closed")
                .register(meterRegistry);

        Gauge.builder("condortrader.feed.connected", this, TradingMetrics::feedConnected)
                .description("1 while the market data feed is connected")
                .register(meterRegistry);

        Gauge.builder("condortrader.feed.last.message.age", this, TradingMetrics::lastMessageAgeSeconds)
                .description("Seconds since the last market data message")
                .baseUnit("seconds")
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        if (event.getEventType() == OrderEventType.ACKNOWLEDGED) {
            ordersPlacedCounter.increment();
        } else if (event.getEventType() == OrderEventType.REJECTED) {
            ordersRejectedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        if (event.getEventType() == PositionEventType.CLOSED) {
            positionsClosedCounter.increment();
        }
    }

    double feedConnected() {
        return feedHealthHolder.current().map(h -> h.isConnected() ? 1.0 : 0.0).orElse(0.0);
    }

    double lastMessageAgeSeconds() {
        return feedHealthHolder
                .current()
                .map(FeedHealth::getLastMessageAt)
                .map(last -> Duration.between(last, LocalDateTime.now(clock)).toMillis() / 1000.0)
                .orElse(-1.0);
    }
}
