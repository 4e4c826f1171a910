package com.condortrader.unit.observability;

import static com.condortrader.support.ChainFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

import com.condortrader.config.TradingConfig;
import com.condortrader.domain.enums.FeedState;
import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.model.Order;
import com.condortrader.event.OrderEvent;
import com.condortrader.event.PositionEvent;
import com.condortrader.event.PositionEventType;
import com.condortrader.feed.FeedHealth;
import com.condortrader.observability.FeedHealthHolder;
import com.condortrader.observability.TradingMetrics;
import com.condortrader.support.PositionFixtures;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for TradingMetrics verifying the counters follow the order and position events and
 * the feed gauges read the current feed health.
 */
class TradingMetricsTest {

    private MeterRegistry meterRegistry;
    private FeedHealthHolder feedHealthHolder;
    private TradingMetrics tradingMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        feedHealthHolder = new FeedHealthHolder();
        Clock clock = Clock.fixed(
                T0.plusSeconds(12).atZone(TradingConfig.EXCHANGE_ZONE).toInstant(), TradingConfig.EXCHANGE_ZONE);
        tradingMetrics = new TradingMetrics(meterRegistry, feedHealthHolder, clock);
    }

    private double counter(String name) {
        return meterRegistry.find(name).counter().count();
    }

    private double gauge(String name) {
        return meterRegistry.find(name).gauge().value();
    }

    @Nested
    @DisplayName("Counter metrics")
    class CounterMetrics {

        @Test
        @DisplayName("orders.placed increments on ACKNOWLEDGED only")
        void ordersPlaced() {
            Order order = Order.builder().id("NIFTY-240115-1-1").build();

            tradingMetrics.onOrderEvent(new OrderEvent(this, order, OrderEventType.CREATED));
            tradingMetrics.onOrderEvent(new OrderEvent(this, order, OrderEventType.ACKNOWLEDGED));
            tradingMetrics.onOrderEvent(new OrderEvent(this, order, OrderEventType.FILL));

            assertThat(counter("condortrader.orders.placed")).isEqualTo(1.0);
            assertThat(counter("condortrader.orders.rejected")).isZero();
        }

        @Test
        @DisplayName("orders.rejected increments on REJECTED")
        void ordersRejected() {
            Order order = Order.builder().id("NIFTY-240115-1-1").build();

            tradingMetrics.onOrderEvent(new OrderEvent(this, order, OrderEventType.REJECTED));

            assertThat(counter("condortrader.orders.rejected")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("positions.closed increments on CLOSED only")
        void positionsClosed() {
            tradingMetrics.onPositionEvent(
                    new PositionEvent(this, PositionFixtures.enteredCondor(), PositionEventType.ENTERED, T0));
            tradingMetrics.onPositionEvent(
                    new PositionEvent(this, PositionFixtures.enteredCondor(), PositionEventType.CLOSED, T0));

            assertThat(counter("condortrader.positions.closed")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Feed gauges")
    class FeedGauges {

        @Test
        @DisplayName("Without a feed the gauges read disconnected and -1")
        void noFeed() {
            assertThat(gauge("condortrader.feed.connected")).isZero();
            assertThat(gauge("condortrader.feed.last.message.age")).isEqualTo(-1.0);
        }

        @Test
        @DisplayName("Connected feed reports its silence in seconds")
        void connectedFeed() {
            FeedHealth health = new FeedHealth(FeedState.CONNECTED);
            health.recordMessage(T0);
            feedHealthHolder.set(health);

            assertThat(gauge("condortrader.feed.connected")).isEqualTo(1.0);
            assertThat(gauge("condortrader.feed.last.message.age")).isEqualTo(12.0);
        }

        @Test
        @DisplayName("Reconnecting feed reads as disconnected")
        void reconnectingFeed() {
            FeedHealth health = new FeedHealth(FeedState.CONNECTED);
            health.transition(FeedState.RECONNECTING);
            feedHealthHolder.set(health);

            assertThat(gauge("condortrader.feed.connected")).isZero();
        }
    }
}
