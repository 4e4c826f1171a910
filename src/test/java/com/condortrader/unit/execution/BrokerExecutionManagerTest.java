package com.condortrader.unit.execution;

import static com.condortrader.support.ChainFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.condortrader.broker.BrokerOrderRequest;
import com.condortrader.broker.BrokerOrderUpdate;
import com.condortrader.domain.enums.ExecutionEventType;
import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.OptionType;
import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.enums.OrderIntent;
import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.enums.OrderStatus;
import com.condortrader.domain.enums.OrderType;
import com.condortrader.domain.enums.RejectCode;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.Order;
import com.condortrader.exception.BrokerException;
import com.condortrader.execution.BrokerExecutionManager;
import com.condortrader.execution.InMemoryOrderEventLog;
import com.condortrader.execution.OrderEventRecord;
import com.condortrader.execution.OrderTags;
import com.condortrader.execution.RetryPolicy;
import com.condortrader.support.ChainFixtures;
import com.condortrader.support.FakeBrokerGateway;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Unit tests for BrokerExecutionManager: placement, push and poll reconciliation, retries
 * with backoff, acknowledgment timeouts and cancellation.
 *
 * <p>Most tests run broker calls inline ({@code Runnable::run}); the timing-sensitive ones
 * queue them and release them explicitly.
 */
class BrokerExecutionManagerTest {

    private static final String ORDER_ID = "NIFTY-240115-1-3";
    private static final Duration ACK_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration POLL_INTERVAL = Duration.ofSeconds(3);

    private InMemoryOrderEventLog eventLog;
    private final List<Runnable> queued = new ArrayList<>();
    private final Executor queuedExecutor = queued::add;

    @BeforeEach
    void setUp() {
        eventLog = new InMemoryOrderEventLog();
        queued.clear();
    }

    // ========================
    // HELPERS
    // ========================

    private BrokerExecutionManager manager(FakeBrokerGateway gateway, Executor executor, int maxRetries) {
        return new BrokerExecutionManager(
                gateway,
                executor,
                eventLog,
                new RetryPolicy(maxRetries, Duration.ofMillis(500), Duration.ofSeconds(5)),
                ACK_TIMEOUT,
                POLL_INTERVAL);
    }

    private BrokerExecutionManager manager(FakeBrokerGateway gateway, Executor executor) {
        return manager(gateway, executor, 3);
    }

    private static LegAction sellShortCall() {
        return LegAction.builder()
                .clientOrderId(ORDER_ID)
                .positionId("NIFTY-240115-1")
                .legId("NIFTY-240115-1-SHORT_CALL")
                .role(LegRole.SHORT_CALL)
                .contract(ChainFixtures.contract(22300, OptionType.CE))
                .side(OrderSide.SELL)
                .quantity(75)
                .orderType(OrderType.MARKET)
                .referencePrice(new BigDecimal("50"))
                .intent(OrderIntent.OPEN)
                .reason("ENTRY")
                .build();
    }

    private void runQueued() {
        List<Runnable> tasks = new ArrayList<>(queued);
        queued.clear();
        tasks.forEach(Runnable::run);
    }

    private static ListAppender<ILoggingEvent> attachAppender() {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        ((Logger) LoggerFactory.getLogger(BrokerExecutionManager.class)).addAppender(appender);
        return appender;
    }

    private static void detachAppender(ListAppender<ILoggingEvent> appender) {
        ((Logger) LoggerFactory.getLogger(BrokerExecutionManager.class)).detachAppender(appender);
    }

    private List<OrderEventType> loggedTypes() {
        return eventLog.readAll().stream().map(OrderEventRecord::getEventType).toList();
    }

    // ========================
    // PLACEMENT
    // ========================

    @Nested
    @DisplayName("Placement")
    class Placement {

        @Test
        @DisplayName("Order is sent with its tag and the pushed fill is reported on reconcile")
        void pushedFill() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(true);
            BrokerExecutionManager manager = manager(gateway, Runnable::run);

            Order order = manager.submit(sellShortCall(), T0);
            List<ExecutionEvent> events = manager.reconcile(T0);

            assertThat(gateway.getPlaced()).extracting(BrokerOrderRequest::getTag).containsExactly(OrderTags.of(ORDER_ID));
            assertThat(events)
                    .extracting(ExecutionEvent::getType)
                    .containsExactly(ExecutionEventType.ACKNOWLEDGED, ExecutionEventType.FILL);
            ExecutionEvent fill = events.get(1);
            assertThat(fill.getBrokerOrderId()).isEqualTo("B-1");
            assertThat(fill.getQuantity()).isEqualTo(75);
            assertThat(fill.getFillSeq()).isEqualTo(75);
            assertThat(fill.getPrice()).isEqualByComparingTo("50");
            assertThat(fill.fillKey()).isEqualTo("B-1:75");
            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(loggedTypes())
                    .containsExactly(
                            OrderEventType.CREATED,
                            OrderEventType.SENT,
                            OrderEventType.ACKNOWLEDGED,
                            OrderEventType.FILL);
        }

        @Test
        @DisplayName("Nothing is reported before reconcile")
        void eventsOnlyOnReconcile() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(true);
            BrokerExecutionManager manager = manager(gateway, Runnable::run);

            Order order = manager.submit(sellShortCall(), T0);

            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(manager.openOrders()).containsExactly(order);
        }

        @Test
        @DisplayName("Order-book poll finds the fill when nothing is pushed")
        void pollReconciliation() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(false);
            BrokerExecutionManager manager = manager(gateway, Runnable::run);

            Order order = manager.submit(sellShortCall(), T0);
            List<ExecutionEvent> first = manager.reconcile(T0);
            List<ExecutionEvent> second = manager.reconcile(T0.plusSeconds(1));

            assertThat(first).extracting(ExecutionEvent::getType).containsExactly(ExecutionEventType.ACKNOWLEDGED);
            assertThat(second).extracting(ExecutionEvent::getType).containsExactly(ExecutionEventType.FILL);
            assertThat(gateway.getBookFetches()).isEqualTo(1);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
        }

        @Test
        @DisplayName("A fill seen by poll and again by push is reported once")
        void duplicateUpdateIgnored() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(false);
            BrokerExecutionManager manager = manager(gateway, Runnable::run);
            manager.submit(sellShortCall(), T0);
            manager.reconcile(T0);
            manager.reconcile(T0.plusSeconds(1));

            gateway.push(gateway.fetchOrderBook().get(0));

            assertThat(manager.reconcile(T0.plusSeconds(2))).isEmpty();
            assertThat(loggedTypes()).filteredOn(OrderEventType.FILL::equals).hasSize(1);
        }

        @Test
        @DisplayName("Cumulative partial reports become incremental fills")
        void partialFills() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(false);
            BrokerExecutionManager manager = manager(gateway, queuedExecutor);
            Order order = manager.submit(sellShortCall(), T0);
            runQueued();
            manager.reconcile(T0);

            gateway.push(BrokerOrderUpdate.builder()
                    .brokerOrderId("B-1")
                    .tag(OrderTags.of(ORDER_ID))
                    .status(OrderStatus.PARTIALLY_FILLED)
                    .filledQuantity(25)
                    .averagePrice(new BigDecimal("50"))
                    .build());
            List<ExecutionEvent> first = manager.reconcile(T0.plusSeconds(1));
            gateway.push(BrokerOrderUpdate.builder()
                    .brokerOrderId("B-1")
                    .status(OrderStatus.FILLED)
                    .filledQuantity(75)
                    .averagePrice(new BigDecimal("52"))
                    .build());
            List<ExecutionEvent> second = manager.reconcile(T0.plusSeconds(2));

            assertThat(first).singleElement().satisfies(fill -> {
                assertThat(fill.getQuantity()).isEqualTo(25);
                assertThat(fill.getPrice()).isEqualByComparingTo("50");
            });
            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
            // (52 * 75 - 50 * 25) / 50
            assertThat(second).singleElement().satisfies(fill -> {
                assertThat(fill.getQuantity()).isEqualTo(50);
                assertThat(fill.getFillSeq()).isEqualTo(75);
                assertThat(fill.getPrice()).isEqualByComparingTo("53");
            });
        }

        @Test
        @DisplayName("Fill for an unknown tagged order is dropped with a reconciliation warning")
        void unknownUpdateDropped() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(false);
            BrokerExecutionManager manager = manager(gateway, queuedExecutor);
            ListAppender<ILoggingEvent> appender = attachAppender();

            try {
                gateway.push(BrokerOrderUpdate.builder()
                        .brokerOrderId("B-99")
                        .tag("SOMEONExELSE")
                        .status(OrderStatus.FILLED)
                        .filledQuantity(75)
                        .averagePrice(new BigDecimal("10"))
                        .build());

                assertThat(manager.reconcile(T0)).isEmpty();
                assertThat(manager.openOrders()).isEmpty();
                assertThat(appender.list).singleElement().satisfies(line -> {
                    assertThat(line.getLevel()).isEqualTo(Level.WARN);
                    assertThat(line.getFormattedMessage())
                            .contains("RECONCILIATION_CONFLICT")
                            .contains("brokerOrderId=B-99")
                            .contains("filled=75");
                });
            } finally {
                detachAppender(appender);
            }
        }

        @Test
        @DisplayName("Unfilled activity of another order in the account is ignored quietly")
        void foreignUnfilledUpdateIgnored() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(false);
            BrokerExecutionManager manager = manager(gateway, queuedExecutor);
            ListAppender<ILoggingEvent> appender = attachAppender();

            try {
                gateway.push(BrokerOrderUpdate.builder()
                        .brokerOrderId("B-98")
                        .status(OrderStatus.PLACED)
                        .filledQuantity(0)
                        .build());

                assertThat(manager.reconcile(T0)).isEmpty();
                assertThat(appender.list).noneMatch(line -> line.getLevel() == Level.WARN);
            } finally {
                detachAppender(appender);
            }
        }
    }

    // ========================
    // RETRIES
    // ========================

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("Network failure goes back to PENDING and is resent after the backoff")
        void transientFailureRetried() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(true);
            gateway.failNext(new BrokerException(RejectCode.NETWORK, "connection reset"));
            BrokerExecutionManager manager = manager(gateway, Runnable::run);

            Order order = manager.submit(sellShortCall(), T0);
            List<ExecutionEvent> afterFailure = manager.reconcile(T0);

            assertThat(afterFailure).isEmpty();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getRejectCode()).isEqualTo(RejectCode.NETWORK);
            assertThat(order.getNextRetryAt()).isEqualTo(T0.plusNanos(500_000_000));

            manager.reconcile(T0.plusNanos(400_000_000));
            assertThat(gateway.getPlaced()).hasSize(1);

            manager.reconcile(T0.plusNanos(500_000_000));
            List<ExecutionEvent> afterRetry = manager.reconcile(T0.plusNanos(600_000_000));

            assertThat(gateway.getPlaced()).hasSize(2);
            assertThat(order.getAttempts()).isEqualTo(2);
            assertThat(afterRetry)
                    .extracting(ExecutionEvent::getType)
                    .containsExactly(ExecutionEventType.ACKNOWLEDGED, ExecutionEventType.FILL);
            assertThat(loggedTypes()).contains(OrderEventType.RETRY_SCHEDULED);
        }

        @Test
        @DisplayName("Running out of retries rejects with RETRIES_EXHAUSTED")
        void retriesExhausted() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(true);
            gateway.failNext(new BrokerException(RejectCode.TIMEOUT, "read timed out"));
            gateway.failNext(new BrokerException(RejectCode.TIMEOUT, "read timed out"));
            BrokerExecutionManager manager = manager(gateway, Runnable::run, 1);

            Order order = manager.submit(sellShortCall(), T0);
            manager.reconcile(T0);
            manager.reconcile(T0.plusSeconds(1));
            List<ExecutionEvent> events = manager.reconcile(T0.plusSeconds(2));

            assertThat(gateway.getPlaced()).hasSize(2);
            assertThat(events).singleElement().satisfies(event -> {
                assertThat(event.getType()).isEqualTo(ExecutionEventType.REJECTED);
                assertThat(event.getRejectCode()).isEqualTo(RejectCode.RETRIES_EXHAUSTED);
            });
            assertThat(order.getStatus()).isEqualTo(OrderStatus.REJECTED);
        }

        @Test
        @DisplayName("Permanent rejection is not retried")
        void permanentRejection() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(true);
            gateway.failNext(new BrokerException(RejectCode.MARGIN_INSUFFICIENT, "Insufficient funds"));
            BrokerExecutionManager manager = manager(gateway, Runnable::run);

            manager.submit(sellShortCall(), T0);
            List<ExecutionEvent> events = manager.reconcile(T0);
            manager.reconcile(T0.plusSeconds(10));

            assertThat(gateway.getPlaced()).hasSize(1);
            assertThat(events).singleElement().satisfies(event -> {
                assertThat(event.getType()).isEqualTo(ExecutionEventType.REJECTED);
                assertThat(event.getRejectCode()).isEqualTo(RejectCode.MARGIN_INSUFFICIENT);
            });
        }

        @Test
        @DisplayName("No answer within the ack timeout schedules a retry")
        void ackTimeout() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(false);
            BrokerExecutionManager manager = manager(gateway, queuedExecutor);

            Order order = manager.submit(sellShortCall(), T0);
            manager.reconcile(T0.plusSeconds(4));
            assertThat(order.isInFlight()).isTrue();

            manager.reconcile(T0.plusSeconds(5));

            assertThat(order.isInFlight()).isFalse();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getRejectCode()).isEqualTo(RejectCode.ACK_TIMEOUT);
        }

        @Test
        @DisplayName("Late acknowledgment after a timeout is adopted without a second placement")
        void lateAckAdopted() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(false);
            BrokerExecutionManager manager = manager(gateway, queuedExecutor);
            Order order = manager.submit(sellShortCall(), T0);
            manager.reconcile(T0.plusSeconds(5));

            runQueued();
            List<ExecutionEvent> events = manager.reconcile(T0.plusSeconds(5).plusNanos(100_000_000));

            assertThat(events)
                    .extracting(ExecutionEvent::getType)
                    .containsExactly(ExecutionEventType.ACKNOWLEDGED, ExecutionEventType.FILL);
            assertThat(order.getBrokerOrderId()).isEqualTo("B-1");
            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(gateway.getPlaced()).hasSize(1);
        }
    }

    // ========================
    // CANCEL AND RESTORE
    // ========================

    @Nested
    @DisplayName("Cancel and Restore")
    class CancelAndRestore {

        @Test
        @DisplayName("Cancel while waiting for a retry cancels locally")
        void cancelUnsentOrder() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(true);
            gateway.failNext(new BrokerException(RejectCode.RATE_LIMITED, "Too many requests"));
            BrokerExecutionManager manager = manager(gateway, Runnable::run);
            Order order = manager.submit(sellShortCall(), T0);
            manager.reconcile(T0);

            manager.cancel(order, T0.plusNanos(100_000_000));
            List<ExecutionEvent> events = manager.reconcile(T0.plusSeconds(1));

            assertThat(events).extracting(ExecutionEvent::getType).containsExactly(ExecutionEventType.CANCELLED);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(gateway.getPlaced()).hasSize(1);
            assertThat(gateway.getCancelled()).isEmpty();
        }

        @Test
        @DisplayName("Cancel during placement goes to the broker once the id is known")
        void cancelInFlight() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(false);
            BrokerExecutionManager manager = manager(gateway, queuedExecutor);
            Order order = manager.submit(sellShortCall(), T0);

            manager.cancel(order, T0);
            runQueued();
            manager.reconcile(T0.plusSeconds(1));
            runQueued();

            assertThat(order.getBrokerOrderId()).isEqualTo("B-1");
            assertThat(gateway.getCancelled()).containsExactly("B-1");
        }

        @Test
        @DisplayName("Restored order without a broker id is found by tag on the first poll")
        void restoredOrderAdoptedByTag() {
            FakeBrokerGateway gateway = new FakeBrokerGateway(false);
            gateway.place(BrokerOrderRequest.builder()
                    .tag(OrderTags.of(ORDER_ID))
                    .tradingSymbol("NIFTY24JAN22300CE")
                    .exchange("NFO")
                    .side(OrderSide.SELL)
                    .orderType(OrderType.MARKET)
                    .quantity(75)
                    .price(new BigDecimal("50"))
                    .build());
            Order restored = Order.builder()
                    .id(ORDER_ID)
                    .positionId("NIFTY-240115-1")
                    .legId("NIFTY-240115-1-SHORT_CALL")
                    .role(LegRole.SHORT_CALL)
                    .intent(OrderIntent.OPEN)
                    .tradingSymbol("NIFTY24JAN22300CE")
                    .side(OrderSide.SELL)
                    .orderType(OrderType.MARKET)
                    .quantity(75)
                    .status(OrderStatus.PENDING)
                    .attempts(1)
                    .build();
            BrokerExecutionManager manager = manager(gateway, Runnable::run);

            manager.restore(List.of(restored));
            List<ExecutionEvent> first = manager.reconcile(T0);
            List<ExecutionEvent> second = manager.reconcile(T0.plusSeconds(1));

            assertThat(first).isEmpty();
            assertThat(second)
                    .extracting(ExecutionEvent::getType)
                    .containsExactly(ExecutionEventType.ACKNOWLEDGED, ExecutionEventType.FILL);
            assertThat(gateway.getPlaced()).hasSize(1);
        }
    }
}
