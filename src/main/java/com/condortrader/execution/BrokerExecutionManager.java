package com.condortrader.execution;

import com.condortrader.broker.BrokerGateway;
import com.condortrader.broker.BrokerOrderRequest;
import com.condortrader.broker.BrokerOrderUpdate;
import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.enums.OrderStatus;
import com.condortrader.domain.enums.RejectCode;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.Order;
import com.condortrader.exception.BrokerException;
import com.condortrader.exception.ReconciliationConflictException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live execution manager: places orders through a {@link BrokerGateway} and reconciles
 * them from pushed updates and order-book polls.
 *
 * <p><b>Threading:</b> every gateway call runs on the I/O executor. Results, push updates
 * and poll results land in a lock-free inbox; only {@link #reconcile} (decision thread)
 * drains it and touches order state.
 *
 * <p><b>Retry state</b> lives on the {@link Order} and is evaluated on each reconcile:
 * <ul>
 *   <li>A transient failure (timeout, network, rate limit) returns the order to PENDING
 *       with {@code nextRetryAt = now + backoff(attempts)}</li>
 *   <li>A placement without a result after {@code ackTimeout} counts as ACK_TIMEOUT</li>
 *   <li>After {@code maxRetries} retries, or on a permanent code, the order is REJECTED</li>
 * </ul>
 *
 * <p><b>Matching:</b> updates are matched by broker order id, then by order tag. The tag
 * match adopts orders whose placement call timed out although the broker accepted them.
 *
 * <p><b>Idempotence:</b> broker reports are cumulative; a fill is emitted only when the
 * cumulative filled quantity grows, keyed by broker id plus that quantity.
 */
public class BrokerExecutionManager extends AbstractExecutionManager {

    private static final Logger log = LoggerFactory.getLogger(BrokerExecutionManager.class);

    private final BrokerGateway brokerGateway;
    private final Executor ioExecutor;
    private final RetryPolicy retryPolicy;
    private final Duration ackTimeout;
    private final Duration pollInterval;

    private final Map<String, String> orderIdByBrokerId = new HashMap<>();
    private final Map<String, String> orderIdByTag = new HashMap<>();
    private final Queue<InboxItem> inbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean pollInFlight = new AtomicBoolean();

    private LocalDateTime lastPollAt;

    public BrokerExecutionManager(
            BrokerGateway brokerGateway,
            Executor ioExecutor,
            OrderEventLog orderEventLog,
            RetryPolicy retryPolicy,
            Duration ackTimeout,
            Duration pollInterval) {
        super(orderEventLog);
        this.brokerGateway = brokerGateway;
        this.ioExecutor = ioExecutor;
        this.retryPolicy = retryPolicy;
        this.ackTimeout = ackTimeout;
        this.pollInterval = pollInterval;
        brokerGateway.setOrderUpdateListener(update -> inbox.add(new PushedUpdate(update)));
    }

    // ========================
    // COMMANDS
    // ========================

    @Override
    public Order submit(LegAction action, LocalDateTime now) {
        Order order = createOrder(action, now);
        orderIdByTag.put(OrderTags.of(order.getId()), order.getId());
        dispatch(order, now);
        return order;
    }

    @Override
    public void cancel(Order order, LocalDateTime now) {
        if (order.getStatus().isTerminal() || order.isCancelRequested()) {
            return;
        }
        order.setCancelRequested(true);
        record(order, OrderEventType.CANCEL_REQUESTED, now);

        if (order.getBrokerOrderId() != null) {
            sendCancel(order.getId(), order.getBrokerOrderId());
        } else if (!order.isInFlight()) {
            // never reached the broker
            recordCancelled(order, now);
        }
        // in flight: the cancel goes out when the placement result arrives
    }

    @Override
    public void restore(Collection<Order> restored) {
        for (Order order : restored) {
            orders.put(order.getId(), order);
            orderIdByTag.put(OrderTags.of(order.getId()), order.getId());
            if (order.getBrokerOrderId() != null) {
                orderIdByBrokerId.put(order.getBrokerOrderId(), order.getId());
            } else if (order.getAttempts() > 0) {
                // the last placement may have reached the broker; wait for a poll to find it by tag
                order.setInFlight(true);
                order.setLastSentAt(null);
            }
        }
        lastPollAt = null;
        log.info("Restored {} open orders", restored.size());
    }

    // ========================
    // RECONCILIATION
    // ========================

    @Override
    public List<ExecutionEvent> reconcile(LocalDateTime now) {
        InboxItem item;
        while ((item = inbox.poll()) != null) {
            process(item, now);
        }

        for (Order order : new ArrayList<>(orders.values())) {
            if (order.getStatus().isTerminal()) {
                continue;
            }
            if (order.isInFlight() && order.getBrokerOrderId() == null) {
                if (order.getLastSentAt() == null) {
                    order.setLastSentAt(now);
                } else if (!now.isBefore(order.getLastSentAt().plus(ackTimeout))) {
                    order.setInFlight(false);
                    if (order.isCancelRequested()) {
                        recordCancelled(order, now);
                    } else {
                        failTransient(order, RejectCode.ACK_TIMEOUT, "No acknowledgment within " + ackTimeout, now);
                    }
                }
            } else if (order.getStatus() == OrderStatus.PENDING
                    && !order.isInFlight()
                    && !order.isCancelRequested()
                    && !now.isBefore(order.getNextRetryAt())) {
                dispatch(order, now);
            }
        }

        pollIfDue(now);
        return drainEvents();
    }

    private void process(InboxItem item, LocalDateTime now) {
        if (item instanceof PlacementResult result) {
            onPlacementResult(result, now);
        } else if (item instanceof PushedUpdate pushed) {
            onBrokerUpdate(pushed.update(), true, now);
        } else if (item instanceof PollResult poll) {
            pollInFlight.set(false);
            if (poll.error() != null) {
                log.warn("Order book poll failed: {}", poll.error().getMessage());
                return;
            }
            poll.updates().forEach(update -> onBrokerUpdate(update, false, now));
        } else if (item instanceof CancelResult cancel) {
            log.warn("Cancel failed: order={}, reason={}", cancel.orderId(), cancel.error().getMessage());
        }
    }

    private void onPlacementResult(PlacementResult result, LocalDateTime now) {
        Order order = orders.get(result.orderId());
        if (order == null) {
            return;
        }

        if (result.error() != null) {
            if (result.attempt() != order.getAttempts() || !order.isInFlight()) {
                log.debug("Stale placement failure ignored: order={}, attempt={}", order.getId(), result.attempt());
                return;
            }
            order.setInFlight(false);
            BrokerException error = result.error();
            if (order.isCancelRequested()) {
                recordCancelled(order, now);
            } else if (error.isRetryable()) {
                failTransient(order, error.getRejectCode(), error.getMessage(), now);
            } else {
                recordRejected(order, error.getRejectCode(), error.getMessage(), now);
            }
            return;
        }

        String brokerOrderId = result.brokerOrderId();
        if (order.getBrokerOrderId() != null && !order.getBrokerOrderId().equals(brokerOrderId)) {
            // a retry after an ack timeout reached the broker twice
            log.warn(
                    "Duplicate placement detected: order={}, kept={}, cancelling={}",
                    order.getId(),
                    order.getBrokerOrderId(),
                    brokerOrderId);
            sendCancel(order.getId(), brokerOrderId);
            return;
        }
        if (order.getBrokerOrderId() == null) {
            adopt(order, brokerOrderId, now);
        }
    }

    private void onBrokerUpdate(BrokerOrderUpdate update, boolean pushed, LocalDateTime now) {
        Order order;
        try {
            order = resolveOrder(update, pushed);
        } catch (ReconciliationConflictException e) {
            log.warn("Dropping broker update [{}]: {}", e.getErrorCode(), e.getMessage());
            return;
        }
        if (order == null) {
            return;
        }

        if (order.getBrokerOrderId() == null) {
            adopt(order, update.getBrokerOrderId(), now);
        } else if (!order.getBrokerOrderId().equals(update.getBrokerOrderId())) {
            // a duplicate placement matched by tag; its fills are not ours to book
            log.debug("Ignoring update of duplicate broker order {}", update.getBrokerOrderId());
            return;
        }

        if (update.getAveragePrice() != null) {
            recordCumulativeFill(order, update.getFilledQuantity(), update.getAveragePrice(), now);
        }

        if (update.getStatus() == OrderStatus.CANCELLED) {
            recordCancelled(order, now);
        } else if (update.getStatus() == OrderStatus.REJECTED) {
            RejectCode code = update.getRejectCode() != null ? update.getRejectCode() : RejectCode.BROKER_REJECTED;
            recordRejected(order, code, update.getMessage(), now);
        }
    }

    /**
     * Order the update belongs to, by broker id and then by tag. Null for activity of other
     * orders in the account.
     *
     * @throws ReconciliationConflictException when the update carries fills for an order this
     *     process tagged or was pushed, but does not know
     */
    private Order resolveOrder(BrokerOrderUpdate update, boolean pushed) {
        String orderId = orderIdByBrokerId.get(update.getBrokerOrderId());
        if (orderId == null && update.getTag() != null) {
            orderId = orderIdByTag.get(update.getTag());
        }
        Order order = orderId != null ? orders.get(orderId) : null;
        if (order == null && update.getFilledQuantity() > 0 && (pushed || update.getTag() != null)) {
            throw new ReconciliationConflictException("Update for unknown order: brokerOrderId="
                    + update.getBrokerOrderId() + ", tag=" + update.getTag()
                    + ", filled=" + update.getFilledQuantity());
        }
        return order;
    }

    private void adopt(Order order, String brokerOrderId, LocalDateTime now) {
        orderIdByBrokerId.put(brokerOrderId, order.getId());
        boolean lateAck = order.getStatus().isTerminal();
        recordAcknowledged(order, brokerOrderId, now);
        if (lateAck || order.isCancelRequested()) {
            // cancelled or given up before the broker answered
            sendCancel(order.getId(), brokerOrderId);
        }
    }

    private void failTransient(Order order, RejectCode code, String reason, LocalDateTime now) {
        if (retryPolicy.canRetry(order.getAttempts())) {
            Duration delay = retryPolicy.backoff(order.getAttempts());
            order.setStatus(OrderStatus.PENDING);
            order.setNextRetryAt(now.plus(delay));
            order.setRejectCode(code);
            order.setRejectReason(reason);
            record(order, OrderEventType.RETRY_SCHEDULED, now);
            log.warn(
                    "Order attempt {} failed ({}), retrying in {}ms: id={}",
                    order.getAttempts(),
                    code,
                    delay.toMillis(),
                    order.getId());
        } else {
            recordRejected(order, RejectCode.RETRIES_EXHAUSTED, code + ": " + reason, now);
        }
    }

    private void pollIfDue(LocalDateTime now) {
        if (lastPollAt != null && now.isBefore(lastPollAt.plus(pollInterval))) {
            return;
        }
        boolean anyOpen = orders.values().stream().anyMatch(o -> !o.getStatus().isTerminal());
        if (!anyOpen || !pollInFlight.compareAndSet(false, true)) {
            return;
        }
        lastPollAt = now;
        ioExecutor.execute(() -> {
            try {
                inbox.add(new PollResult(brokerGateway.fetchOrderBook(), null));
            } catch (RuntimeException e) {
                inbox.add(new PollResult(List.of(), e));
            }
        });
    }

    // ========================
    // I/O
    // ========================

    private void dispatch(Order order, LocalDateTime now) {
        order.setAttempts(order.getAttempts() + 1);
        order.setInFlight(true);
        order.setLastSentAt(now);
        record(order, OrderEventType.SENT, now);

        String orderId = order.getId();
        int attempt = order.getAttempts();
        BrokerOrderRequest request = BrokerOrderRequest.builder()
                .tag(OrderTags.of(orderId))
                .tradingSymbol(order.getTradingSymbol())
                .exchange(order.getExchange())
                .side(order.getSide())
                .orderType(order.getOrderType())
                .quantity(order.getQuantity())
                .price(order.getPrice())
                .build();

        ioExecutor.execute(() -> {
            try {
                inbox.add(new PlacementResult(orderId, attempt, brokerGateway.place(request), null));
            } catch (BrokerException e) {
                inbox.add(new PlacementResult(orderId, attempt, null, e));
            } catch (RuntimeException e) {
                inbox.add(new PlacementResult(
                        orderId, attempt, null, new BrokerException(RejectCode.NETWORK, e.getMessage(), e)));
            }
        });
    }

    private void sendCancel(String orderId, String brokerOrderId) {
        ioExecutor.execute(() -> {
            try {
                brokerGateway.cancel(brokerOrderId);
            } catch (RuntimeException e) {
                inbox.add(new CancelResult(orderId, e));
            }
        });
    }

    // ========================
    // INBOX
    // ========================

    private interface InboxItem {}

    private record PlacementResult(String orderId, int attempt, String brokerOrderId, BrokerException error)
            implements InboxItem {}

    private record PushedUpdate(BrokerOrderUpdate update) implements InboxItem {}

    private record PollResult(List<BrokerOrderUpdate> updates, RuntimeException error) implements InboxItem {}

    private record CancelResult(String orderId, RuntimeException error) implements InboxItem {}
}
