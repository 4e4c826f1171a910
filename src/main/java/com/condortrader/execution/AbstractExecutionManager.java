package com.condortrader.execution;

import com.condortrader.domain.enums.ExecutionEventType;
import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.enums.OrderStatus;
import com.condortrader.domain.enums.RejectCode;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.Order;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Order bookkeeping shared by the live and simulated execution managers: the order table,
 * the queue of events not yet handed to the decision loop, and the order-event log.
 *
 * <p>Subclasses decide how orders reach a venue; every transition they make goes through
 * the {@code record*} helpers so the log and the emitted events stay in step.
 */
public abstract class AbstractExecutionManager implements ExecutionManager {

    private static final Logger log = LoggerFactory.getLogger(AbstractExecutionManager.class);

    protected final Map<String, Order> orders = new LinkedHashMap<>();
    protected final OrderEventLog orderEventLog;

    private final List<ExecutionEvent> pendingEvents = new ArrayList<>();

    protected AbstractExecutionManager(OrderEventLog orderEventLog) {
        this.orderEventLog = orderEventLog;
    }

    @Override
    public Optional<Order> order(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public Collection<Order> openOrders() {
        return orders.values().stream().filter(o -> !o.getStatus().isTerminal()).toList();
    }

    protected Order createOrder(LegAction action, LocalDateTime now) {
        if (orders.containsKey(action.getClientOrderId())) {
            throw new IllegalArgumentException("Duplicate client order id: " + action.getClientOrderId());
        }
        Order order = Order.builder()
                .id(action.getClientOrderId())
                .positionId(action.getPositionId())
                .legId(action.getLegId())
                .role(action.getRole())
                .intent(action.getIntent())
                .instrumentToken(action.getContract().getInstrumentToken())
                .tradingSymbol(action.getContract().getTradingSymbol())
                .exchange(action.getContract().getExchange())
                .side(action.getSide())
                .orderType(action.getOrderType())
                .quantity(action.getQuantity())
                .price(action.getReferencePrice())
                .status(OrderStatus.PENDING)
                .nextRetryAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        orders.put(order.getId(), order);
        record(order, OrderEventType.CREATED, now);
        log.info(
                "Order created: id={}, symbol={}, side={}, qty={}, intent={}, reason={}",
                order.getId(),
                order.getTradingSymbol(),
                order.getSide(),
                order.getQuantity(),
                order.getIntent(),
                action.getReason());
        return order;
    }

    /** Drains the events collected since the previous call. */
    protected List<ExecutionEvent> drainEvents() {
        List<ExecutionEvent> drained = List.copyOf(pendingEvents);
        pendingEvents.clear();
        return drained;
    }

    protected void record(Order order, OrderEventType type, LocalDateTime now) {
        order.setUpdatedAt(now);
        orderEventLog.append(OrderEventRecord.of(order, type, now));
    }

    protected void recordAcknowledged(Order order, String brokerOrderId, LocalDateTime now) {
        order.setBrokerOrderId(brokerOrderId);
        order.setInFlight(false);
        if (order.getStatus() == OrderStatus.PENDING) {
            order.setStatus(OrderStatus.PLACED);
        }
        record(order, OrderEventType.ACKNOWLEDGED, now);
        pendingEvents.add(baseEvent(order, ExecutionEventType.ACKNOWLEDGED, now).build());
    }

    /**
     * Applies a cumulative fill report. Nothing happens unless the cumulative quantity
     * grew, which makes repeated reports of the same state harmless.
     *
     * @param cumulativeQuantity filled quantity reported by the venue
     * @param averagePrice average price over all {@code cumulativeQuantity} units
     */
    protected void recordCumulativeFill(
            Order order, int cumulativeQuantity, BigDecimal averagePrice, LocalDateTime now) {
        int previous = order.getFilledQuantity();
        if (cumulativeQuantity <= previous) {
            return;
        }
        int quantity = cumulativeQuantity - previous;
        BigDecimal fillPrice = incrementalPrice(order, cumulativeQuantity, averagePrice);

        order.setFilledQuantity(cumulativeQuantity);
        order.setAveragePrice(averagePrice);
        if (!order.getStatus().isTerminal()) {
            order.setStatus(cumulativeQuantity >= order.getQuantity() ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED);
        }

        orderEventLog.append(OrderEventRecord.of(order, OrderEventType.FILL, now).toBuilder()
                .fillQuantity(quantity)
                .fillPrice(fillPrice)
                .fillSeq(cumulativeQuantity)
                .build());
        order.setUpdatedAt(now);

        pendingEvents.add(baseEvent(order, ExecutionEventType.FILL, now)
                .fillSeq(cumulativeQuantity)
                .quantity(quantity)
                .price(fillPrice)
                .build());

        log.info(
                "Order fill: id={}, brokerOrderId={}, qty={}, price={}, filled={}/{}",
                order.getId(),
                order.getBrokerOrderId(),
                quantity,
                fillPrice,
                cumulativeQuantity,
                order.getQuantity());
    }

    protected void recordCancelled(Order order, LocalDateTime now) {
        if (order.getStatus().isTerminal()) {
            return;
        }
        order.setStatus(OrderStatus.CANCELLED);
        order.setInFlight(false);
        record(order, OrderEventType.CANCELLED, now);
        pendingEvents.add(baseEvent(order, ExecutionEventType.CANCELLED, now).build());
        log.info("Order cancelled: id={}, filled={}/{}", order.getId(), order.getFilledQuantity(), order.getQuantity());
    }

    protected void recordRejected(Order order, RejectCode code, String reason, LocalDateTime now) {
        if (order.getStatus().isTerminal()) {
            return;
        }
        order.setStatus(OrderStatus.REJECTED);
        order.setInFlight(false);
        order.setRejectCode(code);
        order.setRejectReason(reason);
        record(order, OrderEventType.REJECTED, now);
        pendingEvents.add(baseEvent(order, ExecutionEventType.REJECTED, now)
                .rejectCode(code)
                .message(reason)
                .build());
        log.warn("Order rejected: id={}, code={}, reason={}", order.getId(), code, reason);
    }

    private static ExecutionEvent.ExecutionEventBuilder baseEvent(
            Order order, ExecutionEventType type, LocalDateTime now) {
        return ExecutionEvent.builder()
                .type(type)
                .orderId(order.getId())
                .positionId(order.getPositionId())
                .legId(order.getLegId())
                .intent(order.getIntent())
                .brokerOrderId(order.getBrokerOrderId())
                .eventTime(now);
    }

    /** Price of the units added by a cumulative report, from the change in total cost. */
    private static BigDecimal incrementalPrice(Order order, int cumulativeQuantity, BigDecimal averagePrice) {
        int previous = order.getFilledQuantity();
        if (previous == 0 || order.getAveragePrice() == null) {
            return averagePrice;
        }
        BigDecimal totalCost = averagePrice.multiply(BigDecimal.valueOf(cumulativeQuantity));
        BigDecimal previousCost = order.getAveragePrice().multiply(BigDecimal.valueOf(previous));
        return totalCost
                .subtract(previousCost)
                .divide(BigDecimal.valueOf(cumulativeQuantity - previous), 4, RoundingMode.HALF_UP);
    }
}
