package com.condortrader.recovery;

import com.condortrader.domain.enums.ExecutionEventType;
import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.Order;
import com.condortrader.domain.model.Position;
import com.condortrader.engine.DecisionLoop;
import com.condortrader.event.EventPublisherHelper;
import com.condortrader.event.PositionEventType;
import com.condortrader.execution.OrderEventLog;
import com.condortrader.execution.OrderEventRecord;
import com.condortrader.persistence.PositionStore;
import com.condortrader.persistence.StoredPosition;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the trading state of a restarted process before the feed connects.
 *
 * <p>The sequence, run on the decision thread:
 * <ol>
 *   <li>Read the order-event log and take the last record of every order; orders whose last
 *       state is not terminal go back to the execution manager</li>
 *   <li>Load the latest snapshot of every open position and resume it, replaying the fills
 *       logged at or after the snapshot time</li>
 *   <li>Count the positions entered today (archived and open) against the daily entry limit</li>
 * </ol>
 * Broker-side changes that happened while the process was down are picked up by the first
 * order-book poll, which matches orders by broker id or tag.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final PositionStore positionStore;
    private final OrderEventLog orderEventLog;
    private final EventPublisherHelper eventPublisherHelper;

    public StartupRecoveryService(
            PositionStore positionStore, OrderEventLog orderEventLog, EventPublisherHelper eventPublisherHelper) {
        this.positionStore = positionStore;
        this.orderEventLog = orderEventLog;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public RecoveryResult recover(DecisionLoop loop, LocalDate tradingDay, LocalDateTime now) {
        long startedAt = System.currentTimeMillis();
        log.info("Starting recovery sequence for {}...", tradingDay);
        RecoveryResult result = RecoveryResult.builder().build();

        List<OrderEventRecord> records = orderEventLog.readAll();
        List<Order> openOrders = openOrders(records);
        loop.restoreOrders(openOrders);
        result.setOrdersRestored(openOrders.size());

        List<StoredPosition> stored = positionStore.loadOpen().stream()
                .sorted(Comparator.comparing(StoredPosition::snapshotAt).reversed())
                .toList();
        for (StoredPosition storedPosition : stored) {
            Position position = storedPosition.position();
            if (loop.getStrategy().activePosition().isPresent()) {
                log.warn(
                        "Strategy already holds position {}, leaving snapshot of {} in the store",
                        loop.getStrategy().activePosition().get().getId(),
                        position.getId());
                result.getPositionsSkipped().add(position.getId());
                continue;
            }
            List<ExecutionEvent> missedFills = fillsSince(records, position.getId(), storedPosition.snapshotAt());
            loop.resume(position, missedFills, now);
            result.getPositionsResumed().add(position.getId());
            result.setFillsReplayed(result.getFillsReplayed() + missedFills.size());
            eventPublisherHelper.publishPositionEvent(this, position, PositionEventType.RECOVERED, now);
        }

        int entriesToday = positionStore.archivedOn(tradingDay).size()
                + (int) stored.stream()
                        .map(StoredPosition::position)
                        .filter(p -> p.getEntryTime() != null
                                && p.getEntryTime().toLocalDate().equals(tradingDay))
                        .count();
        loop.getStrategy().restoreDailyEntries(tradingDay, entriesToday);
        result.setEntriesToday(entriesToday);

        result.setDurationMs(System.currentTimeMillis() - startedAt);
        log.info(
                "Recovery completed: duration={}ms, ordersRestored={}, positionsResumed={}, fillsReplayed={}, entriesToday={}",
                result.getDurationMs(),
                result.getOrdersRestored(),
                result.getPositionsResumed(),
                result.getFillsReplayed(),
                result.getEntriesToday());
        return result;
    }

    /** Last known state of every order whose last record is not terminal. */
    static List<Order> openOrders(List<OrderEventRecord> records) {
        Map<String, OrderEventRecord> lastByOrder = new LinkedHashMap<>();
        for (OrderEventRecord record : records) {
            lastByOrder.put(record.getOrderId(), record);
        }
        return lastByOrder.values().stream()
                .filter(r -> r.getStatus() != null && !r.getStatus().isTerminal())
                .map(OrderEventRecord::toOrder)
                .toList();
    }

    static List<ExecutionEvent> fillsSince(List<OrderEventRecord> records, String positionId, LocalDateTime since) {
        return records.stream()
                .filter(r -> r.getEventType() == OrderEventType.FILL)
                .filter(r -> positionId.equals(r.getPositionId()))
                .filter(r -> since == null || !r.getEventTime().isBefore(since))
                .map(StartupRecoveryService::toFill)
                .toList();
    }

    private static ExecutionEvent toFill(OrderEventRecord record) {
        return ExecutionEvent.builder()
                .type(ExecutionEventType.FILL)
                .orderId(record.getOrderId())
                .positionId(record.getPositionId())
                .legId(record.getLegId())
                .intent(record.getIntent())
                .brokerOrderId(record.getBrokerOrderId())
                .fillSeq(record.getFillSeq())
                .quantity(record.getFillQuantity())
                .price(record.getFillPrice())
                .eventTime(record.getEventTime())
                .build();
    }
}
