package com.condortrader.execution;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Order-event log kept in memory. Used by backtests and tests. */
public class InMemoryOrderEventLog implements OrderEventLog {

    private final List<OrderEventRecord> records = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized OrderEventRecord append(OrderEventRecord record) {
        OrderEventRecord stored = record.toBuilder().sequence(sequence.incrementAndGet()).build();
        records.add(stored);
        return stored;
    }

    @Override
    public synchronized List<OrderEventRecord> readAll() {
        return List.copyOf(records);
    }

    @Override
    public synchronized List<OrderEventRecord> readAfter(LocalDateTime after) {
        return records.stream()
                .filter(r -> after == null || r.getEventTime().isAfter(after))
                .toList();
    }

    @Override
    public void flush() {
        // nothing buffered
    }
}
