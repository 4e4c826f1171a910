package com.condortrader.execution;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only log of order transitions. Written on every transition, read back only by
 * startup recovery.
 */
public interface OrderEventLog {

    /** Appends a record and returns it with its sequence number. */
    OrderEventRecord append(OrderEventRecord record);

    /** All records in append order. */
    List<OrderEventRecord> readAll();

    /** Records with an event time strictly after {@code after}, in append order. */
    List<OrderEventRecord> readAfter(LocalDateTime after);

    /** Forces buffered records to durable storage. */
    void flush();
}
