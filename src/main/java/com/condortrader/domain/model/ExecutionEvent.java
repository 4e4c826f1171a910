package com.condortrader.domain.model;

import com.condortrader.domain.enums.ExecutionEventType;
import com.condortrader.domain.enums.OrderIntent;
import com.condortrader.domain.enums.RejectCode;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable feedback from the execution layer. Funnelled onto the decision thread and
 * applied to the owning Position by its strategy.
 *
 * <p>For FILL events {@code fillSeq} is the order's cumulative filled quantity after this
 * fill. Push updates and order-book polls both report cumulative quantities, so the same
 * fill observed on either channel carries the same key.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionEvent {

    ExecutionEventType type;
    String orderId;
    String positionId;
    String legId;
    OrderIntent intent;
    String brokerOrderId;
    int fillSeq;

    /** Units filled by this event (FILL only). */
    int quantity;

    /** Fill price (FILL only). */
    BigDecimal price;

    RejectCode rejectCode;
    String message;
    LocalDateTime eventTime;

    /** Dedupe key: broker order id (or our id before acknowledgment) plus fill sequence. */
    public String fillKey() {
        return (brokerOrderId != null ? brokerOrderId : orderId) + ":" + fillSeq;
    }
}
