package com.condortrader.broker;

import com.condortrader.domain.enums.OrderStatus;
import com.condortrader.domain.enums.RejectCode;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Broker view of one order, from a push update or an order-book poll. Quantities are
 * cumulative, so the same state seen twice carries the same filled quantity.
 */
@Value
@Builder
public class BrokerOrderUpdate {

    String brokerOrderId;

    /** Tag sent at placement (our client order id), null for orders placed elsewhere. */
    String tag;

    OrderStatus status;
    int filledQuantity;
    BigDecimal averagePrice;

    /** Classification of a broker rejection, null otherwise. */
    RejectCode rejectCode;

    String message;
    LocalDateTime updatedAt;
}
