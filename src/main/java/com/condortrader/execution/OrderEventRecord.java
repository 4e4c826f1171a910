package com.condortrader.execution;

import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.enums.OrderIntent;
import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.enums.OrderStatus;
import com.condortrader.domain.enums.OrderType;
import com.condortrader.domain.enums.RejectCode;
import com.condortrader.domain.model.Order;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One line of the order-event log: the full order state right after a transition, plus
 * the fill that caused it for FILL records. Carrying the whole order lets recovery rebuild
 * open orders from the last record of each id.
 */
@Value
@Builder(toBuilder = true)
public class OrderEventRecord {

    /** Assigned by the log on append. */
    long sequence;

    OrderEventType eventType;
    LocalDateTime eventTime;

    String orderId;
    String positionId;
    String legId;
    LegRole role;
    OrderIntent intent;
    long instrumentToken;
    String tradingSymbol;
    String exchange;
    OrderSide side;
    OrderType orderType;
    int quantity;
    BigDecimal price;

    OrderStatus status;
    String brokerOrderId;
    int attempts;
    int filledQuantity;
    BigDecimal averagePrice;

    /** FILL only: units and price of this fill, and the cumulative quantity keying it. */
    int fillQuantity;

    BigDecimal fillPrice;
    int fillSeq;

    RejectCode rejectCode;
    String message;

    public static OrderEventRecord of(Order order, OrderEventType eventType, LocalDateTime eventTime) {
        return OrderEventRecord.builder()
                .eventType(eventType)
                .eventTime(eventTime)
                .orderId(order.getId())
                .positionId(order.getPositionId())
                .legId(order.getLegId())
                .role(order.getRole())
                .intent(order.getIntent())
                .instrumentToken(order.getInstrumentToken())
                .tradingSymbol(order.getTradingSymbol())
                .exchange(order.getExchange())
                .side(order.getSide())
                .orderType(order.getOrderType())
                .quantity(order.getQuantity())
                .price(order.getPrice())
                .status(order.getStatus())
                .brokerOrderId(order.getBrokerOrderId())
                .attempts(order.getAttempts())
                .filledQuantity(order.getFilledQuantity())
                .averagePrice(order.getAveragePrice())
                .rejectCode(order.getRejectCode())
                .message(order.getRejectReason())
                .build();
    }

    /** Rebuilds the order state captured by this record. */
    public Order toOrder() {
        return Order.builder()
                .id(orderId)
                .positionId(positionId)
                .legId(legId)
                .role(role)
                .intent(intent)
                .instrumentToken(instrumentToken)
                .tradingSymbol(tradingSymbol)
                .exchange(exchange)
                .side(side)
                .orderType(orderType)
                .quantity(quantity)
                .price(price)
                .status(status)
                .brokerOrderId(brokerOrderId)
                .attempts(attempts)
                .filledQuantity(filledQuantity)
                .averagePrice(averagePrice)
                .rejectCode(rejectCode)
                .rejectReason(message)
                .updatedAt(eventTime)
                .build();
    }
}
