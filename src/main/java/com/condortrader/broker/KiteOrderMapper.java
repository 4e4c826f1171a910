package com.condortrader.broker;

import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.enums.OrderStatus;
import com.condortrader.domain.enums.OrderType;
import com.condortrader.domain.enums.RejectCode;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Maps between Kite SDK order objects and the broker-neutral request/update types.
 *
 * <p>Kite SDK uses public fields and stores most numbers as Strings (quantity,
 * filledQuantity, averagePrice), so MapStruct cannot generate these mappings. All
 * conversions are manual and null-safe.
 */
@Component
public class KiteOrderMapper {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    public OrderParams toOrderParams(BrokerOrderRequest request) {
        OrderParams params = new OrderParams();
        params.tradingsymbol = request.getTradingSymbol();
        params.exchange = request.getExchange() != null ? request.getExchange() : Constants.EXCHANGE_NFO;
        params.transactionType = request.getSide() == OrderSide.BUY
                ? Constants.TRANSACTION_TYPE_BUY
                : Constants.TRANSACTION_TYPE_SELL;
        params.orderType = request.getOrderType() == OrderType.LIMIT
                ? Constants.ORDER_TYPE_LIMIT
                : Constants.ORDER_TYPE_MARKET;
        params.quantity = request.getQuantity();
        params.product = Constants.PRODUCT_NRML;
        params.validity = Constants.VALIDITY_DAY;
        params.tag = request.getTag();

        if (request.getOrderType() == OrderType.LIMIT && request.getPrice() != null) {
            params.price = request.getPrice().doubleValue();
        }
        return params;
    }

    public BrokerOrderUpdate toUpdate(Order kiteOrder) {
        OrderStatus status = mapStatus(kiteOrder.status);
        return BrokerOrderUpdate.builder()
                .brokerOrderId(kiteOrder.orderId)
                .tag(kiteOrder.tag)
                .status(status)
                .filledQuantity(parseInt(kiteOrder.filledQuantity))
                .averagePrice(parseBigDecimal(kiteOrder.averagePrice))
                .rejectCode(status == OrderStatus.REJECTED ? classifyRejection(kiteOrder.statusMessage) : null)
                .message(kiteOrder.statusMessage)
                .updatedAt(toLocalDateTime(
                        kiteOrder.exchangeUpdateTimestamp != null
                                ? kiteOrder.exchangeUpdateTimestamp
                                : kiteOrder.orderTimestamp))
                .build();
    }

    public List<BrokerOrderUpdate> toUpdates(List<Order> kiteOrders) {
        if (kiteOrders == null) {
            return List.of();
        }
        return kiteOrders.stream().map(this::toUpdate).toList();
    }

    /**
     * Maps Kite order status strings.
     *
     * <p>Kite uses: OPEN, COMPLETE, CANCELLED, REJECTED, TRIGGER PENDING, UPDATE, PUT ORDER REQ
     * RECEIVED, VALIDATION PENDING, OPEN PENDING. Everything not terminal counts as PLACED.
     */
    OrderStatus mapStatus(String kiteStatus) {
        if (kiteStatus == null) {
            return OrderStatus.PLACED;
        }
        return switch (kiteStatus) {
            case "COMPLETE" -> OrderStatus.FILLED;
            case "CANCELLED" -> OrderStatus.CANCELLED;
            case "REJECTED" -> OrderStatus.REJECTED;
            default -> OrderStatus.PLACED;
        };
    }

    /** Kite reports rejections as free text from the RMS; the margin case is the one that matters. */
    RejectCode classifyRejection(String statusMessage) {
        if (statusMessage == null) {
            return RejectCode.BROKER_REJECTED;
        }
        String text = statusMessage.toLowerCase(Locale.ROOT);
        if (text.contains("margin") || text.contains("insufficient funds")) {
            return RejectCode.MARGIN_INSUFFICIENT;
        }
        return RejectCode.BROKER_REJECTED;
    }

    // ---- Parsing helpers ----

    private int parseInt(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        try {
            return (int) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private BigDecimal parseBigDecimal(String value) {
        if (value == null || value.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    private LocalDateTime toLocalDateTime(Date date) {
        if (date == null) {
            return null;
        }
        return date.toInstant().atZone(IST).toLocalDateTime();
    }
}
