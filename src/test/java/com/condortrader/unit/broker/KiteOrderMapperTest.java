package com.condortrader.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;

import com.condortrader.broker.BrokerOrderRequest;
import com.condortrader.broker.BrokerOrderUpdate;
import com.condortrader.broker.KiteOrderMapper;
import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.enums.OrderStatus;
import com.condortrader.domain.enums.OrderType;
import com.condortrader.domain.enums.RejectCode;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import java.math.BigDecimal;
import java.util.Date;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link KiteOrderMapper}.
 *
 * <p>Verifies request to OrderParams mapping and Kite Order (String fields) to broker
 * update mapping, including status and rejection classification.
 */
class KiteOrderMapperTest {

    private KiteOrderMapper kiteOrderMapper;

    @BeforeEach
    void setUp() {
        kiteOrderMapper = new KiteOrderMapper();
    }

    private static Order kiteOrder(String status, String filled, String average) {
        Order order = new Order();
        order.orderId = "240115000001234";
        order.tag = "NIFTYx240115x1x3";
        order.status = status;
        order.filledQuantity = filled;
        order.averagePrice = average;
        order.orderTimestamp = new Date();
        return order;
    }

    @Nested
    @DisplayName("Request -> OrderParams")
    class ToOrderParams {

        @Test
        @DisplayName("maps a market sell with NRML product and the tag")
        void marketSell() {
            BrokerOrderRequest request = BrokerOrderRequest.builder()
                    .tag("NIFTYx240115x1x3")
                    .tradingSymbol("NIFTY24JAN22300CE")
                    .exchange("NFO")
                    .side(OrderSide.SELL)
                    .orderType(OrderType.MARKET)
                    .quantity(75)
                    .price(new BigDecimal("50"))
                    .build();

            OrderParams params = kiteOrderMapper.toOrderParams(request);

            assertThat(params.tradingsymbol).isEqualTo("NIFTY24JAN22300CE");
            assertThat(params.exchange).isEqualTo("NFO");
            assertThat(params.transactionType).isEqualTo("SELL");
            assertThat(params.orderType).isEqualTo("MARKET");
            assertThat(params.product).isEqualTo("NRML");
            assertThat(params.quantity).isEqualTo(75);
            assertThat(params.tag).isEqualTo("NIFTYx240115x1x3");
            assertThat(params.price).isNull();
        }

        @Test
        @DisplayName("limit orders carry the price")
        void limitBuy() {
            BrokerOrderRequest request = BrokerOrderRequest.builder()
                    .tradingSymbol("SENSEX24JAN72000PE")
                    .exchange("BFO")
                    .side(OrderSide.BUY)
                    .orderType(OrderType.LIMIT)
                    .quantity(10)
                    .price(new BigDecimal("118.35"))
                    .build();

            OrderParams params = kiteOrderMapper.toOrderParams(request);

            assertThat(params.exchange).isEqualTo("BFO");
            assertThat(params.transactionType).isEqualTo("BUY");
            assertThat(params.orderType).isEqualTo("LIMIT");
            assertThat(params.price).isEqualTo(118.35);
        }
    }

    @Nested
    @DisplayName("Kite Order -> Update")
    class ToUpdate {

        @Test
        @DisplayName("COMPLETE maps to FILLED with quantities parsed from strings")
        void completed() {
            BrokerOrderUpdate update = kiteOrderMapper.toUpdate(kiteOrder("COMPLETE", "75", "49.85"));

            assertThat(update.getBrokerOrderId()).isEqualTo("240115000001234");
            assertThat(update.getTag()).isEqualTo("NIFTYx240115x1x3");
            assertThat(update.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(update.getFilledQuantity()).isEqualTo(75);
            assertThat(update.getAveragePrice()).isEqualByComparingTo("49.85");
            assertThat(update.getRejectCode()).isNull();
            assertThat(update.getUpdatedAt()).isNotNull();
        }

        @Test
        @DisplayName("Non-terminal Kite states map to PLACED")
        void openStates() {
            assertThat(kiteOrderMapper.toUpdate(kiteOrder("OPEN", "0", "0")).getStatus())
                    .isEqualTo(OrderStatus.PLACED);
            assertThat(kiteOrderMapper.toUpdate(kiteOrder("TRIGGER PENDING", "0", "0")).getStatus())
                    .isEqualTo(OrderStatus.PLACED);
            assertThat(kiteOrderMapper.toUpdate(kiteOrder(null, null, null)).getStatus())
                    .isEqualTo(OrderStatus.PLACED);
        }

        @Test
        @DisplayName("Margin rejection text is classified as MARGIN_INSUFFICIENT")
        void marginRejection() {
            Order order = kiteOrder("REJECTED", "0", "0");
            order.statusMessage = "RMS:Margin Exceeds,Required:152000, Available:90000";

            BrokerOrderUpdate update = kiteOrderMapper.toUpdate(order);

            assertThat(update.getStatus()).isEqualTo(OrderStatus.REJECTED);
            assertThat(update.getRejectCode()).isEqualTo(RejectCode.MARGIN_INSUFFICIENT);
            assertThat(update.getMessage()).contains("Margin");
        }

        @Test
        @DisplayName("Other rejections are BROKER_REJECTED")
        void otherRejection() {
            Order order = kiteOrder("REJECTED", "0", "0");
            order.statusMessage = "Trading not allowed in this contract";

            assertThat(kiteOrderMapper.toUpdate(order).getRejectCode()).isEqualTo(RejectCode.BROKER_REJECTED);
        }

        @Test
        @DisplayName("Unparseable numbers fall back to zero")
        void badNumbers() {
            BrokerOrderUpdate update = kiteOrderMapper.toUpdate(kiteOrder("OPEN", "abc", ""));

            assertThat(update.getFilledQuantity()).isZero();
            assertThat(update.getAveragePrice()).isEqualByComparingTo(BigDecimal.ZERO);
        }

        @Test
        @DisplayName("Null order list maps to an empty list")
        void nullList() {
            assertThat(kiteOrderMapper.toUpdates(null)).isEmpty();
            assertThat(kiteOrderMapper.toUpdates(List.of(kiteOrder("COMPLETE", "75", "50")))).hasSize(1);
        }
    }
}
