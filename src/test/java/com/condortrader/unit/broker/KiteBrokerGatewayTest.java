package com.condortrader.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.condortrader.broker.BrokerOrderRequest;
import com.condortrader.broker.BrokerOrderUpdate;
import com.condortrader.broker.KiteBrokerGateway;
import com.condortrader.broker.KiteOrderMapper;
import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.enums.OrderStatus;
import com.condortrader.domain.enums.OrderType;
import com.condortrader.domain.enums.RejectCode;
import com.condortrader.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.InputException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.NetworkException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.OrderException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import com.zerodhatech.models.Order;
import com.zerodhatech.models.OrderParams;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Unit tests for {@link KiteBrokerGateway}.
 *
 * <p>Covers delegation to the Kite SDK, the fail-fast rate limit and the classification of
 * Kite exceptions into retryable and permanent reject codes.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class KiteBrokerGatewayTest {

    @Mock
    private KiteConnect kiteConnect;

    @Mock
    private RateLimiter rateLimiter;

    private KiteBrokerGateway kiteBrokerGateway;

    private final BrokerOrderRequest request = BrokerOrderRequest.builder()
            .tag("NIFTYx240115x1x3")
            .tradingSymbol("NIFTY24JAN22300CE")
            .exchange("NFO")
            .side(OrderSide.SELL)
            .orderType(OrderType.MARKET)
            .quantity(75)
            .price(new BigDecimal("50"))
            .build();

    @BeforeEach
    void setUp() {
        kiteBrokerGateway = new KiteBrokerGateway(kiteConnect, new KiteOrderMapper(), rateLimiter);
        when(rateLimiter.acquirePermission()).thenReturn(true);
    }

    private BrokerException placeFailingWith(Throwable failure) throws Throwable {
        when(kiteConnect.placeOrder(any(OrderParams.class), anyString())).thenThrow(failure);
        try {
            kiteBrokerGateway.place(request);
        } catch (BrokerException e) {
            return e;
        }
        throw new AssertionError("place did not fail");
    }

    @Nested
    @DisplayName("Delegation")
    class Delegation {

        @Test
        @DisplayName("place returns the Kite order id")
        void place() throws Throwable {
            Order placed = new Order();
            placed.orderId = "240115000001234";
            when(kiteConnect.placeOrder(any(OrderParams.class), eq("regular"))).thenReturn(placed);

            assertThat(kiteBrokerGateway.place(request)).isEqualTo("240115000001234");
        }

        @Test
        @DisplayName("fetchOrderBook maps every Kite order")
        void fetchOrderBook() throws Throwable {
            Order order = new Order();
            order.orderId = "240115000001234";
            order.status = "COMPLETE";
            order.filledQuantity = "75";
            order.averagePrice = "50.05";
            when(kiteConnect.getOrders()).thenReturn(List.of(order));

            List<BrokerOrderUpdate> updates = kiteBrokerGateway.fetchOrderBook();

            assertThat(updates).singleElement().satisfies(update -> {
                assertThat(update.getStatus()).isEqualTo(OrderStatus.FILLED);
                assertThat(update.getFilledQuantity()).isEqualTo(75);
            });
        }

        @Test
        @DisplayName("pushed Kite updates reach the listener")
        void pushedUpdates() {
            List<BrokerOrderUpdate> received = new ArrayList<>();
            kiteBrokerGateway.setOrderUpdateListener(received::add);
            Order order = new Order();
            order.orderId = "240115000001234";
            order.status = "OPEN";

            kiteBrokerGateway.onKiteOrderUpdate(order);
            kiteBrokerGateway.onKiteOrderUpdate(new Order());

            assertThat(received).extracting(BrokerOrderUpdate::getBrokerOrderId).containsExactly("240115000001234");
        }
    }

    @Nested
    @DisplayName("Rate Limit")
    class RateLimit {

        @Test
        @DisplayName("denied permit fails fast as RATE_LIMITED without calling Kite")
        void deniedPermit() throws Throwable {
            when(rateLimiter.acquirePermission()).thenReturn(false);

            assertThatThrownBy(() -> kiteBrokerGateway.place(request))
                    .isInstanceOf(BrokerException.class)
                    .satisfies(e -> assertThat(((BrokerException) e).getRejectCode()).isEqualTo(RejectCode.RATE_LIMITED));
            verify(kiteConnect, never()).placeOrder(any(OrderParams.class), anyString());
        }
    }

    @Nested
    @DisplayName("Exception Classification")
    class Classification {

        @Test
        @DisplayName("TokenException is AUTH_EXPIRED and permanent")
        void token() throws Throwable {
            BrokerException e = placeFailingWith(new TokenException("Invalid access token", 403));

            assertThat(e.getRejectCode()).isEqualTo(RejectCode.AUTH_EXPIRED);
            assertThat(e.isRetryable()).isFalse();
        }

        @Test
        @DisplayName("InputException is INVALID_ORDER")
        void input() throws Throwable {
            assertThat(placeFailingWith(new InputException("Invalid quantity", 400)).getRejectCode())
                    .isEqualTo(RejectCode.INVALID_ORDER);
        }

        @Test
        @DisplayName("OrderException about margin is MARGIN_INSUFFICIENT")
        void margin() throws Throwable {
            assertThat(placeFailingWith(new OrderException("Insufficient margin", 400)).getRejectCode())
                    .isEqualTo(RejectCode.MARGIN_INSUFFICIENT);
        }

        @Test
        @DisplayName("NetworkException is retryable NETWORK")
        void network() throws Throwable {
            BrokerException e = placeFailingWith(new NetworkException("Gateway timed out", 504));

            assertThat(e.getRejectCode()).isEqualTo(RejectCode.NETWORK);
            assertThat(e.isRetryable()).isTrue();
        }

        @Test
        @DisplayName("HTTP 429 is RATE_LIMITED")
        void tooManyRequests() throws Throwable {
            assertThat(placeFailingWith(new KiteException("Too many requests", 429)).getRejectCode())
                    .isEqualTo(RejectCode.RATE_LIMITED);
        }

        @Test
        @DisplayName("Socket timeout is TIMEOUT")
        void socketTimeout() throws Throwable {
            assertThat(placeFailingWith(new SocketTimeoutException("Read timed out")).getRejectCode())
                    .isEqualTo(RejectCode.TIMEOUT);
        }
    }
}
