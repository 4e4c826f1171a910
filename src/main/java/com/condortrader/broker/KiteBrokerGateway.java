package com.condortrader.broker;

import com.condortrader.domain.enums.RejectCode;
import com.condortrader.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.InputException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.NetworkException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.OrderException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.PermissionException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.OrderParams;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.function.Consumer;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrokerGateway} backed by the Kite Connect REST API.
 *
 * <p>Every call first takes a permit from the {@code kiteOrders} rate limiter (Kite allows
 * 10 order requests per second; the default leaves headroom). A denied permit is not
 * waited for: it fails fast as {@link RejectCode#RATE_LIMITED} so the execution manager
 * schedules the retry with its own backoff.
 *
 * <p>Kite's checked exceptions are wrapped into {@link BrokerException} with a reject code:
 * <ul>
 *   <li>TokenException: AUTH_EXPIRED (permanent)</li>
 *   <li>InputException, PermissionException: INVALID_ORDER (permanent)</li>
 *   <li>OrderException: MARGIN_INSUFFICIENT or BROKER_REJECTED (permanent)</li>
 *   <li>NetworkException, HTTP 429/5xx, IOException, JSONException: transient</li>
 * </ul>
 *
 * <p>Pushed order updates arrive from the ticker's order-update callback through
 * {@link #onKiteOrderUpdate}.
 */
public class KiteBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(KiteBrokerGateway.class);

    private final KiteConnect kiteConnect;
    private final KiteOrderMapper kiteOrderMapper;
    private final RateLimiter rateLimiter;

    private volatile Consumer<BrokerOrderUpdate> orderUpdateListener = update -> {};

    public KiteBrokerGateway(KiteConnect kiteConnect, KiteOrderMapper kiteOrderMapper, RateLimiter rateLimiter) {
        this.kiteConnect = kiteConnect;
        this.kiteOrderMapper = kiteOrderMapper;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public String place(BrokerOrderRequest request) {
        acquirePermit("place " + request.getTag());
        OrderParams params = kiteOrderMapper.toOrderParams(request);
        try {
            com.zerodhatech.models.Order kiteOrder = kiteConnect.placeOrder(params, Constants.VARIETY_REGULAR);
            log.info(
                    "Order placed: orderId={} tag={} symbol={} side={} qty={}",
                    kiteOrder.orderId,
                    request.getTag(),
                    request.getTradingSymbol(),
                    request.getSide(),
                    request.getQuantity());
            return kiteOrder.orderId;
        } catch (KiteException e) {
            log.error("Kite order placement failed for {}: {}", request.getTradingSymbol(), e.message);
            throw classify("Order placement failed", e);
        } catch (JSONException | IOException e) {
            log.error("Order placement error for {}", request.getTradingSymbol(), e);
            throw classify("Order placement error", e);
        }
    }

    @Override
    public void cancel(String brokerOrderId) {
        acquirePermit("cancel " + brokerOrderId);
        try {
            kiteConnect.cancelOrder(brokerOrderId, Constants.VARIETY_REGULAR);
            log.info("Order cancelled: orderId={}", brokerOrderId);
        } catch (KiteException e) {
            log.error("Order cancellation failed for {}: {}", brokerOrderId, e.message);
            throw classify("Order cancellation failed", e);
        } catch (JSONException | IOException e) {
            log.error("Order cancellation error for {}", brokerOrderId, e);
            throw classify("Order cancellation error", e);
        }
    }

    @Override
    public void modify(String brokerOrderId, BrokerOrderRequest request) {
        acquirePermit("modify " + brokerOrderId);
        OrderParams params = new OrderParams();
        if (request.getPrice() != null) {
            params.price = request.getPrice().doubleValue();
        }
        if (request.getQuantity() > 0) {
            params.quantity = request.getQuantity();
        }
        try {
            kiteConnect.modifyOrder(brokerOrderId, params, Constants.VARIETY_REGULAR);
            log.info("Order modified: orderId={}", brokerOrderId);
        } catch (KiteException e) {
            log.error("Order modification failed for {}: {}", brokerOrderId, e.message);
            throw classify("Order modification failed", e);
        } catch (JSONException | IOException e) {
            log.error("Order modification error for {}", brokerOrderId, e);
            throw classify("Order modification error", e);
        }
    }

    @Override
    public List<BrokerOrderUpdate> fetchOrderBook() {
        acquirePermit("order book");
        try {
            return kiteOrderMapper.toUpdates(kiteConnect.getOrders());
        } catch (KiteException e) {
            log.error("Failed to fetch orders: {}", e.message);
            throw classify("Failed to fetch orders", e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching orders", e);
            throw classify("Error fetching orders", e);
        }
    }

    @Override
    public void setOrderUpdateListener(Consumer<BrokerOrderUpdate> listener) {
        this.orderUpdateListener = listener;
    }

    /**
     * Entry point for the KiteTicker OnOrderUpdate callback. Runs on the ticker thread.
     */
    public void onKiteOrderUpdate(com.zerodhatech.models.Order kiteOrder) {
        if (kiteOrder == null || kiteOrder.orderId == null) {
            log.warn("Received null order update or order with null orderId, ignoring");
            return;
        }
        log.debug(
                "Order update received: brokerOrderId={}, status={}, filledQty={}, avgPrice={}",
                kiteOrder.orderId,
                kiteOrder.status,
                kiteOrder.filledQuantity,
                kiteOrder.averagePrice);
        orderUpdateListener.accept(kiteOrderMapper.toUpdate(kiteOrder));
    }

    private void acquirePermit(String operation) {
        if (!rateLimiter.acquirePermission()) {
            log.warn("Broker rate limit reached, deferring {}", operation);
            throw new BrokerException(RejectCode.RATE_LIMITED, "Rate limit reached for " + operation);
        }
    }

    static BrokerException classify(String context, KiteException e) {
        RejectCode code;
        if (e instanceof TokenException) {
            code = RejectCode.AUTH_EXPIRED;
        } else if (e instanceof InputException || e instanceof PermissionException) {
            code = RejectCode.INVALID_ORDER;
        } else if (e instanceof OrderException) {
            String text = e.message != null ? e.message.toLowerCase() : "";
            code = text.contains("margin") || text.contains("insufficient")
                    ? RejectCode.MARGIN_INSUFFICIENT
                    : RejectCode.BROKER_REJECTED;
        } else if (e instanceof NetworkException || e.code >= 500) {
            code = RejectCode.NETWORK;
        } else if (e.code == 429) {
            code = RejectCode.RATE_LIMITED;
        } else {
            code = RejectCode.BROKER_REJECTED;
        }
        return new BrokerException(code, context + ": " + e.message, e);
    }

    static BrokerException classify(String context, Exception e) {
        RejectCode code = e instanceof SocketTimeoutException ? RejectCode.TIMEOUT : RejectCode.NETWORK;
        return new BrokerException(code, context + ": " + e.getMessage(), e);
    }
}
