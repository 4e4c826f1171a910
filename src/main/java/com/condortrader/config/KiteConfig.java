package com.condortrader.config;

import com.condortrader.broker.KiteBrokerGateway;
import com.condortrader.broker.KiteCandleLoader;
import com.condortrader.broker.KiteInstrumentLoader;
import com.condortrader.broker.KiteOrderMapper;
import com.condortrader.exception.AuthExpiredException;
import com.condortrader.recovery.FatalShutdownHandler;
import com.zerodhatech.kiteconnect.KiteConnect;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kite Connect beans, created in LIVE mode only.
 *
 * <p>Provides:
 * <ul>
 *   <li>A singleton {@link KiteConnect} client with the operator-supplied access token. The
 *       core never logs in: an expired session is fatal (exit code 3) and the operator
 *       restarts with a fresh token.</li>
 *   <li>The {@code kiteOrders} rate limiter guarding every broker call. Requests over the
 *       limit are refused immediately rather than queued, so the decision thread never
 *       waits on a permit.</li>
 *   <li>The broker gateway, the instrument loader and the candle loader on top of the
 *       client.</li>
 * </ul>
 */
@Configuration
@ConditionalOnProperty(prefix = "condortrader", name = "mode", havingValue = "LIVE", matchIfMissing = true)
public class KiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KiteConfig.class);

    @Bean
    public KiteConnect kiteConnect(
            TradingProperties tradingProperties, ObjectProvider<FatalShutdownHandler> fatalShutdownHandler) {
        TradingProperties.Kite kite = tradingProperties.getKite();
        log.info("Creating KiteConnect bean with API key: {}...", maskApiKey(kite.getApiKey()));
        KiteConnect kiteConnect = new KiteConnect(kite.getApiKey());
        kiteConnect.setAccessToken(kite.getAccessToken());
        if (kite.getUserId() != null) {
            kiteConnect.setUserId(kite.getUserId());
        }
        kiteConnect.setSessionExpiryHook(() -> {
            log.error("Kite session expired (detected by SDK SessionExpiryHook)");
            fatalShutdownHandler.ifAvailable(
                    handler -> handler.terminate(new AuthExpiredException("Kite session expired")));
        });
        return kiteConnect;
    }

    @Bean
    public RateLimiter kiteOrdersRateLimiter(TradingProperties tradingProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(tradingProperties.getExecution().getRateLimitPerSecond())
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of("kiteOrders", config);
    }

    @Bean
    public KiteBrokerGateway kiteBrokerGateway(
            KiteConnect kiteConnect, KiteOrderMapper kiteOrderMapper, RateLimiter kiteOrdersRateLimiter) {
        return new KiteBrokerGateway(kiteConnect, kiteOrderMapper, kiteOrdersRateLimiter);
    }

    @Bean
    public KiteInstrumentLoader kiteInstrumentLoader(KiteConnect kiteConnect) {
        return new KiteInstrumentLoader(kiteConnect);
    }

    /** Paced at Kite's three historical requests per second, waiting up to 5s for a slot. */
    @Bean
    public KiteCandleLoader kiteCandleLoader(KiteConnect kiteConnect) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(3)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ofSeconds(5))
                .build();
        return new KiteCandleLoader(kiteConnect, RateLimiter.of("kiteHistorical", config));
    }

    private String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}
