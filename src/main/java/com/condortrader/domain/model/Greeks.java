package com.condortrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Option Greeks calculated via Black-Scholes. Kite does not publish Greeks, so they are
 * derived locally from spot, strike, expiry and the option's traded price.
 *
 * <p>{@code calculatedAt} is the timestamp of the tick the values were derived from, not
 * the wall clock. When the IV solver fails the {@link #UNAVAILABLE} sentinel is returned
 * instead of potentially incorrect values; check {@link #isAvailable()} before use.
 */
@Value
@Builder
public class Greeks {

    /** Price sensitivity to the underlying. -1 (deep ITM put) to +1 (deep ITM call). */
    BigDecimal delta;

    /** Rate of change of delta. Highest for ATM options. */
    BigDecimal gamma;

    /** Time decay per calendar day in rupees. */
    BigDecimal theta;

    /** Sensitivity to a 1% change in implied volatility. */
    BigDecimal vega;

    /** Implied volatility in percent (16.25 = 16.25%). */
    BigDecimal iv;

    LocalDateTime calculatedAt;

    /** IV solver did not converge, or inputs were not usable. */
    public static final Greeks UNAVAILABLE = Greeks.builder()
            .delta(BigDecimal.ZERO)
            .gamma(BigDecimal.ZERO)
            .theta(BigDecimal.ZERO)
            .vega(BigDecimal.ZERO)
            .iv(BigDecimal.valueOf(-1))
            .calculatedAt(LocalDateTime.MIN)
            .build();

    public boolean isAvailable() {
        return this != UNAVAILABLE && iv != null && iv.signum() > 0;
    }
}
