package com.condortrader.chain;

import com.condortrader.domain.model.Greeks;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Black-Scholes Greeks for European index options (NIFTY and SENSEX weeklies).
 *
 * <p>IV is solved from the option's traded price by {@link IVCalculator}, then the Greeks
 * follow analytically from d1/d2:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r + sigma^2/2) * T] / (sigma * sqrt(T)), d2 = d1 - sigma * sqrt(T)</li>
 *   <li>Delta: N(d1) for calls, N(d1) - 1 for puts</li>
 *   <li>Gamma: n(d1) / (S * sigma * sqrt(T))</li>
 *   <li>Theta: per calendar day</li>
 *   <li>Vega: S * n(d1) * sqrt(T) / 100 (per 1% IV)</li>
 * </ul>
 *
 * <p>The calculation is a pure function of its arguments. Time to expiry is measured from
 * the {@code asOf} timestamp of the tick being processed to 15:30 IST on the expiry date,
 * never from the wall clock, so a replayed tick produces the same Greeks as the live one.
 */
@Component
public class GreeksCalculator {

    /** Index options settle at the 15:30 close on expiry day. */
    public static final LocalTime MARKET_CLOSE = LocalTime.of(15, 30);

    /** 365.25 * 24 * 60 */
    private static final double MINUTES_PER_YEAR = 525_960.0;

    private static final NormalDistribution NORM = new NormalDistribution();

    private final IVCalculator ivCalculator;
    private final double riskFreeRate;

    public GreeksCalculator(
            IVCalculator ivCalculator, @Value("${condortrader.pricing.risk-free-rate:0.07}") double riskFreeRate) {
        this.ivCalculator = ivCalculator;
        this.riskFreeRate = riskFreeRate;
    }

    /**
     * Solves IV from the market price and derives the Greeks.
     *
     * @param spotPrice   underlying price
     * @param strike      option strike
     * @param expiry      expiry date
     * @param optionPrice traded price of the option
     * @param isCall      true for CE
     * @param asOf        timestamp of the tick the inputs came from
     * @return the Greeks, or {@link Greeks#UNAVAILABLE} when IV cannot be solved
     */
    public Greeks calculate(
            BigDecimal spotPrice,
            BigDecimal strike,
            LocalDate expiry,
            BigDecimal optionPrice,
            boolean isCall,
            LocalDateTime asOf) {
        double S = spotPrice.doubleValue();
        double K = strike.doubleValue();
        double price = optionPrice.doubleValue();
        if (price <= 0 || S <= 0 || K <= 0) {
            return Greeks.UNAVAILABLE;
        }

        double T = timeToExpiryYears(expiry, asOf);
        double iv = ivCalculator.solve(S, K, T, riskFreeRate, price, isCall);
        if (iv < 0) {
            return Greeks.UNAVAILABLE;
        }

        return fromVolatility(S, K, T, iv, isCall, asOf);
    }

    /** Greeks from a known volatility (decimal), bypassing the solver. */
    public Greeks calculateDirect(
            BigDecimal spotPrice,
            BigDecimal strike,
            LocalDate expiry,
            BigDecimal iv,
            boolean isCall,
            LocalDateTime asOf) {
        double sigma = iv.doubleValue();
        if (spotPrice.signum() <= 0 || strike.signum() <= 0 || sigma <= 0) {
            return Greeks.UNAVAILABLE;
        }
        return fromVolatility(
                spotPrice.doubleValue(),
                strike.doubleValue(),
                timeToExpiryYears(expiry, asOf),
                sigma,
                isCall,
                asOf);
    }

    /** Theoretical price for a known volatility. */
    public BigDecimal theoreticalPrice(
            BigDecimal spotPrice,
            BigDecimal strike,
            LocalDate expiry,
            double sigma,
            boolean isCall,
            LocalDateTime asOf) {
        double price = ivCalculator.blackScholesPrice(
                spotPrice.doubleValue(),
                strike.doubleValue(),
                timeToExpiryYears(expiry, asOf),
                riskFreeRate,
                sigma,
                isCall);
        return BigDecimal.valueOf(price).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Years from {@code asOf} to market close on the expiry date, floored at one minute so
     * expiry-day ticks never divide by sqrt(0).
     */
    public double timeToExpiryYears(LocalDate expiry, LocalDateTime asOf) {
        long minutes = ChronoUnit.MINUTES.between(asOf, expiry.atTime(MARKET_CLOSE));
        return Math.max(minutes, 1) / MINUTES_PER_YEAR;
    }

    private Greeks fromVolatility(double S, double K, double T, double iv, boolean isCall, LocalDateTime asOf) {
        double r = riskFreeRate;
        double sqrtT = Math.sqrt(T);
        double d1 = (Math.log(S / K) + (r + iv * iv / 2.0) * T) / (iv * sqrtT);
        double d2 = d1 - iv * sqrtT;

        double nd1 = NORM.density(d1);
        double expRT = Math.exp(-r * T);

        double delta;
        double theta;
        if (isCall) {
            delta = NORM.cumulativeProbability(d1);
            theta = (-S * nd1 * iv / (2.0 * sqrtT) - r * K * expRT * NORM.cumulativeProbability(d2)) / 365.0;
        } else {
            delta = NORM.cumulativeProbability(d1) - 1.0;
            theta = (-S * nd1 * iv / (2.0 * sqrtT) + r * K * expRT * NORM.cumulativeProbability(-d2)) / 365.0;
        }

        double gamma = nd1 / (S * iv * sqrtT);
        double vega = S * nd1 * sqrtT / 100.0;

        return Greeks.builder()
                .delta(BigDecimal.valueOf(delta).setScale(4, RoundingMode.HALF_UP))
                .gamma(BigDecimal.valueOf(gamma).setScale(6, RoundingMode.HALF_UP))
                .theta(BigDecimal.valueOf(theta).setScale(2, RoundingMode.HALF_UP))
                .vega(BigDecimal.valueOf(vega).setScale(2, RoundingMode.HALF_UP))
                .iv(BigDecimal.valueOf(iv * 100).setScale(2, RoundingMode.HALF_UP))
                .calculatedAt(asOf)
                .build();
    }
}
