package com.condortrader.chain;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Newton-Raphson implied volatility solver with bisection fallback for European options.
 *
 * <p>Newton-Raphson uses vega as the derivative and converges in a handful of iterations
 * for near-the-money strikes. Far OTM wings, which an iron condor always carries, have
 * near-zero vega; there the solver falls back to bisection, which always converges when the
 * price is inside the achievable Black-Scholes range.
 *
 * <p>Results outside [1%, 200%] are clamped. Unsolvable inputs return -1, which the
 * caller turns into {@link com.condortrader.domain.model.Greeks#UNAVAILABLE}.
 *
 * <p>Stateless and thread-safe.
 */
@Slf4j
@Component
public class IVCalculator {

    private static final double NR_INITIAL_GUESS = 0.25;
    private static final double NR_TOLERANCE = 0.0001;
    private static final int NR_MAX_ITERATIONS = 100;

    private static final double BISECTION_LOWER = 0.001;
    private static final double BISECTION_UPPER = 5.0;
    private static final int BISECTION_MAX_ITERATIONS = 200;

    static final double IV_MIN = 0.01;
    static final double IV_MAX = 2.0;

    // thread-safe in commons-math3
    private static final NormalDistribution NORM = new NormalDistribution();

    /**
     * Solves implied volatility from an observed option price.
     *
     * @param S      spot price
     * @param K      strike price
     * @param T      time to expiry in years (must be > 0)
     * @param r      risk-free rate as a decimal
     * @param price  observed option price
     * @param isCall true for CE, false for PE
     * @return implied volatility as a decimal (0.16 = 16%), or -1 if unsolvable
     */
    public double solve(double S, double K, double T, double r, double price, boolean isCall) {
        if (price <= 0 || S <= 0 || K <= 0 || T <= 0) {
            return -1;
        }

        Double iv = tryNewtonRaphson(S, K, T, r, price, isCall);
        if (iv == null) {
            log.debug(
                    "Newton-Raphson did not converge for S={}, K={}, T={}, price={}, isCall={}, using bisection",
                    S,
                    K,
                    T,
                    price,
                    isCall);
            double bisected = bisectionMethod(S, K, T, r, price, isCall);
            if (bisected < 0) {
                return -1;
            }
            iv = bisected;
        }

        return clamp(iv);
    }

    /** Black-Scholes price of a European option without dividends. */
    public double blackScholesPrice(double S, double K, double T, double r, double sigma, boolean isCall) {
        double sqrtT = Math.sqrt(T);
        double d1 = (Math.log(S / K) + (r + sigma * sigma / 2.0) * T) / (sigma * sqrtT);
        double d2 = d1 - sigma * sqrtT;

        if (isCall) {
            return S * NORM.cumulativeProbability(d1) - K * Math.exp(-r * T) * NORM.cumulativeProbability(d2);
        }
        return K * Math.exp(-r * T) * NORM.cumulativeProbability(-d2) - S * NORM.cumulativeProbability(-d1);
    }

    private Double tryNewtonRaphson(double S, double K, double T, double r, double price, boolean isCall) {
        double sigma = NR_INITIAL_GUESS;
        double sqrtT = Math.sqrt(T);

        for (int i = 0; i < NR_MAX_ITERATIONS; i++) {
            double diff = blackScholesPrice(S, K, T, r, sigma, isCall) - price;
            if (Math.abs(diff) < NR_TOLERANCE) {
                return sigma;
            }

            double d1 = (Math.log(S / K) + (r + sigma * sigma / 2.0) * T) / (sigma * sqrtT);
            double vega = S * NORM.density(d1) * sqrtT;
            if (Math.abs(vega) < 1e-10) {
                return null;
            }

            sigma = Math.max(BISECTION_LOWER, Math.min(BISECTION_UPPER, sigma - diff / vega));
        }

        return null;
    }

    private double bisectionMethod(double S, double K, double T, double r, double price, boolean isCall) {
        double lower = BISECTION_LOWER;
        double upper = BISECTION_UPPER;

        double lowerPrice = blackScholesPrice(S, K, T, r, lower, isCall);
        double upperPrice = blackScholesPrice(S, K, T, r, upper, isCall);
        if (price < lowerPrice || price > upperPrice) {
            log.debug("Option price {} outside achievable range [{}, {}]", price, lowerPrice, upperPrice);
            return -1;
        }

        for (int i = 0; i < BISECTION_MAX_ITERATIONS; i++) {
            double mid = (lower + upper) / 2.0;
            double midPrice = blackScholesPrice(S, K, T, r, mid, isCall);

            if (Math.abs(midPrice - price) < NR_TOLERANCE) {
                return mid;
            }
            if (midPrice > price) {
                upper = mid;
            } else {
                lower = mid;
            }
        }

        return (lower + upper) / 2.0;
    }

    double clamp(double iv) {
        if (iv < IV_MIN || iv > IV_MAX) {
            log.warn("Suspect IV calculated: {}%. Clamping to [{}%, {}%].", iv * 100, IV_MIN * 100, IV_MAX * 100);
            return Math.max(IV_MIN, Math.min(iv, IV_MAX));
        }
        return iv;
    }
}
