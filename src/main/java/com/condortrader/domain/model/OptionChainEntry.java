package com.condortrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Latest known state of one option in the chain. Immutable; the chain replaces the entry
 * on every accepted tick.
 *
 * <p>{@code greeks} is null while the Greeks are unknown (no spot yet, or the solver
 * failed on every tick so far). Once the contract reaches its expiry date the Greeks stop
 * updating and {@code expired} is set.
 */
@Value
@Builder(toBuilder = true)
public class OptionChainEntry {

    OptionContract contract;
    BigDecimal price;
    BigDecimal bid;
    BigDecimal ask;
    long volume;
    Greeks greeks;
    LocalDateTime lastUpdateTime;
    boolean expired;

    public StrikeKey key() {
        return StrikeKey.of(contract.getStrike(), contract.getOptionType());
    }

    public boolean hasGreeks() {
        return greeks != null && greeks.isAvailable();
    }

    /** Delta, or null when unknown. */
    public BigDecimal getDelta() {
        return hasGreeks() ? greeks.getDelta() : null;
    }

    /** Implied volatility in percent, or null when unknown. */
    public BigDecimal getImpliedVolatility() {
        return hasGreeks() ? greeks.getIv() : null;
    }
}
