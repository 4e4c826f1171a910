package com.condortrader.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Risk limits for iron condor positions. Loaded once from configuration
 * ({@code condortrader.risk.*}) and never changed while the process runs.
 */
@Value
@Builder
public class RiskLimits {

    /** Loss per position (INR) at which the position is force-closed. */
    BigDecimal maxLossPerPosition;

    /** Open positions allowed at once; further entries are blocked. */
    int maxPositions;

    /**
     * Fraction of {@link #maxLossPerPosition} that triggers the stop-loss exit.
     * 0.5 exits at half the maximum loss.
     */
    BigDecimal stopLossPct;

    /** Absolute short-leg delta above which the leg must be hedged (rolled). */
    BigDecimal hedgeTriggerDelta;

    /** Sizing cap in lots. Null disables the cap. */
    Integer maxLotsPerPosition;

    public BigDecimal stopLossThreshold() {
        return maxLossPerPosition.multiply(stopLossPct).negate();
    }
}
