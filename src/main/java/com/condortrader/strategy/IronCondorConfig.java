package com.condortrader.strategy;

import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuration for the iron condor strategy.
 *
 * <p>An iron condor sells an OTM CE and an OTM PE and buys further OTM CE + PE for
 * protection. It profits from theta decay and IV crush in a range-bound market; the long
 * wings cap the maximum loss at (wingWidth - net premium) per unit.
 *
 * <p><b>Strike layout example (NIFTY at 22000, offsets 300, wingWidth 200):</b>
 * <pre>
 *   Buy PE 21500 | Sell PE 21700 | --- ATM 22000 --- | Sell CE 22300 | Buy CE 22500
 * </pre>
 * The offsets only apply when the chain has no short candidate inside the delta band.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IronCondorConfig {

    @Builder.Default
    private String strategyName = "IRON_CONDOR";

    private IndexName index;

    /** Lots per leg before the risk cap. */
    @Builder.Default
    private int lots = 1;

    /** Entry requires IV rank (0-100) at or above this value. */
    private BigDecimal minIvRank;

    private LocalTime entryStart;
    private LocalTime entryEnd;

    /** Calendar days between the trading date and expiry required for entry. */
    private int minDaysToExpiry;

    @Builder.Default
    private int maxEntriesPerDay = 1;

    /** Accepted |delta| band for the short strikes. */
    private BigDecimal shortDeltaMin;

    private BigDecimal shortDeltaMax;

    /** |delta| the short strike should be nearest to. */
    private BigDecimal shortDeltaTarget;

    /** Points between a short strike and its hedge. */
    private BigDecimal wingWidth;

    /** Fallback: points above the ceiling strike of spot for the short call. */
    private BigDecimal callOffset;

    /** Fallback: points below the floor strike of spot for the short put. */
    private BigDecimal putOffset;

    /** |delta| the replacement strike of a roll should be nearest to. */
    private BigDecimal rollTargetDelta;

    /** Both roll orders must fill within this time, otherwise the position exits. */
    private Duration rollTimeout;

    /** Exit this many minutes before the 15:30 close on expiry day. */
    private int exitMinutesBeforeExpiry;

    /** Intraday square-off time. Null keeps positions overnight. */
    private LocalTime dailyExitTime;

    /**
     * Exit when total P&L (realized plus unrealized) reaches this fraction of the credit
     * taken at entry. Null disables.
     */
    private BigDecimal takeProfitPct;

    /** Exit when a short leg's LTP reaches its entry price times this. Null disables. */
    private BigDecimal legStopMultiplier;

    /**
     * Rejected closes tolerated per leg before closing it is abandoned. A non-retryable
     * rejection abandons it at once.
     */
    @Builder.Default
    private int maxCloseAttempts = 3;

    /**
     * Time entries on the candidate's net credit: arm when it trades above its VWAP, enter
     * when it falls back to or below it.
     */
    private boolean vwapEntryGate;

    /** Seed the net credit VWAP from the day's minute candles when a candidate is picked. */
    @Builder.Default
    private boolean vwapPrefill = true;

    @Builder.Default
    private OrderType orderType = OrderType.MARKET;
}
