package com.condortrader.domain.enums;

import java.math.BigDecimal;
import lombok.Getter;

/**
 * Tradable index underlyings.
 *
 * <p>NIFTY options trade on NFO and SENSEX options on BFO. The spot quote for each index
 * comes from the cash-market index instrument ({@link #spotSymbol}).
 */
@Getter
public enum IndexName {
    NIFTY("NIFTY", "NFO", "NSE:NIFTY 50", 256265L, new BigDecimal("50"), 75),
    SENSEX("SENSEX", "BFO", "BSE:SENSEX", 265L, new BigDecimal("100"), 20);

    /** Instrument "name" column in the Kite instrument dump. */
    private final String instrumentName;

    /** Derivatives segment where the options are listed. */
    private final String exchange;

    /** Quote key of the index itself, used for spot snapshots. */
    private final String spotSymbol;

    /** Kite instrument token of the index (ticks carry spot for Greeks). */
    private final long spotToken;

    /** Listed strike spacing. */
    private final BigDecimal strikeInterval;

    /** Default exchange lot size; contracts from the registry override it. */
    private final int defaultLotSize;

    IndexName(
            String instrumentName,
            String exchange,
            String spotSymbol,
            long spotToken,
            BigDecimal strikeInterval,
            int defaultLotSize) {
        this.instrumentName = instrumentName;
        this.exchange = exchange;
        this.spotSymbol = spotSymbol;
        this.spotToken = spotToken;
        this.strikeInterval = strikeInterval;
        this.defaultLotSize = defaultLotSize;
    }
}
