package com.condortrader.domain.model;

import com.condortrader.domain.enums.OptionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Static metadata of one listed option, taken from the Kite instrument dump
 * (or the instruments file of a recorded session).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionContract {

    private long instrumentToken;

    /** Exchange trading symbol, e.g. NIFTY24JAN22300CE. */
    private String tradingSymbol;

    /** NFO for NIFTY, BFO for SENSEX. */
    private String exchange;

    private BigDecimal strike;
    private OptionType optionType;
    private LocalDate expiry;
    private int lotSize;
}
