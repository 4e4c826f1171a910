package com.condortrader.domain.model;

import com.condortrader.domain.enums.OptionType;
import java.math.BigDecimal;

/**
 * Chain key. Strikes are normalized so 22300 and 22300.00 address the same entry.
 */
public record StrikeKey(BigDecimal strike, OptionType optionType) {

    public StrikeKey {
        strike = strike.stripTrailingZeros();
    }

    public static StrikeKey of(BigDecimal strike, OptionType optionType) {
        return new StrikeKey(strike, optionType);
    }
}
