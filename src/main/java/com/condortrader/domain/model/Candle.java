package com.condortrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** One historical OHLCV bar of an instrument; {@code time} is the bar's start in IST. */
@Value
@Builder
public class Candle {

    LocalDateTime time;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;
}
