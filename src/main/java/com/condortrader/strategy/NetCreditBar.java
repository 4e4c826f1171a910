package com.condortrader.strategy;

import com.condortrader.domain.model.Candle;
import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Value;

/**
 * One bar of a condor's net credit (shorts minus longs), combined from the four legs'
 * candles of the same minute. The high pairs the shorts' highs with the longs' lows and the
 * low the other way round.
 */
@Value
@Builder
public class NetCreditBar {

    private static final BigDecimal FOUR = BigDecimal.valueOf(4);

    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;

    /** Combined volume of the four legs. */
    long volume;

    public static NetCreditBar combine(Candle shortCall, Candle shortPut, Candle longCall, Candle longPut) {
        return NetCreditBar.builder()
                .open(shortCall.getOpen().add(shortPut.getOpen()).subtract(longCall.getOpen()).subtract(longPut.getOpen()))
                .high(shortCall.getHigh().add(shortPut.getHigh()).subtract(longCall.getLow()).subtract(longPut.getLow()))
                .low(shortCall.getLow().add(shortPut.getLow()).subtract(longCall.getHigh()).subtract(longPut.getHigh()))
                .close(shortCall.getClose().add(shortPut.getClose()).subtract(longCall.getClose()).subtract(longPut.getClose()))
                .volume(shortCall.getVolume() + shortPut.getVolume() + longCall.getVolume() + longPut.getVolume())
                .build();
    }

    /** (open + high + low + close) / 4 */
    public BigDecimal typicalPrice() {
        return open.add(high).add(low).add(close).divide(FOUR, 6, RoundingMode.HALF_UP);
    }
}
