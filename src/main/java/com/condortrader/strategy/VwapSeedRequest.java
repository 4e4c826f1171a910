package com.condortrader.strategy;

import com.condortrader.domain.model.OptionContract;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Asks the session for the history of a candidate condor's net credit, so its VWAP does
 * not start from the first live sample. The answer comes back through
 * {@link OptionStrategy#seedNetCreditVwap}.
 */
@Value
@Builder
public class VwapSeedRequest {

    OptionContract shortCall;
    OptionContract shortPut;
    OptionContract longCall;
    OptionContract longPut;
    LocalDateTime from;
    LocalDateTime to;

    /** Instrument tokens: short call, short put, long call, long put. */
    public List<Long> tokens() {
        return List.of(
                shortCall.getInstrumentToken(),
                shortPut.getInstrumentToken(),
                longCall.getInstrumentToken(),
                longPut.getInstrumentToken());
    }
}
