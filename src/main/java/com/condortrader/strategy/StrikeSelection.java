package com.condortrader.strategy;

import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.model.OptionChainEntry;

/** The four quoted strikes chosen for an iron condor entry. */
public record StrikeSelection(
        OptionChainEntry shortCall, OptionChainEntry longCall, OptionChainEntry shortPut, OptionChainEntry longPut) {

    public OptionChainEntry entry(LegRole role) {
        return switch (role) {
            case SHORT_CALL -> shortCall;
            case LONG_CALL -> longCall;
            case SHORT_PUT -> shortPut;
            case LONG_PUT -> longPut;
        };
    }
}
