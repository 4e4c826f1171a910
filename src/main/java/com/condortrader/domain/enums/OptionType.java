package com.condortrader.domain.enums;

/** Option right. Names match the Kite instrument_type field (CE = call, PE = put). */
public enum OptionType {
    CE,
    PE;

    public boolean isCall() {
        return this == CE;
    }
}
