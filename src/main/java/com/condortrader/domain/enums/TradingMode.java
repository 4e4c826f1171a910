package com.condortrader.domain.enums;

/** Process mode selected at launch. */
public enum TradingMode {
    LIVE,
    BACKTEST
}
