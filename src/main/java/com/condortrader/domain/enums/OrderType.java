package com.condortrader.domain.enums;

/** Order types the core places. Index options legs go out as MARKET or LIMIT. */
public enum OrderType {
    MARKET,
    LIMIT
}
