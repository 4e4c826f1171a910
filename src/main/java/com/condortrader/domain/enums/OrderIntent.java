package com.condortrader.domain.enums;

/** Whether an order opens (adds to) or closes (reduces) its leg. */
public enum OrderIntent {
    OPEN,
    CLOSE
}
