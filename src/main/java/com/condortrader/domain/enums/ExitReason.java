package com.condortrader.domain.enums;

/** Why a Position moved to EXITING. Stored on the archived Position. */
public enum ExitReason {
    STOP_LOSS_BREACHED,
    MAX_LOSS_BREACHED,
    ORDER_REJECTED,
    ENTRY_FAILED,
    ROLL_FAILED,
    TIME_EXIT,
    DAILY_SQUARE_OFF,
    TAKE_PROFIT,
    LEG_PREMIUM_STOP,
    SHUTDOWN
}
