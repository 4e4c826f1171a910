package com.condortrader.event;

/**
 * Classifies the lifecycle step that triggered a {@link PositionEvent}.
 */
public enum PositionEventType {

    /** Entry orders submitted; the position holds its four legs with no fills yet. */
    OPENED,

    /** All four entry legs filled. */
    ENTERED,

    /** A short leg is being rolled. */
    ADJUSTED,

    /** Close orders submitted for every leg. */
    EXITING,

    /** All legs flat; realized P&L is final. */
    CLOSED,

    /** Rebuilt from a snapshot at startup. */
    RECOVERED
}
