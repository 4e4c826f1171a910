package com.condortrader.domain.enums;

/**
 * Iron condor lifecycle.
 *
 * <pre>
 *   IDLE -> EVALUATING -> ADJUSTING (entry fills pending) -> ENTERED
 *   ENTERED -> ADJUSTING (roll) -> ENTERED
 *   ENTERED / ADJUSTING -> EXITING -> CLOSED
 * </pre>
 *
 * IDLE and EVALUATING belong to the strategy (no Position exists yet); the others are
 * carried by the Position itself.
 */
public enum PositionState {
    IDLE,
    EVALUATING,
    ENTERED,
    ADJUSTING,
    EXITING,
    CLOSED;

    /** States in which a Position exists and must hold all four legs. */
    public boolean holdsLegs() {
        return this == ENTERED || this == ADJUSTING || this == EXITING;
    }
}
