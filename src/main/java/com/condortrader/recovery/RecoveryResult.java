package com.condortrader.recovery;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of the startup recovery sequence.
 */
@Data
@Builder
public class RecoveryResult {

    private long durationMs;

    /** Non-terminal orders put back under execution management. */
    private int ordersRestored;

    @Builder.Default
    private List<String> positionsResumed = new ArrayList<>();

    /** Snapshots not resumed because the strategy already holds a position. */
    @Builder.Default
    private List<String> positionsSkipped = new ArrayList<>();

    /** Logged fills newer than their position's snapshot, applied again. */
    private int fillsReplayed;

    /** Positions entered on the trading day, counted against the daily entry limit. */
    private int entriesToday;
}
