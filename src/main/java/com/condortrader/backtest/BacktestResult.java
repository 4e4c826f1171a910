package com.condortrader.backtest;

import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.model.Position;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one backtest run, written as the JSON report.
 */
@Data
@Builder
public class BacktestResult {

    private IndexName index;
    private LocalDate expiry;
    private LocalDateTime firstTick;
    private LocalDateTime lastTick;
    private int ticksReplayed;
    private long ordersSubmitted;
    private long failedSteps;

    @Builder.Default
    private List<TrajectoryPoint> trajectory = new ArrayList<>();

    @Builder.Default
    private List<Position> closedPositions = new ArrayList<>();

    /** Position still held when the ticks ran out, or null. */
    private Position openPosition;

    /** Sum over closed positions, plus what the open one has realized so far. */
    private BigDecimal totalRealizedPnl;
}
