package com.condortrader.backtest;

import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.PositionState;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One change of the strategy's state as seen at the end of a decision step.
 *
 * <p>{@code legQuantities} holds the open units per role, signed: positive for long legs,
 * negative for short ones. A leg waiting to replace a rolled one is keyed by its role and
 * reported under {@code rollQuantity}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrajectoryPoint {

    private LocalDateTime at;
    private String stepKind;
    private PositionState state;
    private String positionId;
    private Map<LegRole, Integer> legQuantities;
    private Integer rollQuantity;
    private BigDecimal realizedPnl;
    private int rollCount;

    /** True when the two points describe the same state, whatever their times. */
    public boolean sameStateAs(TrajectoryPoint other) {
        return other != null
                && state == other.state
                && Objects.equals(positionId, other.positionId)
                && Objects.equals(legQuantities, other.legQuantities)
                && Objects.equals(rollQuantity, other.rollQuantity)
                && compare(realizedPnl, other.realizedPnl)
                && rollCount == other.rollCount;
    }

    private static boolean compare(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }
}
