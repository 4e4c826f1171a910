package com.condortrader.backtest;

import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.PositionState;
import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.OptionLeg;
import com.condortrader.domain.model.Order;
import com.condortrader.domain.model.Position;
import com.condortrader.engine.DecisionObserver;
import com.condortrader.engine.StepSummary;
import com.condortrader.mapper.JsonHelper;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Records the position/state trajectory of a run: one {@link TrajectoryPoint} per step
 * that changed the strategy state, the position, a leg quantity or the realized P&L.
 * Closed positions are kept as detached copies.
 */
public class TrajectoryRecorder implements DecisionObserver {

    static final String STEP_CLOSE = "CLOSE";

    private final List<TrajectoryPoint> points = new ArrayList<>();
    private final List<Position> closedPositions = new ArrayList<>();

    private long ordersSubmitted;

    @Override
    public void onStepCompleted(LocalDateTime at, StepSummary summary) {
        TrajectoryPoint point = toPoint(at, summary);
        TrajectoryPoint last = points.isEmpty() ? null : points.get(points.size() - 1);
        if (!point.sameStateAs(last)) {
            points.add(point);
        }
    }

    @Override
    public void onPositionClosed(Position position, LocalDateTime at) {
        closedPositions.add(JsonHelper.deepCopy(position, Position.class));
        // the strategy is already back to IDLE when the step completes
        Map<LegRole, Integer> quantities = new EnumMap<>(LegRole.class);
        for (OptionLeg leg : position.getLegs()) {
            quantities.put(leg.getRole(), signed(leg));
        }
        points.add(TrajectoryPoint.builder()
                .at(at)
                .stepKind(STEP_CLOSE)
                .state(PositionState.CLOSED)
                .positionId(position.getId())
                .legQuantities(quantities)
                .realizedPnl(position.getRealizedPnl())
                .rollCount(position.getRollCount())
                .build());
    }

    @Override
    public void onOrderSubmitted(Order order, LegAction action, LocalDateTime at) {
        ordersSubmitted++;
    }

    public List<TrajectoryPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public List<Position> getClosedPositions() {
        return Collections.unmodifiableList(closedPositions);
    }

    public long getOrdersSubmitted() {
        return ordersSubmitted;
    }

    static TrajectoryPoint toPoint(LocalDateTime at, StepSummary summary) {
        Position position = summary.position();
        TrajectoryPoint.TrajectoryPointBuilder builder = TrajectoryPoint.builder()
                .at(at)
                .stepKind(summary.stepKind())
                .state(summary.strategyState());
        if (position == null) {
            return builder.legQuantities(Map.of()).build();
        }
        Map<LegRole, Integer> quantities = new EnumMap<>(LegRole.class);
        for (OptionLeg leg : position.getLegs()) {
            quantities.put(leg.getRole(), signed(leg));
        }
        return builder
                .positionId(position.getId())
                .legQuantities(quantities)
                .rollQuantity(position.getPendingRoll() != null ? signed(position.getPendingRoll().getNewLeg()) : null)
                .realizedPnl(position.getRealizedPnl())
                .rollCount(position.getRollCount())
                .build();
    }

    private static int signed(OptionLeg leg) {
        return leg.getSide().sign() * leg.openQuantity();
    }
}
