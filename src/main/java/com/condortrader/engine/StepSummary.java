package com.condortrader.engine;

import com.condortrader.domain.enums.PositionState;
import com.condortrader.domain.model.Position;

/**
 * State after one decision step.
 *
 * @param strategyState strategy lifecycle state
 * @param position      the active position, or null when there is none; live object, read only
 * @param stepKind      TICK or TIMER
 */
public record StepSummary(PositionState strategyState, Position position, String stepKind) {}
