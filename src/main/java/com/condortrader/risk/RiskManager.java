package com.condortrader.risk;

import com.condortrader.domain.enums.PositionState;
import com.condortrader.domain.model.FeedStatus;
import com.condortrader.domain.model.OptionChainEntry;
import com.condortrader.domain.model.OptionChainSnapshot;
import com.condortrader.domain.model.OptionLeg;
import com.condortrader.domain.model.Position;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Risk checks for iron condor positions.
 *
 * <p>Every method is a pure function of its arguments: no state besides the Position
 * passed in, no clock, no I/O. That is what lets backtests and live trading take identical
 * decisions from identical ticks.
 *
 * <p>Precedence inside {@link #evaluate}:
 * <ol>
 *   <li>FEED_STALE: prices cannot be trusted, so neither P&L exits nor hedges fire</li>
 *   <li>ORDER_REJECTED: a permanent rejection was recorded on the position</li>
 *   <li>MAX_LOSS_BREACHED, then STOP_LOSS_BREACHED on the mark-to-market</li>
 *   <li>HEDGE for the short leg with the largest |delta| breach (ENTERED only)</li>
 *   <li>CONTINUE</li>
 * </ol>
 * The strategy must act on a closing ForceExit whatever its own state.
 */
@Component
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    public RiskDecision evaluate(
            Position position, OptionChainSnapshot snapshot, RiskLimits limits, FeedStatus feedStatus) {
        if (feedStatus.isStale()) {
            return RiskDecision.forceExit(RiskReason.FEED_STALE);
        }

        if (position.getPermanentRejection() != null) {
            return RiskDecision.forceExit(RiskReason.ORDER_REJECTED);
        }

        Optional<BigDecimal> unrealized = position.computeUnrealizedPnl(snapshot);
        if (unrealized.isPresent()) {
            BigDecimal pnl = unrealized.get();
            if (pnl.compareTo(limits.getMaxLossPerPosition().negate()) <= 0) {
                log.debug("Max loss breached: position={}, pnl={}", position.getId(), pnl);
                return RiskDecision.forceExit(RiskReason.MAX_LOSS_BREACHED);
            }
            if (pnl.compareTo(limits.stopLossThreshold()) <= 0) {
                log.debug("Stop loss breached: position={}, pnl={}", position.getId(), pnl);
                return RiskDecision.forceExit(RiskReason.STOP_LOSS_BREACHED);
            }
        }

        if (position.getState() == PositionState.ENTERED) {
            return largestDeltaBreach(position, snapshot, limits.getHedgeTriggerDelta());
        }

        return RiskDecision.continueTrading();
    }

    /**
     * Entry gate evaluated while no position is open for the strategy.
     *
     * @param openPositions positions currently open in the process
     */
    public RiskDecision evaluateEntry(int openPositions, FeedStatus feedStatus, RiskLimits limits) {
        if (feedStatus.isStale()) {
            return RiskDecision.forceExit(RiskReason.FEED_STALE);
        }
        if (openPositions >= limits.getMaxPositions()) {
            return RiskDecision.forceExit(RiskReason.MAX_POSITIONS_EXCEEDED);
        }
        return RiskDecision.continueTrading();
    }

    /** Lots allowed for a new entry, at least 0. */
    public int allowedLots(int requestedLots, RiskLimits limits) {
        Integer cap = limits.getMaxLotsPerPosition();
        int lots = cap != null ? Math.min(requestedLots, cap) : requestedLots;
        return Math.max(lots, 0);
    }

    /**
     * Short leg whose |delta| exceeds the trigger by the most. Legs without Greeks are
     * skipped (unknown is not a breach). On an exact tie the call side, first in leg order,
     * wins.
     */
    private RiskDecision largestDeltaBreach(Position position, OptionChainSnapshot snapshot, BigDecimal trigger) {
        OptionLeg worst = null;
        BigDecimal worstBreach = BigDecimal.ZERO;

        for (OptionLeg leg : position.getLegs()) {
            if (!leg.getRole().isShort() || leg.flat()) {
                continue;
            }
            Optional<OptionChainEntry> quote = snapshot.entryByToken(leg.getInstrumentToken());
            if (quote.isEmpty() || !quote.get().hasGreeks()) {
                continue;
            }
            BigDecimal breach = quote.get().getDelta().abs().subtract(trigger);
            if (breach.signum() > 0 && breach.compareTo(worstBreach) > 0) {
                worst = leg;
                worstBreach = breach;
            }
        }

        if (worst == null) {
            return RiskDecision.continueTrading();
        }
        return RiskDecision.hedge(worst.getLegId(), worst.getRole(), worstBreach);
    }
}
