package com.condortrader.strategy;

import com.condortrader.chain.GreeksCalculator;
import com.condortrader.domain.enums.ExitReason;
import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.OrderIntent;
import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.enums.PositionState;
import com.condortrader.domain.enums.RejectCode;
import com.condortrader.domain.model.ExecutionEvent;
import com.condortrader.domain.model.LegAction;
import com.condortrader.domain.model.LegRoll;
import com.condortrader.domain.model.OptionChainEntry;
import com.condortrader.domain.model.OptionChainSnapshot;
import com.condortrader.domain.model.OptionContract;
import com.condortrader.domain.model.OptionLeg;
import com.condortrader.domain.model.OrderRef;
import com.condortrader.domain.model.Position;
import com.condortrader.risk.RiskDecision;
import com.condortrader.risk.RiskManager;
import com.condortrader.risk.RiskReason;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Iron condor strategy: sells an OTM call and an OTM put, buys further OTM call + put for
 * protection.
 *
 * <p><b>Market view:</b> Neutral/range-bound. Profits from theta decay and IV crush when
 * the underlying stays between the two short strikes.
 *
 * <p><b>States:</b>
 * <pre>
 *   IDLE -> EVALUATING -> ADJUSTING (entry fills) -> ENTERED
 *   ENTERED -> ADJUSTING (roll) -> ENTERED
 *   ENTERED / ADJUSTING -> EXITING -> CLOSED -> IDLE
 * </pre>
 * IDLE and EVALUATING are held here while no position exists; from entry on the state
 * lives on the {@link Position}.
 *
 * <p><b>Entry conditions:</b>
 * <ul>
 *   <li>Decision time within [entryStart, entryEnd]</li>
 *   <li>Days to expiry >= minDaysToExpiry, entries today < maxEntriesPerDay</li>
 *   <li>IV rank >= minIvRank</li>
 *   <li>Risk entry gate returns Continue and no selected instrument is held elsewhere</li>
 *   <li>With {@code vwapEntryGate}: the candidate's net credit went above its VWAP and is
 *       back at or below it ({@link NetCreditVwapGate})</li>
 * </ul>
 * The four opening orders go out as one batch, hedges first so the margin benefit
 * applies to the shorts.
 *
 * <p><b>Exit conditions:</b> closing risk verdicts (stop loss, max loss, rejected order),
 * time exit before expiry, intraday square-off, take profit, short-leg premium stop, a
 * failed entry and a failed roll. Exiting cancels open orders and buys back the shorts
 * before selling the hedges.
 *
 * <p><b>Adjustment (roll):</b> on a Hedge verdict the breached short is bought back and
 * sold again at the strike nearest rollTargetDelta between it and its hedge.
 *
 * <p>Not thread-safe: driven by the decision thread only.
 */
public class IronCondorStrategy implements OptionStrategy {

    private static final Logger log = LoggerFactory.getLogger(IronCondorStrategy.class);

    private static final DateTimeFormatter POSITION_DAY = DateTimeFormatter.ofPattern("yyMMdd");

    /** Opening order of the entry batch: hedges first. */
    private static final List<LegRole> ENTRY_ORDER =
            List.of(LegRole.LONG_CALL, LegRole.LONG_PUT, LegRole.SHORT_CALL, LegRole.SHORT_PUT);

    private final IronCondorConfig config;
    private final RiskManager riskManager;
    private final StrikeSelector strikeSelector;
    private final NetCreditVwapGate vwapGate = new NetCreditVwapGate();

    private PositionState state = PositionState.IDLE;
    private Position position;

    private LocalDate tradingDay;
    private int entriesToday;

    public IronCondorStrategy(IronCondorConfig config, RiskManager riskManager) {
        this(config, riskManager, new StrikeSelector(config));
    }

    public IronCondorStrategy(IronCondorConfig config, RiskManager riskManager, StrikeSelector strikeSelector) {
        this.config = config;
        this.riskManager = riskManager;
        this.strikeSelector = strikeSelector;
    }

    @Override
    public String getName() {
        return config.getStrategyName();
    }

    @Override
    public PositionState currentState() {
        return position != null ? position.getState() : state;
    }

    @Override
    public Optional<Position> activePosition() {
        return Optional.ofNullable(position);
    }

    @Override
    public void resume(Position resumed) {
        this.position = resumed;
        LocalDate day = resumed.getEntryTime().toLocalDate();
        if (!day.equals(tradingDay)) {
            tradingDay = day;
            entriesToday = 0;
        }
        entriesToday++;
        log.info(
                "Resumed position: id={}, state={}, legs={}, outstandingOrders={}",
                resumed.getId(),
                resumed.getState(),
                resumed.getLegs().size(),
                resumed.getOutstandingOrders().size());
    }

    @Override
    public void seedNetCreditVwap(VwapSeedRequest request, List<NetCreditBar> bars) {
        vwapGate.seed(request.tokens(), request.getTo().toLocalDate(), bars);
    }

    @Override
    public void restoreDailyEntries(LocalDate day, int entries) {
        if (!day.equals(tradingDay)) {
            tradingDay = day;
            entriesToday = 0;
        }
        entriesToday = Math.max(entriesToday, entries);
    }

    // ========================
    // EVALUATION
    // ========================

    @Override
    public StrategyDecision evaluate(StrategyContext context) {
        rollTradingDay(context.getNow().toLocalDate());

        if (position == null) {
            return evaluateEntry(context);
        }

        OptionChainSnapshot snapshot = context.getSnapshot();
        position.setUnrealizedPnl(position.computeUnrealizedPnl(snapshot).orElse(null));

        RiskDecision risk =
                riskManager.evaluate(position, snapshot, context.getRiskLimits(), context.getFeedStatus());

        if (position.getState() == PositionState.EXITING) {
            StrategyDecision.StrategyDecisionBuilder decision = StrategyDecision.builder().riskDecision(risk);
            issueMissingCloses(decision, snapshot);
            return decision.build();
        }

        if (risk.requiresClose()) {
            return beginExit(exitReasonFor(risk.getReason()), context.getNow(), snapshot, risk);
        }

        Optional<ExitReason> ruleExit = checkExitRules(context);
        if (ruleExit.isPresent()) {
            return beginExit(ruleExit.get(), context.getNow(), snapshot, risk);
        }

        if (position.getState() == PositionState.ADJUSTING && position.getPendingRoll() != null) {
            Duration elapsed = Duration.between(position.getPendingRoll().getStartedAt(), context.getNow());
            if (elapsed.compareTo(config.getRollTimeout()) > 0) {
                log.warn("Roll timed out: position={}, elapsed={}", position.getId(), elapsed);
                return beginExit(ExitReason.ROLL_FAILED, context.getNow(), snapshot, risk);
            }
        }

        if (position.getState() == PositionState.ENTERED && risk.getType() == RiskDecision.Type.HEDGE) {
            return startRoll(risk, context);
        }

        return StrategyDecision.builder().riskDecision(risk).build();
    }

    private StrategyDecision evaluateEntry(StrategyContext context) {
        state = PositionState.IDLE;
        OptionChainSnapshot snapshot = context.getSnapshot();
        LocalDateTime now = context.getNow();
        StrategyDecision.StrategyDecisionBuilder decision = StrategyDecision.builder();

        // sampled on every step without a position, inside the entry window or not
        NetCreditVwapGate.Signal vwapSignal =
                config.isVwapEntryGate() ? trackNetCredit(snapshot, now, decision) : null;

        if (!entryPreconditionsHold(context)) {
            return decision.build();
        }

        RiskDecision gate =
                riskManager.evaluateEntry(context.getOpenPositions(), context.getFeedStatus(), context.getRiskLimits());
        decision.riskDecision(gate);
        if (gate.blocksEntries()) {
            return decision.note("Entry blocked: " + gate.getReason()).build();
        }

        state = PositionState.EVALUATING;

        int lots = riskManager.allowedLots(config.getLots(), context.getRiskLimits());
        if (lots <= 0) {
            return decision.note("Entry sized to zero lots").build();
        }

        Optional<StrikeSelection> selection = strikeSelector.select(snapshot);
        if (selection.isEmpty()) {
            return decision.note("Strikes not quoted yet").build();
        }

        StrikeSelection strikes = selection.get();
        for (LegRole role : LegRole.values()) {
            if (context.getClaimedInstruments()
                    .contains(strikes.entry(role).getContract().getInstrumentToken())) {
                return decision
                        .note("Instrument already held: " + strikes.entry(role).getContract().getTradingSymbol())
                        .build();
            }
        }

        if (config.isVwapEntryGate() && vwapSignal != NetCreditVwapGate.Signal.TRIGGERED) {
            return decision.build();
        }

        String positionId = snapshot.getIndex().name() + "-" + now.format(POSITION_DAY) + "-" + (entriesToday + 1);
        List<OptionLeg> legs = new ArrayList<>();
        for (LegRole role : LegRole.values()) {
            OptionContract contract = strikes.entry(role).getContract();
            int lotSize = contract.getLotSize() > 0 ? contract.getLotSize() : snapshot.getIndex().getDefaultLotSize();
            legs.add(OptionLeg.fromContract(positionId + "-" + role.name(), role, contract, lots * lotSize));
        }

        position = Position.open(positionId, config.getStrategyName(), snapshot.getIndex(), legs, now);
        entriesToday++;

        decision.openedPosition(position)
                .note("Entry: ivRank=" + context.getIvRank() + ", spot=" + snapshot.getSpot()
                        + ", strikes=" + describe(strikes)
                        + (config.isVwapEntryGate()
                                ? ", netCredit=" + vwapGate.getLastCredit() + ", vwap=" + vwapGate.vwap().orElse(null)
                                : ""));

        for (LegRole role : ENTRY_ORDER) {
            OptionLeg leg = position.leg(role);
            OptionChainEntry quote = strikes.entry(role);
            decision.action(
                    newAction(leg, leg.getSide(), leg.getQuantity(), OrderIntent.OPEN, referencePrice(quote, leg.getSide()), "ENTRY"));
        }

        log.info(
                "Entering iron condor: position={}, lots={}, shortCall={}, shortPut={}",
                positionId,
                lots,
                strikes.shortCall().getContract().getStrike(),
                strikes.shortPut().getContract().getStrike());
        return decision.build();
    }

    /**
     * Feeds the net credit of the condor the selector would pick now into the VWAP gate.
     * Null while no candidate is quoted. A new candidate asks for its history.
     */
    private NetCreditVwapGate.Signal trackNetCredit(
            OptionChainSnapshot snapshot, LocalDateTime now, StrategyDecision.StrategyDecisionBuilder decision) {
        if (!snapshot.hasSpot()) {
            return null;
        }
        Optional<StrikeSelection> candidate = strikeSelector.select(snapshot);
        if (candidate.isEmpty()) {
            return null;
        }

        NetCreditVwapGate.Signal signal = vwapGate.observe(candidate.get(), now.toLocalDate());
        if (signal == NetCreditVwapGate.Signal.RESTARTED
                && config.isVwapPrefill()
                && now.toLocalTime().isAfter(NetCreditVwapGate.SESSION_OPEN)) {
            StrikeSelection strikes = candidate.get();
            decision.vwapSeedRequest(VwapSeedRequest.builder()
                    .shortCall(strikes.shortCall().getContract())
                    .shortPut(strikes.shortPut().getContract())
                    .longCall(strikes.longCall().getContract())
                    .longPut(strikes.longPut().getContract())
                    .from(now.toLocalDate().atTime(NetCreditVwapGate.SESSION_OPEN))
                    .to(now)
                    .build());
        } else if (signal == NetCreditVwapGate.Signal.ARMED) {
            decision.note("Entry armed: netCredit=" + vwapGate.getLastCredit() + " above vwap="
                    + vwapGate.vwap().orElse(null));
        }
        return signal;
    }

    private boolean entryPreconditionsHold(StrategyContext context) {
        LocalDateTime now = context.getNow();
        OptionChainSnapshot snapshot = context.getSnapshot();

        if (entriesToday >= config.getMaxEntriesPerDay()) {
            return false;
        }

        LocalTime time = now.toLocalTime();
        if (time.isBefore(config.getEntryStart()) || time.isAfter(config.getEntryEnd())) {
            return false;
        }

        if (snapshot.getExpiry() == null
                || ChronoUnit.DAYS.between(now.toLocalDate(), snapshot.getExpiry()) < config.getMinDaysToExpiry()) {
            return false;
        }

        BigDecimal ivRank = context.getIvRank();
        if (ivRank == null || ivRank.compareTo(config.getMinIvRank()) < 0) {
            return false;
        }

        return snapshot.hasSpot();
    }

    /**
     * Exit rules owned by the strategy. Price-based rules are skipped while the feed is
     * stale; the time-based ones are not.
     */
    private Optional<ExitReason> checkExitRules(StrategyContext context) {
        LocalDateTime now = context.getNow();
        OptionChainSnapshot snapshot = context.getSnapshot();

        LocalDate expiry = position.getLegs().get(0).getExpiry();
        if (expiry != null && !now.toLocalDate().isBefore(expiry)) {
            LocalTime cutoff = GreeksCalculator.MARKET_CLOSE.minusMinutes(config.getExitMinutesBeforeExpiry());
            if (!now.toLocalTime().isBefore(cutoff)) {
                return Optional.of(ExitReason.TIME_EXIT);
            }
        }

        if (config.getDailyExitTime() != null && !now.toLocalTime().isBefore(config.getDailyExitTime())) {
            return Optional.of(ExitReason.DAILY_SQUARE_OFF);
        }

        if (position.getState() != PositionState.ENTERED || context.getFeedStatus().isStale()) {
            return Optional.empty();
        }

        // total P&L, so losses realized by rolls count against the original credit
        BigDecimal unrealized = position.getUnrealizedPnl();
        if (config.getTakeProfitPct() != null
                && unrealized != null
                && position.getEntryCredit() != null
                && position.getEntryCredit().signum() > 0) {
            BigDecimal total = position.getRealizedPnl().add(unrealized);
            if (total.compareTo(position.getEntryCredit().multiply(config.getTakeProfitPct())) >= 0) {
                log.info(
                        "Take profit: position={}, totalPnl={}, credit={}",
                        position.getId(),
                        total,
                        position.getEntryCredit());
                return Optional.of(ExitReason.TAKE_PROFIT);
            }
        }

        if (config.getLegStopMultiplier() != null) {
            for (OptionLeg leg : position.getLegs()) {
                if (!leg.getRole().isShort() || leg.flat() || leg.getEntryPrice() == null) {
                    continue;
                }
                Optional<OptionChainEntry> quote = snapshot.entryByToken(leg.getInstrumentToken());
                if (quote.isPresent()
                        && quote.get().getPrice() != null
                        && quote.get().getPrice().compareTo(leg.getEntryPrice().multiply(config.getLegStopMultiplier()))
                                >= 0) {
                    log.info(
                            "Short leg premium stop: leg={}, ltp={}, entry={}",
                            leg.getTradingSymbol(),
                            quote.get().getPrice(),
                            leg.getEntryPrice());
                    return Optional.of(ExitReason.LEG_PREMIUM_STOP);
                }
            }
        }

        return Optional.empty();
    }

    // ========================
    // ADJUSTMENT (roll)
    // ========================

    private StrategyDecision startRoll(RiskDecision risk, StrategyContext context) {
        OptionChainSnapshot snapshot = context.getSnapshot();
        OptionLeg shortLeg = position.leg(risk.getRole());
        OptionLeg hedgeLeg = position.leg(risk.getRole().hedge());

        Optional<OptionChainEntry> target =
                strikeSelector.selectRoll(snapshot, shortLeg, hedgeLeg, config.getRollTargetDelta());
        if (target.isEmpty()) {
            log.warn(
                    "No roll strike between {} and {} for {}: position={}",
                    shortLeg.getStrike(),
                    hedgeLeg.getStrike(),
                    shortLeg.getRole(),
                    position.getId());
            return beginExit(ExitReason.ROLL_FAILED, context.getNow(), snapshot, risk);
        }

        OptionChainEntry replacement = target.get();
        String newLegId = position.getId() + "-" + shortLeg.getRole().name() + "-R" + (position.getRollCount() + 1);
        OptionLeg newLeg =
                OptionLeg.fromContract(newLegId, shortLeg.getRole(), replacement.getContract(), shortLeg.getQuantity());

        OrderSide closeSide = shortLeg.getSide().opposite();
        LegAction close = newAction(
                shortLeg,
                closeSide,
                shortLeg.openQuantity(),
                OrderIntent.CLOSE,
                snapshot.entryByToken(shortLeg.getInstrumentToken())
                        .map(q -> referencePrice(q, closeSide))
                        .orElse(null),
                "ROLL_CLOSE");

        position.setPendingRoll(LegRoll.builder()
                .role(shortLeg.getRole())
                .oldLegId(shortLeg.getLegId())
                .newLeg(newLeg)
                .startedAt(context.getNow())
                .closeOrderId(close.getClientOrderId())
                .build());

        LegAction open = newAction(
                newLeg,
                newLeg.getSide(),
                newLeg.getQuantity(),
                OrderIntent.OPEN,
                referencePrice(replacement, newLeg.getSide()),
                "ROLL_OPEN");
        position.getPendingRoll().setOpenOrderId(open.getClientOrderId());
        position.setState(PositionState.ADJUSTING);

        log.info(
                "Rolling {}: position={}, from={}, to={}, breach={}",
                shortLeg.getRole(),
                position.getId(),
                shortLeg.getStrike(),
                replacement.getContract().getStrike(),
                risk.getBreach());

        return StrategyDecision.builder()
                .riskDecision(risk)
                .action(close)
                .action(open)
                .note("Roll " + shortLeg.getRole() + " " + shortLeg.getStrike() + " -> "
                        + replacement.getContract().getStrike())
                .build();
    }

    // ========================
    // EXIT
    // ========================

    private StrategyDecision beginExit(
            ExitReason reason, LocalDateTime now, OptionChainSnapshot snapshot, RiskDecision risk) {
        position.setState(PositionState.EXITING);
        position.setExitReason(reason);

        StrategyDecision.StrategyDecisionBuilder decision = StrategyDecision.builder()
                .riskDecision(risk)
                .note("Exit: " + reason);

        for (OrderRef ref : position.getOutstandingOrders().values()) {
            if (ref.intent() == OrderIntent.OPEN) {
                decision.cancel(ref.orderId());
            }
        }

        issueMissingCloses(decision, snapshot);

        log.info(
                "Exiting position: id={}, reason={}, unrealizedPnl={}, at={}",
                position.getId(),
                reason,
                position.getUnrealizedPnl(),
                now);
        return decision.build();
    }

    /**
     * Submits a close for every leg holding units without a pending close. Shorts come
     * first so the hedges stay in place until the short risk is gone. Legs whose close was
     * abandoned are left alone.
     */
    private void issueMissingCloses(StrategyDecision.StrategyDecisionBuilder decision, OptionChainSnapshot snapshot) {
        List<OptionLeg> open = position.liveLegs().stream()
                .filter(leg -> !leg.flat())
                .filter(leg -> !leg.isCloseAbandoned())
                .filter(leg -> !position.hasOutstandingOrder(leg.getLegId(), OrderIntent.CLOSE))
                .sorted(Comparator.comparing((OptionLeg leg) -> !leg.getRole().isShort())
                        .thenComparing(OptionLeg::getRole))
                .toList();

        for (OptionLeg leg : open) {
            OrderSide side = leg.getSide().opposite();
            BigDecimal reference = snapshot != null
                    ? snapshot.entryByToken(leg.getInstrumentToken())
                            .map(q -> referencePrice(q, side))
                            .orElse(null)
                    : null;
            decision.action(newAction(
                    leg, side, leg.openQuantity(), OrderIntent.CLOSE, reference, "EXIT_" + position.getExitReason()));
        }
    }

    private static ExitReason exitReasonFor(RiskReason reason) {
        return switch (reason) {
            case STOP_LOSS_BREACHED -> ExitReason.STOP_LOSS_BREACHED;
            case MAX_LOSS_BREACHED -> ExitReason.MAX_LOSS_BREACHED;
            case ORDER_REJECTED -> ExitReason.ORDER_REJECTED;
            default -> throw new IllegalArgumentException("Risk reason does not close positions: " + reason);
        };
    }

    // ========================
    // EXECUTION FEEDBACK
    // ========================

    @Override
    public StrategyDecision onExecutionEvent(ExecutionEvent event, LocalDateTime now) {
        if (position == null || !position.getId().equals(event.getPositionId())) {
            log.warn(
                    "Execution event for unknown position: position={}, order={}, type={}",
                    event.getPositionId(),
                    event.getOrderId(),
                    event.getType());
            return StrategyDecision.none();
        }

        StrategyDecision.StrategyDecisionBuilder decision = StrategyDecision.builder();

        switch (event.getType()) {
            case ACKNOWLEDGED -> log.debug(
                    "Order acknowledged: order={}, brokerOrderId={}", event.getOrderId(), event.getBrokerOrderId());
            case FILL -> applyFill(event);
            case CANCELLED -> position.untrackOrder(event.getOrderId());
            case REJECTED -> applyRejection(event, now, decision);
        }

        progress(now, decision);
        return decision.build();
    }

    private void applyFill(ExecutionEvent event) {
        if (!position.markFillApplied(event.fillKey())) {
            log.debug("Duplicate fill dropped: key={}", event.fillKey());
            return;
        }

        Optional<OptionLeg> leg = position.findLeg(event.getLegId());
        if (leg.isEmpty()) {
            log.warn("Fill for unknown leg dropped: order={}, leg={}", event.getOrderId(), event.getLegId());
            return;
        }

        if (event.getIntent() == OrderIntent.OPEN) {
            leg.get().applyOpenFill(event.getQuantity(), event.getPrice());
        } else {
            BigDecimal realized = leg.get().applyCloseFill(event.getQuantity(), event.getPrice());
            log.debug("Close fill: leg={}, qty={}, realized={}", leg.get().getLegId(), event.getQuantity(), realized);
        }
        position.recomputeRealizedPnl();

        position.orderRef(event.getOrderId())
                .filter(ref -> event.getFillSeq() >= ref.quantity())
                .ifPresent(ref -> position.untrackOrder(ref.orderId()));
    }

    private void applyRejection(ExecutionEvent event, LocalDateTime now, StrategyDecision.StrategyDecisionBuilder decision) {
        Optional<OrderRef> ref = position.orderRef(event.getOrderId());
        position.untrackOrder(event.getOrderId());
        position.setPermanentRejection(event.getRejectCode());

        log.warn(
                "Order rejected: position={}, order={}, code={}, message={}",
                position.getId(),
                event.getOrderId(),
                event.getRejectCode(),
                event.getMessage());

        if (ref.isPresent() && ref.get().intent() == OrderIntent.CLOSE) {
            position.findLeg(ref.get().legId())
                    .ifPresent(leg -> countCloseRejection(leg, event.getRejectCode(), decision));
        }

        if (position.getState() == PositionState.EXITING) {
            // a leg with close attempts left is picked up again by issueMissingCloses
            return;
        }

        ExitReason reason;
        if (position.getPendingRoll() != null) {
            reason = ExitReason.ROLL_FAILED;
        } else if (ref.isPresent() && ref.get().intent() == OrderIntent.OPEN && !position.entryComplete()) {
            reason = ExitReason.ENTRY_FAILED;
        } else {
            reason = ExitReason.ORDER_REJECTED;
        }

        StrategyDecision exit = beginExit(reason, now, null, null);
        decision.notes(exit.getNotes());
        decision.cancelOrderIds(exit.getCancelOrderIds());
        decision.actions(exit.getActions());
    }

    /**
     * A close goes out again after a retryable rejection until the leg has used its attempts.
     * A non-retryable rejection or the last attempt abandons the leg and raises an alert;
     * the position then stays EXITING, holding no new entries, until an operator steps in.
     */
    private void countCloseRejection(
            OptionLeg leg, RejectCode code, StrategyDecision.StrategyDecisionBuilder decision) {
        leg.setCloseRejections(leg.getCloseRejections() + 1);
        boolean retryable = code != null && code.isRetryable();
        if (retryable && leg.getCloseRejections() < config.getMaxCloseAttempts()) {
            log.info(
                    "Close rejected, sending again: position={}, leg={}, attempt={}/{}",
                    position.getId(),
                    leg.getTradingSymbol(),
                    leg.getCloseRejections(),
                    config.getMaxCloseAttempts());
            return;
        }

        leg.setCloseAbandoned(true);
        String alert = "Close abandoned: position=" + position.getId()
                + ", leg=" + leg.getTradingSymbol()
                + ", openQuantity=" + leg.openQuantity()
                + ", rejections=" + leg.getCloseRejections()
                + ", code=" + code;
        log.error("{}; manual intervention required", alert);
        decision.alert(alert);
        decision.note(alert);
    }

    /** Moves the position forward once the fills of the current step are in. */
    private void progress(LocalDateTime now, StrategyDecision.StrategyDecisionBuilder decision) {
        switch (position.getState()) {
            case ADJUSTING -> {
                LegRoll roll = position.getPendingRoll();
                if (roll == null && position.entryComplete()) {
                    position.setEntryCredit(computeEntryCredit());
                    position.setState(PositionState.ENTERED);
                    decision.note("Entered: credit=" + position.getEntryCredit());
                    log.info("Position entered: id={}, credit={}", position.getId(), position.getEntryCredit());
                } else if (roll != null
                        && position.findLeg(roll.getOldLegId()).map(OptionLeg::flat).orElse(true)
                        && roll.getNewLeg().fullyOpened()) {
                    position.completeRoll();
                    position.setState(PositionState.ENTERED);
                    decision.note("Roll complete: " + roll.getRole() + " at " + roll.getNewLeg().getStrike());
                    log.info("Roll complete: position={}, role={}, strike={}",
                            position.getId(), roll.getRole(), roll.getNewLeg().getStrike());
                }
            }
            case EXITING -> {
                if (position.flat() && !position.hasOutstandingOrders()) {
                    close(now, decision);
                } else {
                    // late fills on cancelled opening orders leave units without a close
                    issueMissingCloses(decision, null);
                }
            }
            default -> {
                // ENTERED needs nothing from fills
            }
        }
    }

    private void close(LocalDateTime now, StrategyDecision.StrategyDecisionBuilder decision) {
        position.recomputeRealizedPnl();
        position.setUnrealizedPnl(BigDecimal.ZERO);
        position.setExitTime(now);
        position.setState(PositionState.CLOSED);
        decision.closedPosition(position);
        decision.note("Closed: reason=" + position.getExitReason() + ", realizedPnl=" + position.getRealizedPnl());
        log.info(
                "Position closed: id={}, reason={}, realizedPnl={}",
                position.getId(),
                position.getExitReason(),
                position.getRealizedPnl());
        position = null;
        state = PositionState.CLOSED;
    }

    // ========================
    // INTERNALS
    // ========================

    private void rollTradingDay(LocalDate day) {
        if (!day.equals(tradingDay)) {
            tradingDay = day;
            entriesToday = 0;
        }
    }

    private LegAction newAction(
            OptionLeg leg, OrderSide side, int quantity, OrderIntent intent, BigDecimal referencePrice, String reason) {
        String orderId = position.nextOrderId();
        position.trackOrder(new OrderRef(orderId, leg.getLegId(), intent, quantity));
        return LegAction.builder()
                .clientOrderId(orderId)
                .positionId(position.getId())
                .legId(leg.getLegId())
                .role(leg.getRole())
                .contract(leg.toContract())
                .side(side)
                .quantity(quantity)
                .orderType(config.getOrderType())
                .referencePrice(referencePrice)
                .intent(intent)
                .reason(reason)
                .build();
    }

    /** Net premium received: sold premium minus paid premium. */
    private BigDecimal computeEntryCredit() {
        return position.getLegs().stream()
                .filter(leg -> leg.getEntryPrice() != null)
                .map(leg -> leg.getEntryPrice()
                        .multiply(BigDecimal.valueOf(leg.getOpenedQuantity()))
                        .multiply(BigDecimal.valueOf(-leg.getSide().sign())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal referencePrice(OptionChainEntry quote, OrderSide side) {
        BigDecimal touch = side == OrderSide.BUY ? quote.getAsk() : quote.getBid();
        return touch != null && touch.signum() > 0 ? touch : quote.getPrice();
    }

    private static String describe(StrikeSelection strikes) {
        return strikes.longPut().getContract().getStrike().toPlainString() + "PE/"
                + strikes.shortPut().getContract().getStrike().toPlainString() + "PE/"
                + strikes.shortCall().getContract().getStrike().toPlainString() + "CE/"
                + strikes.longCall().getContract().getStrike().toPlainString() + "CE";
    }
}
