package com.condortrader.domain.model;

import com.condortrader.domain.enums.ExitReason;
import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.OrderIntent;
import com.condortrader.domain.enums.PositionState;
import com.condortrader.domain.enums.RejectCode;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A four-leg iron condor position.
 *
 * <p>Ownership: a Position is created and mutated only by the strategy that entered it, on
 * the decision thread. Risk checks read it and the execution layer refers to it by id; neither
 * changes it.
 *
 * <p>Leg invariant: {@code legs} is either empty (never persisted that way) or holds exactly
 * one leg per {@link LegRole}. A roll never changes the count: the replacement waits in
 * {@link #pendingRoll} and swaps into the slot when it is complete, and the rolled-out leg
 * moves to {@code retiredLegs} so its realized P&L is kept.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    public static final int IRON_CONDOR_LEGS = 4;

    private String id;
    private String strategyName;
    private IndexName index;

    @Builder.Default
    private List<OptionLeg> legs = new ArrayList<>();

    @Builder.Default
    private List<OptionLeg> retiredLegs = new ArrayList<>();

    private PositionState state;
    private LocalDateTime entryTime;
    private LocalDateTime exitTime;

    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    /** Last mark-to-market, null while any open leg has no quote. */
    private BigDecimal unrealizedPnl;

    /** Net premium received at first entry (positive for a credit). Rolls leave it unchanged. */
    private BigDecimal entryCredit;

    private ExitReason exitReason;
    private LegRoll pendingRoll;

    /** Set when an order of this position was rejected for a non-retryable reason. */
    private RejectCode permanentRejection;

    @Builder.Default
    private Map<String, OrderRef> outstandingOrders = new LinkedHashMap<>();

    /** Dedupe keys (broker order id + fill sequence) of fills already applied. */
    @Builder.Default
    private Set<String> appliedFills = new HashSet<>();

    private int orderSequence;
    private int rollCount;

    /**
     * Creates a Position awaiting its entry fills. Fails when the legs are not one per role.
     */
    public static Position open(
            String id, String strategyName, IndexName index, List<OptionLeg> legs, LocalDateTime entryTime) {
        if (legs.size() != IRON_CONDOR_LEGS) {
            throw new IllegalArgumentException("Iron condor needs " + IRON_CONDOR_LEGS + " legs, got " + legs.size());
        }
        EnumSet<LegRole> roles = EnumSet.noneOf(LegRole.class);
        legs.forEach(leg -> roles.add(leg.getRole()));
        if (roles.size() != IRON_CONDOR_LEGS) {
            throw new IllegalArgumentException("Iron condor legs must cover every role once: " + roles);
        }
        List<OptionLeg> ordered = new ArrayList<>(legs);
        ordered.sort((a, b) -> a.getRole().compareTo(b.getRole()));
        return Position.builder()
                .id(id)
                .strategyName(strategyName)
                .index(index)
                .legs(ordered)
                .state(PositionState.ADJUSTING)
                .entryTime(entryTime)
                .build();
    }

    public OptionLeg leg(LegRole role) {
        return legs.stream()
                .filter(l -> l.getRole() == role)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Position " + id + " has no " + role + " leg"));
    }

    /** Legs currently carrying or acquiring exposure, including a roll replacement. */
    public List<OptionLeg> liveLegs() {
        if (pendingRoll == null) {
            return legs;
        }
        return Stream.concat(legs.stream(), Stream.of(pendingRoll.getNewLeg())).toList();
    }

    public Optional<OptionLeg> findLeg(String legId) {
        return Stream.concat(liveLegs().stream(), retiredLegs.stream())
                .filter(l -> l.getLegId().equals(legId))
                .findFirst();
    }

    public boolean entryComplete() {
        return legs.size() == IRON_CONDOR_LEGS && legs.stream().allMatch(OptionLeg::fullyOpened);
    }

    public boolean flat() {
        return liveLegs().stream().allMatch(OptionLeg::flat);
    }

    public boolean hasOutstandingOrders() {
        return !outstandingOrders.isEmpty();
    }

    public boolean hasOutstandingOrder(String legId, OrderIntent intent) {
        return outstandingOrders.values().stream()
                .anyMatch(ref -> ref.legId().equals(legId) && ref.intent() == intent);
    }

    public String nextOrderId() {
        orderSequence++;
        return id + "-" + orderSequence;
    }

    public void trackOrder(OrderRef ref) {
        outstandingOrders.put(ref.orderId(), ref);
    }

    public Optional<OrderRef> orderRef(String orderId) {
        return Optional.ofNullable(outstandingOrders.get(orderId));
    }

    public void untrackOrder(String orderId) {
        outstandingOrders.remove(orderId);
    }

    /** Records a fill key; false when the fill was applied before. */
    public boolean markFillApplied(String fillKey) {
        return appliedFills.add(fillKey);
    }

    /** Replaces the slot of the rolled leg with its replacement and retires the old leg. */
    public void completeRoll() {
        LegRoll roll = pendingRoll;
        OptionLeg oldLeg = leg(roll.getRole());
        int slot = legs.indexOf(oldLeg);
        legs.set(slot, roll.getNewLeg());
        retiredLegs.add(oldLeg);
        pendingRoll = null;
        rollCount++;
    }

    public void recomputeRealizedPnl() {
        realizedPnl = Stream.concat(liveLegs().stream(), retiredLegs.stream())
                .map(OptionLeg::getRealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Marks the open legs to the snapshot. Empty when a leg with open units has no quote,
     * since an unknown price must not read as zero loss.
     */
    public Optional<BigDecimal> computeUnrealizedPnl(OptionChainSnapshot snapshot) {
        BigDecimal total = BigDecimal.ZERO;
        for (OptionLeg leg : liveLegs()) {
            if (leg.flat()) {
                continue;
            }
            Optional<OptionChainEntry> quote = snapshot.entryByToken(leg.getInstrumentToken());
            if (quote.isEmpty() || quote.get().getPrice() == null) {
                return Optional.empty();
            }
            total = total.add(leg.markToMarket(quote.get().getPrice()));
        }
        return Optional.of(total);
    }

    /** Signed delta of the open units. Empty when any open leg has unknown Greeks. */
    public Optional<BigDecimal> netDelta(OptionChainSnapshot snapshot) {
        BigDecimal total = BigDecimal.ZERO;
        for (OptionLeg leg : liveLegs()) {
            if (leg.flat()) {
                continue;
            }
            Optional<OptionChainEntry> quote = snapshot.entryByToken(leg.getInstrumentToken());
            if (quote.isEmpty() || !quote.get().hasGreeks()) {
                return Optional.empty();
            }
            total = total.add(quote.get()
                    .getDelta()
                    .multiply(BigDecimal.valueOf((long) leg.openQuantity() * leg.getSide().sign())));
        }
        return Optional.of(total);
    }
}
