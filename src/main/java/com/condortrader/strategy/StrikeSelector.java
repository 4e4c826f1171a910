package com.condortrader.strategy;

import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.enums.OptionType;
import com.condortrader.domain.model.OptionChainEntry;
import com.condortrader.domain.model.OptionChainSnapshot;
import com.condortrader.domain.model.OptionLeg;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks iron condor strikes from the option chain.
 *
 * <p><b>Shorts:</b> the OTM strike whose |delta| lies inside [shortDeltaMin, shortDeltaMax]
 * and is nearest to shortDeltaTarget. On a tie the strike further from spot wins, since it
 * carries less risk for the same premium target. When a side has no delta inside the band
 * (no spot yet, illiquid chain) that side falls back to fixed offsets:
 * <pre>
 *   short call = ceil(spot / interval) * interval + callOffset
 *   short put  = floor(spot / interval) * interval - putOffset
 * </pre>
 *
 * <p><b>Hedges:</b> short call + wingWidth and short put - wingWidth.
 *
 * <p>A selection is only returned when all four strikes have a known price.
 */
public class StrikeSelector {

    private static final Logger log = LoggerFactory.getLogger(StrikeSelector.class);

    private final IronCondorConfig config;

    public StrikeSelector(IronCondorConfig config) {
        this.config = config;
    }

    public Optional<StrikeSelection> select(OptionChainSnapshot snapshot) {
        if (!snapshot.hasSpot()) {
            return Optional.empty();
        }

        Optional<OptionChainEntry> shortCall = selectShort(snapshot, OptionType.CE);
        Optional<OptionChainEntry> shortPut = selectShort(snapshot, OptionType.PE);
        if (shortCall.isEmpty() || shortPut.isEmpty()) {
            log.debug("Short strikes not quoted yet: spot={}", snapshot.getSpot());
            return Optional.empty();
        }

        BigDecimal wing = config.getWingWidth();
        Optional<OptionChainEntry> longCall = quoted(
                snapshot, shortCall.get().getContract().getStrike().add(wing), OptionType.CE);
        Optional<OptionChainEntry> longPut = quoted(
                snapshot, shortPut.get().getContract().getStrike().subtract(wing), OptionType.PE);
        if (longCall.isEmpty() || longPut.isEmpty()) {
            log.debug("Hedge strikes not quoted yet: wingWidth={}", wing);
            return Optional.empty();
        }

        return Optional.of(new StrikeSelection(shortCall.get(), longCall.get(), shortPut.get(), longPut.get()));
    }

    /**
     * Replacement strike for a breached short leg: strictly further from spot than the
     * current short, strictly inside its hedge, with known Greeks and price. The |delta|
     * nearest to {@code targetDelta} wins, further OTM on a tie.
     */
    public Optional<OptionChainEntry> selectRoll(
            OptionChainSnapshot snapshot, OptionLeg shortLeg, OptionLeg hedgeLeg, BigDecimal targetDelta) {
        boolean call = shortLeg.getOptionType().isCall();
        BigDecimal current = shortLeg.getStrike();
        BigDecimal hedge = hedgeLeg.getStrike();

        List<OptionChainEntry> candidates = snapshot.entries(shortLeg.getOptionType()).stream()
                .filter(e -> isPriced(e) && e.hasGreeks() && !e.isExpired())
                .filter(e -> {
                    BigDecimal strike = e.getContract().getStrike();
                    return call
                            ? strike.compareTo(current) > 0 && strike.compareTo(hedge) < 0
                            : strike.compareTo(current) < 0 && strike.compareTo(hedge) > 0;
                })
                .toList();

        return nearestDelta(candidates, targetDelta, call);
    }

    private Optional<OptionChainEntry> selectShort(OptionChainSnapshot snapshot, OptionType type) {
        boolean call = type.isCall();
        BigDecimal spot = snapshot.getSpot();

        List<OptionChainEntry> inBand = snapshot.entries(type).stream()
                .filter(e -> isPriced(e) && e.hasGreeks() && !e.isExpired())
                .filter(e -> call
                        ? e.getContract().getStrike().compareTo(spot) > 0
                        : e.getContract().getStrike().compareTo(spot) < 0)
                .filter(e -> {
                    BigDecimal delta = e.getDelta().abs();
                    return delta.compareTo(config.getShortDeltaMin()) >= 0
                            && delta.compareTo(config.getShortDeltaMax()) <= 0;
                })
                .toList();

        Optional<OptionChainEntry> byDelta = nearestDelta(inBand, config.getShortDeltaTarget(), call);
        if (byDelta.isPresent()) {
            return byDelta;
        }
        return quoted(snapshot, fallbackStrike(snapshot.getIndex(), spot, call), type);
    }

    private BigDecimal fallbackStrike(IndexName index, BigDecimal spot, boolean call) {
        BigDecimal interval = index.getStrikeInterval();
        if (call) {
            return spot.divide(interval, 0, RoundingMode.CEILING).multiply(interval).add(config.getCallOffset());
        }
        return spot.divide(interval, 0, RoundingMode.FLOOR).multiply(interval).subtract(config.getPutOffset());
    }

    private static Optional<OptionChainEntry> nearestDelta(
            List<OptionChainEntry> candidates, BigDecimal target, boolean call) {
        Comparator<OptionChainEntry> byDistance =
                Comparator.comparing(e -> e.getDelta().abs().subtract(target).abs());
        // further OTM first on equal distance: higher strikes for calls, lower for puts
        Comparator<OptionChainEntry> byStrike = Comparator.comparing(e -> e.getContract().getStrike());
        return candidates.stream().min(byDistance.thenComparing(call ? byStrike.reversed() : byStrike));
    }

    private static Optional<OptionChainEntry> quoted(OptionChainSnapshot snapshot, BigDecimal strike, OptionType type) {
        return snapshot.entry(strike, type).filter(StrikeSelector::isPriced);
    }

    private static boolean isPriced(OptionChainEntry entry) {
        return entry.getPrice() != null && entry.getPrice().signum() > 0;
    }
}
