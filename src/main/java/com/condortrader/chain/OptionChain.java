package com.condortrader.chain;

import com.condortrader.domain.model.Greeks;
import com.condortrader.domain.model.OptionChainEntry;
import com.condortrader.domain.model.OptionChainSnapshot;
import com.condortrader.domain.model.OptionContract;
import com.condortrader.domain.model.Tick;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live option chain for one index and expiry.
 *
 * <p>Single writer: only the decision thread calls {@link #apply(Tick)}. Readers get an
 * immutable {@link OptionChainSnapshot}, rebuilt lazily after each accepted tick.
 *
 * <p>Rules applied per tick:
 * <ul>
 *   <li>Per-key monotonicity: a tick older than the last one applied to the same instrument
 *       is dropped, so Greeks never move back to older data</li>
 *   <li>Unknown instruments are ignored; strikes that never ticked stay absent</li>
 *   <li>Greeks need a spot; until the first spot tick the entry carries a price only</li>
 *   <li>From the expiry date on, the entry is marked expired and its Greeks stay frozen at
 *       the last computed value</li>
 * </ul>
 */
public class OptionChain {

    private static final Logger log = LoggerFactory.getLogger(OptionChain.class);

    private final InstrumentRegistry registry;
    private final GreeksCalculator greeksCalculator;

    private final Map<Long, OptionChainEntry> entries = new HashMap<>();
    private BigDecimal spot;
    private LocalDateTime spotTime;
    private LocalDateTime asOf;
    private long droppedOutOfOrder;
    private long version;

    private OptionChainSnapshot cachedSnapshot;

    public OptionChain(InstrumentRegistry registry, GreeksCalculator greeksCalculator) {
        this.registry = registry;
        this.greeksCalculator = greeksCalculator;
    }

    /**
     * Applies a tick.
     *
     * @return the updated option entry; empty for spot ticks, unknown instruments and
     *         out-of-order ticks
     */
    public Optional<OptionChainEntry> apply(Tick tick) {
        if (tick.getTimestamp() == null || tick.getLastPrice() == null) {
            return Optional.empty();
        }

        if (registry.isSpot(tick.getInstrumentToken())) {
            applySpot(tick);
            return Optional.empty();
        }

        Optional<OptionContract> contract = registry.contract(tick.getInstrumentToken());
        if (contract.isEmpty()) {
            log.trace("Ignoring tick for unregistered instrument {}", tick.getInstrumentToken());
            return Optional.empty();
        }

        OptionChainEntry previous = entries.get(tick.getInstrumentToken());
        if (previous != null && tick.getTimestamp().isBefore(previous.getLastUpdateTime())) {
            droppedOutOfOrder++;
            log.debug(
                    "Dropping out-of-order tick: token={}, tickTime={}, lastApplied={}",
                    tick.getInstrumentToken(),
                    tick.getTimestamp(),
                    previous.getLastUpdateTime());
            return Optional.empty();
        }

        OptionContract option = contract.get();
        boolean expired = !tick.getTimestamp().toLocalDate().isBefore(option.getExpiry());

        Greeks greeks;
        if (expired) {
            greeks = previous != null ? previous.getGreeks() : null;
        } else if (spot == null) {
            greeks = null;
        } else {
            Greeks computed = greeksCalculator.calculate(
                    spot,
                    option.getStrike(),
                    option.getExpiry(),
                    tick.getLastPrice(),
                    option.getOptionType().isCall(),
                    tick.getTimestamp());
            greeks = computed.isAvailable() ? computed : null;
        }

        OptionChainEntry entry = OptionChainEntry.builder()
                .contract(option)
                .price(tick.getLastPrice())
                .bid(tick.getBid())
                .ask(tick.getAsk())
                .volume(tick.getVolume())
                .greeks(greeks)
                .lastUpdateTime(tick.getTimestamp())
                .expired(expired)
                .build();
        entries.put(tick.getInstrumentToken(), entry);
        advanceClock(tick.getTimestamp());
        return Optional.of(entry);
    }

    public OptionChainSnapshot snapshot() {
        if (cachedSnapshot == null) {
            cachedSnapshot = new OptionChainSnapshot(
                    registry.getIndex(), registry.getExpiry(), spot, asOf, entries.values());
        }
        return cachedSnapshot;
    }

    public InstrumentRegistry getRegistry() {
        return registry;
    }

    /** Incremented on every accepted tick, spot included. */
    public long getVersion() {
        return version;
    }

    public long getDroppedOutOfOrder() {
        return droppedOutOfOrder;
    }

    public LocalDateTime getSpotTime() {
        return spotTime;
    }

    private void applySpot(Tick tick) {
        if (spotTime != null && tick.getTimestamp().isBefore(spotTime)) {
            droppedOutOfOrder++;
            return;
        }
        spot = tick.getLastPrice();
        spotTime = tick.getTimestamp();
        advanceClock(tick.getTimestamp());
    }

    private void advanceClock(LocalDateTime timestamp) {
        if (asOf == null || timestamp.isAfter(asOf)) {
            asOf = timestamp;
        }
        version++;
        cachedSnapshot = null;
    }
}
