package com.condortrader.domain.model;

import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.enums.OptionType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.Getter;

/**
 * Immutable view of the option chain at one point of the tick stream.
 *
 * <p>Absence is meaningful: a strike without an entry has not traded yet and must be
 * treated as unknown by callers, never as a zero price or zero delta.
 */
@Getter
public class OptionChainSnapshot {

    private final IndexName index;
    private final LocalDate expiry;

    /** Last underlying price, or null before the first spot tick. */
    private final BigDecimal spot;

    /** Timestamp of the newest tick applied to the chain. */
    private final LocalDateTime asOf;

    private final Map<StrikeKey, OptionChainEntry> entries;
    private final Map<Long, OptionChainEntry> entriesByToken;

    public OptionChainSnapshot(
            IndexName index,
            LocalDate expiry,
            BigDecimal spot,
            LocalDateTime asOf,
            Collection<OptionChainEntry> chainEntries) {
        this.index = index;
        this.expiry = expiry;
        this.spot = spot;
        this.asOf = asOf;
        Map<StrikeKey, OptionChainEntry> byKey = new HashMap<>();
        Map<Long, OptionChainEntry> byToken = new HashMap<>();
        for (OptionChainEntry entry : chainEntries) {
            byKey.put(entry.key(), entry);
            byToken.put(entry.getContract().getInstrumentToken(), entry);
        }
        this.entries = Map.copyOf(byKey);
        this.entriesByToken = Map.copyOf(byToken);
    }

    public static OptionChainSnapshot empty(IndexName index, LocalDate expiry) {
        return new OptionChainSnapshot(index, expiry, null, null, List.of());
    }

    public Optional<OptionChainEntry> entry(BigDecimal strike, OptionType optionType) {
        return Optional.ofNullable(entries.get(StrikeKey.of(strike, optionType)));
    }

    public Optional<OptionChainEntry> entryByToken(long instrumentToken) {
        return Optional.ofNullable(entriesByToken.get(instrumentToken));
    }

    /** Entries of one option type, ordered by ascending strike. */
    public List<OptionChainEntry> entries(OptionType optionType) {
        return entries.values().stream()
                .filter(e -> e.getContract().getOptionType() == optionType)
                .sorted(Comparator.comparing(e -> e.getContract().getStrike()))
                .toList();
    }

    public boolean hasSpot() {
        return spot != null;
    }

    /** Spot rounded to the nearest listed strike. */
    public BigDecimal atmStrike() {
        BigDecimal interval = index.getStrikeInterval();
        return spot.divide(interval, 0, RoundingMode.HALF_UP).multiply(interval);
    }

    /**
     * Mean implied volatility (percent) of the ATM call and put, using whichever side has
     * known Greeks. Empty without spot or when neither side is known.
     */
    public Optional<BigDecimal> atmImpliedVolatility() {
        if (!hasSpot()) {
            return Optional.empty();
        }
        BigDecimal atm = atmStrike();
        List<BigDecimal> ivs = Stream.of(OptionType.CE, OptionType.PE)
                .map(type -> entry(atm, type))
                .flatMap(Optional::stream)
                .map(OptionChainEntry::getImpliedVolatility)
                .filter(Objects::nonNull)
                .toList();
        if (ivs.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal sum = ivs.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return Optional.of(sum.divide(BigDecimal.valueOf(ivs.size()), 2, RoundingMode.HALF_UP));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
