package com.condortrader.chain;

import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.enums.OptionType;
import com.condortrader.domain.model.OptionContract;
import com.condortrader.domain.model.StrikeKey;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Option contracts of the traded expiry for one index, keyed by instrument token and by
 * (strike, type). Immutable after construction.
 */
@Getter
public class InstrumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstrumentRegistry.class);

    private final IndexName index;
    private final LocalDate expiry;
    private final Map<Long, OptionContract> contractsByToken;
    private final Map<StrikeKey, OptionContract> contractsByKey;

    public InstrumentRegistry(IndexName index, LocalDate expiry, Collection<OptionContract> contracts) {
        this.index = index;
        this.expiry = expiry;
        Map<Long, OptionContract> byToken = new HashMap<>();
        Map<StrikeKey, OptionContract> byKey = new HashMap<>();
        for (OptionContract contract : contracts) {
            if (!expiry.equals(contract.getExpiry())) {
                continue;
            }
            byToken.put(contract.getInstrumentToken(), contract);
            byKey.put(StrikeKey.of(contract.getStrike(), contract.getOptionType()), contract);
        }
        this.contractsByToken = Map.copyOf(byToken);
        this.contractsByKey = Map.copyOf(byKey);
    }

    /**
     * Builds a registry for the nearest expiry on or after {@code tradingDate}.
     *
     * @throws IllegalArgumentException when no contract expires on or after the date
     */
    public static InstrumentRegistry forNearestExpiry(
            IndexName index, Collection<OptionContract> contracts, LocalDate tradingDate) {
        LocalDate nearest = contracts.stream()
                .map(OptionContract::getExpiry)
                .filter(e -> !e.isBefore(tradingDate))
                .min(Comparator.naturalOrder())
                .orElseThrow(() -> new IllegalArgumentException(
                        "No " + index + " option expiring on or after " + tradingDate));
        InstrumentRegistry registry = new InstrumentRegistry(index, nearest, contracts);
        log.info(
                "Instrument registry built: index={}, expiry={}, contracts={}",
                index,
                nearest,
                registry.contractsByToken.size());
        return registry;
    }

    public Optional<OptionContract> contract(long instrumentToken) {
        return Optional.ofNullable(contractsByToken.get(instrumentToken));
    }

    public Optional<OptionContract> contract(BigDecimal strike, OptionType type) {
        return Optional.ofNullable(contractsByKey.get(StrikeKey.of(strike, type)));
    }

    public boolean isSpot(long instrumentToken) {
        return instrumentToken == index.getSpotToken();
    }

    /** Spot token first, then every option token. */
    public Set<Long> subscriptionTokens() {
        Set<Long> tokens = new LinkedHashSet<>();
        tokens.add(index.getSpotToken());
        tokens.addAll(contractsByToken.keySet());
        return tokens;
    }

    public List<OptionContract> contracts() {
        return List.copyOf(contractsByToken.values());
    }
}
