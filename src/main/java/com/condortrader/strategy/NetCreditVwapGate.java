package com.condortrader.strategy;

import com.condortrader.domain.model.OptionChainEntry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry timing on the net credit of the candidate condor against its volume-weighted
 * average price. The gate arms once the credit trades above its VWAP and lets one entry
 * through when the credit comes back to or below it.
 *
 * <p>The average covers one candidate (the four strikes the selector currently picks) on
 * one trading day. A new day or a different candidate restarts it and disarms the gate.
 * Live samples are weighted by the growth of the four legs' day volume since the previous
 * sample. A sample without volume growth counts with weight one, so ticks that carry no
 * volume still give a time-weighted average.
 *
 * <p>Not thread-safe: driven by the decision thread only.
 */
public class NetCreditVwapGate {

    private static final Logger log = LoggerFactory.getLogger(NetCreditVwapGate.class);

    /** First minute of the cash session; history for a seed starts here. */
    public static final LocalTime SESSION_OPEN = LocalTime.of(9, 15);

    public enum Signal {
        /** First sample of a new candidate or day. */
        RESTARTED,
        WAITING,
        /** The credit moved above its VWAP on this sample. */
        ARMED,
        /** Armed, and the credit is back at or below its VWAP: enter. */
        TRIGGERED
    }

    private final Map<Long, Long> lastVolume = new HashMap<>();

    private List<Long> candidate = List.of();
    private LocalDate day;
    private BigDecimal priceVolume = BigDecimal.ZERO;
    private BigDecimal volume = BigDecimal.ZERO;
    private BigDecimal lastCredit;
    private boolean armed;
    private boolean seeded;

    public Signal observe(StrikeSelection strikes, LocalDate tradingDay) {
        List<Long> tokens = tokens(strikes);
        boolean restarted = !tokens.equals(candidate) || !tradingDay.equals(day);
        if (restarted) {
            restart(tokens, tradingDay);
        }

        BigDecimal credit = netCredit(strikes);
        if (credit == null) {
            return restarted ? Signal.RESTARTED : Signal.WAITING;
        }
        long growth = volumeGrowth(strikes);
        BigDecimal weight = BigDecimal.valueOf(growth > 0 ? growth : 1);
        priceVolume = priceVolume.add(credit.multiply(weight));
        volume = volume.add(weight);
        lastCredit = credit;

        if (restarted) {
            return Signal.RESTARTED;
        }

        BigDecimal vwap = vwap().orElse(credit);
        if (!armed) {
            if (credit.compareTo(vwap) > 0) {
                armed = true;
                log.info("Net credit {} above VWAP {}, entry armed", credit, vwap);
                return Signal.ARMED;
            }
            return Signal.WAITING;
        }
        if (credit.compareTo(vwap) <= 0) {
            armed = false;
            log.info("Net credit {} back at or below VWAP {}, entry triggered", credit, vwap);
            return Signal.TRIGGERED;
        }
        return Signal.WAITING;
    }

    /**
     * Adds the history of the candidate before its first live sample. Ignored when the
     * candidate or the day changed since the request, and after a first seed.
     *
     * @return whether the bars were applied
     */
    public boolean seed(List<Long> tokens, LocalDate tradingDay, List<NetCreditBar> bars) {
        if (seeded || !tokens.equals(candidate) || !tradingDay.equals(day)) {
            log.debug("VWAP seed for {} on {} no longer matches the candidate, dropped", tokens, tradingDay);
            return false;
        }
        for (NetCreditBar bar : bars) {
            if (bar.getVolume() > 0) {
                BigDecimal barVolume = BigDecimal.valueOf(bar.getVolume());
                priceVolume = priceVolume.add(bar.typicalPrice().multiply(barVolume));
                volume = volume.add(barVolume);
            }
        }
        seeded = true;
        log.info("Net credit VWAP seeded: bars={}, vwap={}", bars.size(), vwap().orElse(null));
        return true;
    }

    public Optional<BigDecimal> vwap() {
        if (volume.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(priceVolume.divide(volume, 4, RoundingMode.HALF_UP));
    }

    /** Net credit of the latest sample, null before the first. */
    public BigDecimal getLastCredit() {
        return lastCredit;
    }

    public boolean isArmed() {
        return armed;
    }

    private void restart(List<Long> tokens, LocalDate tradingDay) {
        if (!candidate.isEmpty()) {
            log.info("VWAP restarted: candidate {} -> {}, day {}", candidate, tokens, tradingDay);
        }
        candidate = tokens;
        day = tradingDay;
        priceVolume = BigDecimal.ZERO;
        volume = BigDecimal.ZERO;
        lastCredit = null;
        armed = false;
        seeded = false;
        lastVolume.keySet().retainAll(tokens);
    }

    private long volumeGrowth(StrikeSelection strikes) {
        long growth = 0;
        for (OptionChainEntry entry : legs(strikes)) {
            long token = entry.getContract().getInstrumentToken();
            Long previous = lastVolume.put(token, entry.getVolume());
            if (previous != null && entry.getVolume() > previous) {
                growth += entry.getVolume() - previous;
            }
        }
        return growth;
    }

    private static BigDecimal netCredit(StrikeSelection strikes) {
        for (OptionChainEntry entry : legs(strikes)) {
            if (entry.getPrice() == null) {
                return null;
            }
        }
        return strikes.shortCall().getPrice()
                .add(strikes.shortPut().getPrice())
                .subtract(strikes.longCall().getPrice())
                .subtract(strikes.longPut().getPrice());
    }

    private static List<Long> tokens(StrikeSelection strikes) {
        return legs(strikes).stream().map(e -> e.getContract().getInstrumentToken()).toList();
    }

    /** Short call, short put, long call, long put. */
    private static List<OptionChainEntry> legs(StrikeSelection strikes) {
        return List.of(strikes.shortCall(), strikes.shortPut(), strikes.longCall(), strikes.longPut());
    }
}
