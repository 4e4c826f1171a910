package com.condortrader.chain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rolling IV rank of the at-the-money implied volatility.
 *
 * <p>IV rank = (current - min) / (max - min) * 100 over the retained samples. One sample is
 * kept per sample interval (the latest observation inside an interval replaces the previous
 * one, so each sample is the closing IV of its interval). History can be seeded from
 * configuration so a fresh process does not wait a whole lookback before trading.
 *
 * <p>Owned by the decision thread; not thread-safe.
 */
public class IvRankTracker {

    private static final Logger log = LoggerFactory.getLogger(IvRankTracker.class);

    private final int lookback;
    private final int minSamples;
    private final Duration sampleInterval;

    private final Deque<BigDecimal> samples = new ArrayDeque<>();
    private LocalDateTime currentIntervalStart;

    public IvRankTracker(int lookback, int minSamples, Duration sampleInterval) {
        this.lookback = lookback;
        this.minSamples = minSamples;
        this.sampleInterval = sampleInterval;
    }

    public void seed(Collection<BigDecimal> history) {
        history.forEach(this::append);
        log.info("IV rank history seeded with {} samples", samples.size());
    }

    /** Records the ATM IV (percent) observed at the given tick time. */
    public void observe(BigDecimal atmIv, LocalDateTime at) {
        if (atmIv == null || atmIv.signum() <= 0) {
            return;
        }
        if (currentIntervalStart == null || !at.isBefore(currentIntervalStart.plus(sampleInterval))) {
            currentIntervalStart = at;
            append(atmIv);
        } else if (at.isAfter(currentIntervalStart) || at.isEqual(currentIntervalStart)) {
            samples.pollLast();
            samples.addLast(atmIv);
        }
    }

    /**
     * Rank of {@code currentIv} within the retained history, 0 to 100. Empty until
     * {@code minSamples} samples exist.
     */
    public Optional<BigDecimal> ivRank(BigDecimal currentIv) {
        if (currentIv == null || samples.size() < minSamples) {
            return Optional.empty();
        }
        BigDecimal min = currentIv;
        BigDecimal max = currentIv;
        for (BigDecimal sample : samples) {
            min = sample.min(min);
            max = sample.max(max);
        }
        BigDecimal range = max.subtract(min);
        if (range.signum() == 0) {
            return Optional.of(BigDecimal.ZERO);
        }
        return Optional.of(currentIv
                .subtract(min)
                .multiply(BigDecimal.valueOf(100))
                .divide(range, 2, RoundingMode.HALF_UP));
    }

    public int sampleCount() {
        return samples.size();
    }

    private void append(BigDecimal iv) {
        samples.addLast(iv);
        while (samples.size() > lookback) {
            samples.pollFirst();
        }
    }
}
