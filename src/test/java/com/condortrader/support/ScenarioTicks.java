package com.condortrader.support;

import static com.condortrader.support.ChainFixtures.EXPIRY;
import static com.condortrader.support.ChainFixtures.spotTick;
import static com.condortrader.support.ChainFixtures.tick;
import static com.condortrader.support.ChainFixtures.token;

import com.condortrader.chain.GreeksCalculator;
import com.condortrader.chain.IVCalculator;
import com.condortrader.domain.enums.OptionType;
import com.condortrader.domain.model.Tick;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Tick sequences for end-to-end runs. Option prices are Black-Scholes values at a flat
 * 15% volatility, so the chain solves back to a consistent IV surface.
 *
 * <p>The stop-loss day: quotes at 22000, entry at 09:21, fills at 09:22, then NIFTY jumps to
 * 22600 at 09:30 and the calls are re-quoted from the lowest strike up, which pushes the
 * short call through the stop before its hedge is re-quoted.
 */
public final class ScenarioTicks {

    public static final int LOW_STRIKE = 21000;
    public static final int HIGH_STRIKE = 23000;
    public static final double SIGMA = 0.15;

    public static final LocalDateTime OPEN = LocalDateTime.of(2024, 1, 15, 9, 15);
    public static final LocalDateTime QUOTES = OPEN.plusMinutes(1);
    public static final LocalDateTime ENTRY = LocalDateTime.of(2024, 1, 15, 9, 21);
    public static final LocalDateTime FILLS = ENTRY.plusMinutes(1);
    public static final LocalDateTime JUMP = LocalDateTime.of(2024, 1, 15, 9, 30);

    private static final GreeksCalculator PRICER = new GreeksCalculator(new IVCalculator(), 0.07);

    private ScenarioTicks() {}

    /** Market up to and including the entry fills. */
    public static List<Tick> entryDay() {
        List<Tick> ticks = new ArrayList<>();
        ticks.add(spotTick("22000", OPEN));
        ticks.addAll(quotes("22000", QUOTES, OptionType.CE));
        ticks.addAll(quotes("22000", QUOTES, OptionType.PE));
        ticks.add(spotTick("22000", ENTRY));
        ticks.add(spotTick("22005", FILLS));
        return ticks;
    }

    /** The spot jump and the re-quoted calls, then puts. */
    public static List<Tick> rally() {
        List<Tick> ticks = new ArrayList<>();
        ticks.add(spotTick("22600", JUMP));
        ticks.addAll(quotes("22600", JUMP.plusSeconds(1), OptionType.CE));
        ticks.addAll(quotes("22600", JUMP.plusSeconds(2), OptionType.PE));
        return ticks;
    }

    public static List<Tick> stopLossDay() {
        List<Tick> ticks = new ArrayList<>(entryDay());
        ticks.addAll(rally());
        return ticks;
    }

    /** One tick per strike, ascending, skipping options too cheap to quote. */
    public static List<Tick> quotes(String spot, LocalDateTime at, OptionType type) {
        List<Tick> ticks = new ArrayList<>();
        for (int strike = LOW_STRIKE; strike <= HIGH_STRIKE; strike += 50) {
            BigDecimal price = PRICER.theoreticalPrice(
                    new BigDecimal(spot), BigDecimal.valueOf(strike), EXPIRY, SIGMA, type.isCall(), at);
            if (price.compareTo(new BigDecimal("0.05")) < 0) {
                continue;
            }
            ticks.add(tick(token(strike, type), price.toPlainString(), at));
        }
        return ticks;
    }
}
