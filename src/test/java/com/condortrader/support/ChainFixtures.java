package com.condortrader.support;

import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.enums.OptionType;
import com.condortrader.domain.enums.OrderType;
import com.condortrader.domain.model.Greeks;
import com.condortrader.domain.model.OptionChainEntry;
import com.condortrader.domain.model.OptionChainSnapshot;
import com.condortrader.domain.model.OptionContract;
import com.condortrader.domain.model.Tick;
import com.condortrader.risk.RiskLimits;
import com.condortrader.strategy.IronCondorConfig;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared NIFTY test data: contracts keyed by a predictable token, hand-built chain
 * snapshots and default strategy/risk settings.
 */
public final class ChainFixtures {

    public static final LocalDate EXPIRY = LocalDate.of(2024, 1, 25);
    public static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 15, 10, 0);
    public static final int LOT_SIZE = 75;
    public static final long SPOT_TOKEN = IndexName.NIFTY.getSpotToken();

    private ChainFixtures() {}

    /** Token scheme used by every fixture: strike * 10 + 1 for calls, + 2 for puts. */
    public static long token(int strike, OptionType type) {
        return strike * 10L + (type == OptionType.CE ? 1 : 2);
    }

    public static OptionContract contract(int strike, OptionType type) {
        return OptionContract.builder()
                .instrumentToken(token(strike, type))
                .tradingSymbol("NIFTY24JAN" + strike + type.name())
                .exchange("NFO")
                .strike(BigDecimal.valueOf(strike))
                .optionType(type)
                .expiry(EXPIRY)
                .lotSize(LOT_SIZE)
                .build();
    }

    /** Calls and puts for every listed strike from {@code from} to {@code to}. */
    public static List<OptionContract> contracts(int from, int to) {
        List<OptionContract> contracts = new ArrayList<>();
        for (int strike = from; strike <= to; strike += 50) {
            contracts.add(contract(strike, OptionType.CE));
            contracts.add(contract(strike, OptionType.PE));
        }
        return contracts;
    }

    public static OptionChainEntry entry(int strike, OptionType type, String price, String delta) {
        return OptionChainEntry.builder()
                .contract(contract(strike, type))
                .price(new BigDecimal(price))
                .greeks(Greeks.builder()
                        .delta(new BigDecimal(delta))
                        .gamma(BigDecimal.ZERO)
                        .theta(BigDecimal.ZERO)
                        .vega(BigDecimal.ZERO)
                        .iv(new BigDecimal("15.00"))
                        .calculatedAt(T0)
                        .build())
                .lastUpdateTime(T0)
                .build();
    }

    /** Entry with a price but unknown Greeks. */
    public static OptionChainEntry priceOnly(int strike, OptionType type, String price) {
        return OptionChainEntry.builder()
                .contract(contract(strike, type))
                .price(new BigDecimal(price))
                .lastUpdateTime(T0)
                .build();
    }

    public static OptionChainSnapshot snapshot(String spot, LocalDateTime asOf, List<OptionChainEntry> entries) {
        return new OptionChainSnapshot(
                IndexName.NIFTY, EXPIRY, spot != null ? new BigDecimal(spot) : null, asOf, entries);
    }

    public static Tick tick(long token, String price, LocalDateTime at) {
        return Tick.builder()
                .instrumentToken(token)
                .lastPrice(new BigDecimal(price))
                .timestamp(at)
                .build();
    }

    public static Tick spotTick(String price, LocalDateTime at) {
        return tick(SPOT_TOKEN, price, at);
    }

    /** Defaults close to production: 0.10-0.25 short band, 200 point wings, no premium stop. */
    public static IronCondorConfig.IronCondorConfigBuilder condorConfig() {
        return IronCondorConfig.builder()
                .strategyName("IRON_CONDOR")
                .index(IndexName.NIFTY)
                .lots(1)
                .minIvRank(BigDecimal.ZERO)
                .entryStart(LocalTime.of(9, 20))
                .entryEnd(LocalTime.of(14, 30))
                .minDaysToExpiry(0)
                .maxEntriesPerDay(1)
                .shortDeltaMin(new BigDecimal("0.10"))
                .shortDeltaMax(new BigDecimal("0.25"))
                .shortDeltaTarget(new BigDecimal("0.16"))
                .wingWidth(new BigDecimal("200"))
                .callOffset(new BigDecimal("300"))
                .putOffset(new BigDecimal("300"))
                .rollTargetDelta(new BigDecimal("0.16"))
                .rollTimeout(Duration.ofMinutes(2))
                .exitMinutesBeforeExpiry(15)
                .orderType(OrderType.MARKET);
    }

    public static RiskLimits.RiskLimitsBuilder riskLimits() {
        return RiskLimits.builder()
                .maxLossPerPosition(new BigDecimal("10000"))
                .maxPositions(1)
                .stopLossPct(new BigDecimal("0.50"))
                .hedgeTriggerDelta(new BigDecimal("0.30"));
    }
}
