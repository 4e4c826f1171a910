package com.condortrader.config;

import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.enums.OrderType;
import com.condortrader.domain.enums.TradingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the trading process, bound from the {@code condortrader.*} prefix.
 *
 * <p>Single-field rules are Bean Validation constraints; rules spanning several fields
 * (delta band ordering, entry window, backoff bounds) are cross-checked as well. Both are
 * evaluated together by {@link TradingConfig#validate}, so any failure stops the process
 * with exit code 4 instead of a binding error.
 */
@ConfigurationProperties(prefix = "condortrader")
@Getter
@Setter
public class TradingProperties {

    @NotNull
    private TradingMode mode = TradingMode.LIVE;

    @NotNull
    private IndexName index = IndexName.NIFTY;

    /** Wall-clock interval of the timer step (ack timeouts, retries, polling, feed watchdog). */
    @NotNull
    private Duration timerInterval = Duration.ofSeconds(1);

    @Valid
    private Strategy strategy = new Strategy();

    @Valid
    private Risk risk = new Risk();

    @Valid
    private Feed feed = new Feed();

    @Valid
    private Execution execution = new Execution();

    @Valid
    private Pricing pricing = new Pricing();

    @Valid
    private IvRank ivRank = new IvRank();

    @Valid
    private Recorder recorder = new Recorder();

    @Valid
    private Backtest backtest = new Backtest();

    @Valid
    private Kite kite = new Kite();

    /** Iron condor entry, adjustment and exit rules. */
    @Getter
    @Setter
    public static class Strategy {

        @NotBlank
        private String name = "IRON_CONDOR";

        @Min(1)
        private int lots = 1;

        @NotNull
        @DecimalMin("0")
        @DecimalMax("100")
        private BigDecimal minIvRank = new BigDecimal("50");

        @NotNull
        private LocalTime entryStart = LocalTime.of(9, 20);

        @NotNull
        private LocalTime entryEnd = LocalTime.of(14, 30);

        @Min(0)
        private int minDaysToExpiry = 0;

        @Min(1)
        private int maxEntriesPerDay = 1;

        @NotNull
        @DecimalMin("0")
        @DecimalMax("1")
        private BigDecimal shortDeltaMin = new BigDecimal("0.10");

        @NotNull
        @DecimalMin("0")
        @DecimalMax("1")
        private BigDecimal shortDeltaMax = new BigDecimal("0.25");

        @NotNull
        @DecimalMin("0")
        @DecimalMax("1")
        private BigDecimal shortDeltaTarget = new BigDecimal("0.16");

        @NotNull
        @Positive
        private BigDecimal wingWidth = new BigDecimal("200");

        @NotNull
        @DecimalMin("0")
        private BigDecimal callOffset = new BigDecimal("300");

        @NotNull
        @DecimalMin("0")
        private BigDecimal putOffset = new BigDecimal("300");

        @NotNull
        @DecimalMin("0")
        @DecimalMax("1")
        private BigDecimal rollTargetDelta = new BigDecimal("0.16");

        @NotNull
        private Duration rollTimeout = Duration.ofMinutes(2);

        @Min(0)
        private int exitMinutesBeforeExpiry = 15;

        /** Intraday square-off; unset keeps positions overnight. */
        private LocalTime dailyExitTime;

        /** Fraction of the entry credit that triggers take-profit; unset disables it. */
        @DecimalMin("0")
        private BigDecimal takeProfitPct;

        /** Short-leg premium stop as a multiple of the entry price; unset disables it. */
        @DecimalMin("1")
        private BigDecimal legStopMultiplier = new BigDecimal("1.70");

        /** Rejected closes per leg before the leg is left for manual handling. */
        @Min(1)
        private int maxCloseAttempts = 3;

        /** Enter only after the net credit went above its VWAP and came back to it. */
        private boolean vwapEntryGate = false;

        /** Seed that VWAP from the day's minute candles (live mode). */
        private boolean vwapPrefill = true;

        @NotNull
        private OrderType orderType = OrderType.MARKET;
    }

    /** Per-position risk limits. */
    @Getter
    @Setter
    public static class Risk {

        @NotNull
        @Positive
        private BigDecimal maxLossPerPosition = new BigDecimal("10000");

        @Min(1)
        private int maxPositions = 1;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax("1")
        private BigDecimal stopLossPct = new BigDecimal("0.50");

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax("1")
        private BigDecimal hedgeTriggerDelta = new BigDecimal("0.30");

        /** Cap on lots per leg; unset means no cap. */
        @Min(1)
        private Integer maxLotsPerPosition;
    }

    /** Market data feed connection and health. */
    @Getter
    @Setter
    public static class Feed {

        /** Silence after which the connection is considered dead and re-established. */
        @NotNull
        private Duration heartbeatTimeout = Duration.ofSeconds(10);

        /** Silence after which the feed reads as stale to the risk checks. */
        @NotNull
        private Duration staleThreshold = Duration.ofSeconds(5);

        @NotNull
        private Duration reconnectInitialBackoff = Duration.ofSeconds(1);

        @NotNull
        private Duration reconnectMaxBackoff = Duration.ofSeconds(30);

        @Min(1)
        private int reconnectMaxAttempts = 10;

        /** Option strikes further than this from spot are not subscribed. */
        @NotNull
        @Positive
        private BigDecimal strikeWindow = new BigDecimal("1500");
    }

    /** Order placement, retry and reconciliation. */
    @Getter
    @Setter
    public static class Execution {

        @Min(0)
        private int maxRetries = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(5);

        @NotNull
        private Duration ackTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration pollInterval = Duration.ofSeconds(3);

        @Min(1)
        private int ioThreads = 4;

        /** Broker calls allowed per second (Kite allows 10 order requests per second). */
        @Min(1)
        private int rateLimitPerSecond = 8;
    }

    /** Option pricing inputs. */
    @Getter
    @Setter
    public static class Pricing {

        @NotNull
        @DecimalMin("0")
        private BigDecimal riskFreeRate = new BigDecimal("0.07");
    }

    /** ATM IV history used for the IV rank entry filter. */
    @Getter
    @Setter
    public static class IvRank {

        @Min(2)
        private int lookback = 250;

        @Min(1)
        private int minSamples = 20;

        @NotNull
        private Duration sampleInterval = Duration.ofMinutes(5);

        /** Historical ATM IVs (percent), oldest first, loaded before the first tick. */
        private List<BigDecimal> seed = new ArrayList<>();
    }

    /** Live tick recording for later backtests. */
    @Getter
    @Setter
    public static class Recorder {

        private boolean enabled = false;

        @NotBlank
        private String directory = "data/ticks";

        @Min(1)
        private int bufferFlushSize = 5000;

        private boolean compressOnStop = false;
    }

    /** Backtest input and output. */
    @Getter
    @Setter
    public static class Backtest {

        /** Recorded tick file (.bin or .bin.gz). */
        private String tickFile;

        /** Instruments JSON of the recorded session. */
        private String instrumentsFile;

        @NotBlank
        private String reportFile = "data/backtest-report.json";

        @Min(0)
        private int slippageBps = 0;

        @NotNull
        private Duration latency = Duration.ZERO;
    }

    /** Kite Connect credentials, supplied by the operator. */
    @Getter
    @Setter
    public static class Kite {

        private String apiKey;

        private String accessToken;

        private String userId;
    }
}
