package com.condortrader.config;

import com.condortrader.exception.BaseException;
import com.condortrader.exception.ConfigInvalidException;
import com.condortrader.strategy.IronCondorConfig;
import jakarta.annotation.PostConstruct;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Core wiring of the trading process: configuration binding and validation, the exchange
 * clock, the strategy configuration and exit-code mapping.
 *
 * <p>Validation runs once at startup. Bean Validation constraints on
 * {@link TradingProperties} and the cross-field rules below are collected together and
 * reported in a single {@link ConfigInvalidException} (exit code 4).
 */
@Configuration
@EnableConfigurationProperties(TradingProperties.class)
@EnableScheduling
public class TradingConfig {

    private static final Logger log = LoggerFactory.getLogger(TradingConfig.class);

    public static final ZoneId EXCHANGE_ZONE = ZoneId.of("Asia/Kolkata");

    private final TradingProperties tradingProperties;
    private final Validator validator;

    public TradingConfig(TradingProperties tradingProperties, Validator validator) {
        this.tradingProperties = tradingProperties;
        this.validator = validator;
    }

    @PostConstruct
    void validateOnStartup() {
        List<String> violations = validate(tradingProperties, validator);
        if (!violations.isEmpty()) {
            throw new ConfigInvalidException(violations);
        }
        log.info(
                "Configuration valid: mode={}, index={}, lots={}, maxPositions={}",
                tradingProperties.getMode(),
                tradingProperties.getIndex(),
                tradingProperties.getStrategy().getLots(),
                tradingProperties.getRisk().getMaxPositions());
    }

    /** All constraint and cross-field violations, as {@code path: message}. Empty when valid. */
    public static List<String> validate(TradingProperties properties, Validator validator) {
        List<String> violations = new ArrayList<>();
        validator.validate(properties).stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(TradingConfig::describe)
                .forEach(violations::add);
        if (!violations.isEmpty()) {
            // cross-field rules assume the single fields are set
            return violations;
        }

        TradingProperties.Strategy strategy = properties.getStrategy();
        if (strategy.getShortDeltaMin().compareTo(strategy.getShortDeltaMax()) > 0) {
            violations.add("strategy.shortDeltaMin: must not exceed strategy.shortDeltaMax");
        }
        if (strategy.getShortDeltaTarget().compareTo(strategy.getShortDeltaMin()) < 0
                || strategy.getShortDeltaTarget().compareTo(strategy.getShortDeltaMax()) > 0) {
            violations.add("strategy.shortDeltaTarget: must lie within the short delta band");
        }
        if (!strategy.getEntryStart().isBefore(strategy.getEntryEnd())) {
            violations.add("strategy.entryStart: must be before strategy.entryEnd");
        }
        if (strategy.getWingWidth().remainder(properties.getIndex().getStrikeInterval()).signum() != 0) {
            violations.add("strategy.wingWidth: must be a multiple of the "
                    + properties.getIndex() + " strike interval " + properties.getIndex().getStrikeInterval());
        }
        if (strategy.getRollTargetDelta().compareTo(properties.getRisk().getHedgeTriggerDelta()) >= 0) {
            violations.add("strategy.rollTargetDelta: must be below risk.hedgeTriggerDelta");
        }
        if (strategy.getRollTimeout().isNegative() || strategy.getRollTimeout().isZero()) {
            violations.add("strategy.rollTimeout: must be positive");
        }

        TradingProperties.Feed feed = properties.getFeed();
        if (feed.getReconnectInitialBackoff().compareTo(feed.getReconnectMaxBackoff()) > 0) {
            violations.add("feed.reconnectInitialBackoff: must not exceed feed.reconnectMaxBackoff");
        }
        if (feed.getStaleThreshold().compareTo(feed.getHeartbeatTimeout()) > 0) {
            violations.add("feed.staleThreshold: must not exceed feed.heartbeatTimeout");
        }

        TradingProperties.Execution execution = properties.getExecution();
        if (execution.getInitialBackoff().compareTo(execution.getMaxBackoff()) > 0) {
            violations.add("execution.initialBackoff: must not exceed execution.maxBackoff");
        }
        if (properties.getTimerInterval().isNegative() || properties.getTimerInterval().isZero()) {
            violations.add("timerInterval: must be positive");
        }

        Integer maxLots = properties.getRisk().getMaxLotsPerPosition();
        if (maxLots != null && maxLots < strategy.getLots()) {
            log.warn("strategy.lots={} will be capped to risk.maxLotsPerPosition={}", strategy.getLots(), maxLots);
        }

        switch (properties.getMode()) {
            case LIVE -> {
                if (isBlank(properties.getKite().getApiKey())) {
                    violations.add("kite.apiKey: required in LIVE mode");
                }
                if (isBlank(properties.getKite().getAccessToken())) {
                    violations.add("kite.accessToken: required in LIVE mode");
                }
            }
            case BACKTEST -> {
                if (isBlank(properties.getBacktest().getTickFile())) {
                    violations.add("backtest.tickFile: required in BACKTEST mode");
                }
                if (isBlank(properties.getBacktest().getInstrumentsFile())) {
                    violations.add("backtest.instrumentsFile: required in BACKTEST mode");
                }
            }
        }
        return violations;
    }

    /** Exchange clock (IST). Only the live service and timers read it; decisions use tick time. */
    @Bean
    public Clock clock() {
        return Clock.system(EXCHANGE_ZONE);
    }

    @Bean
    public IronCondorConfig ironCondorConfig() {
        TradingProperties.Strategy strategy = tradingProperties.getStrategy();
        return IronCondorConfig.builder()
                .strategyName(strategy.getName())
                .index(tradingProperties.getIndex())
                .lots(strategy.getLots())
                .minIvRank(strategy.getMinIvRank())
                .entryStart(strategy.getEntryStart())
                .entryEnd(strategy.getEntryEnd())
                .minDaysToExpiry(strategy.getMinDaysToExpiry())
                .maxEntriesPerDay(strategy.getMaxEntriesPerDay())
                .shortDeltaMin(strategy.getShortDeltaMin())
                .shortDeltaMax(strategy.getShortDeltaMax())
                .shortDeltaTarget(strategy.getShortDeltaTarget())
                .wingWidth(strategy.getWingWidth())
                .callOffset(strategy.getCallOffset())
                .putOffset(strategy.getPutOffset())
                .rollTargetDelta(strategy.getRollTargetDelta())
                .rollTimeout(strategy.getRollTimeout())
                .exitMinutesBeforeExpiry(strategy.getExitMinutesBeforeExpiry())
                .dailyExitTime(strategy.getDailyExitTime())
                .takeProfitPct(strategy.getTakeProfitPct())
                .legStopMultiplier(strategy.getLegStopMultiplier())
                .maxCloseAttempts(strategy.getMaxCloseAttempts())
                .vwapEntryGate(strategy.isVwapEntryGate())
                .vwapPrefill(strategy.isVwapPrefill())
                .orderType(strategy.getOrderType())
                .build();
    }

    /** Maps domain failures that escape the launcher to their exit codes (2, 3, 4). */
    @Bean
    public ExitCodeExceptionMapper exitCodeExceptionMapper() {
        return exception -> {
            Throwable current = exception;
            while (current != null) {
                if (current instanceof BaseException baseException) {
                    return baseException.getExitCode();
                }
                current = current.getCause();
            }
            return 1;
        };
    }

    private static String describe(ConstraintViolation<TradingProperties> violation) {
        return violation.getPropertyPath() + ": " + violation.getMessage();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
