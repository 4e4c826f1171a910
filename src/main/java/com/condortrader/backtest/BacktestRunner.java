package com.condortrader.backtest;

import com.condortrader.config.TradingProperties;
import com.condortrader.domain.model.OptionContract;
import com.condortrader.domain.model.Tick;
import com.condortrader.event.EventPublisherHelper;
import com.condortrader.event.SystemEventType;
import com.condortrader.exception.ConfigInvalidException;
import com.condortrader.feed.InstrumentFiles;
import com.condortrader.feed.TickFileReader;
import com.condortrader.mapper.JsonHelper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Entry point of {@code condortrader.mode=BACKTEST}: loads the recorded tick file and the
 * instruments of the same session, runs the {@link BacktestEngine} and writes the JSON
 * report. The application exits once the report is written.
 */
@Component
@ConditionalOnProperty(prefix = "condortrader", name = "mode", havingValue = "BACKTEST")
public class BacktestRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);

    private final TradingProperties tradingProperties;
    private final BacktestEngine backtestEngine;
    private final EventPublisherHelper eventPublisherHelper;

    public BacktestRunner(
            TradingProperties tradingProperties,
            BacktestEngine backtestEngine,
            EventPublisherHelper eventPublisherHelper) {
        this.tradingProperties = tradingProperties;
        this.backtestEngine = backtestEngine;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void run(String... args) {
        TradingProperties.Backtest backtest = tradingProperties.getBacktest();
        Path tickFile = Path.of(backtest.getTickFile());
        Path instrumentsFile = Path.of(backtest.getInstrumentsFile());
        if (!Files.isRegularFile(tickFile) || !Files.isRegularFile(instrumentsFile)) {
            throw new ConfigInvalidException(List.of(
                    "backtest.tickFile/instrumentsFile: not found: " + tickFile + ", " + instrumentsFile));
        }

        List<Tick> ticks;
        List<OptionContract> contracts;
        try {
            ticks = TickFileReader.read(tickFile);
            contracts = InstrumentFiles.read(instrumentsFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read backtest input " + tickFile, e);
        }
        log.info("Loaded {} ticks and {} contracts for backtest", ticks.size(), contracts.size());

        BacktestResult result = backtestEngine.run(contracts, ticks);
        Path report = writeReport(result, Path.of(backtest.getReportFile()));

        eventPublisherHelper.publishSystemEvent(
                this,
                SystemEventType.APPLICATION_READY,
                "Backtest complete",
                Map.of(
                        "report", report.toString(),
                        "closedPositions", result.getClosedPositions().size(),
                        "totalRealizedPnl", result.getTotalRealizedPnl()));
    }

    static Path writeReport(BacktestResult result, Path report) {
        try {
            Path parent = report.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JsonHelper.objectMapper().writerWithDefaultPrettyPrinter().writeValue(report.toFile(), result);
            log.info("Backtest report written to {}", report);
            return report;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write backtest report " + report, e);
        }
    }
}
