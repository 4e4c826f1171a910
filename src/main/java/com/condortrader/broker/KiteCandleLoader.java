package com.condortrader.broker;

import com.condortrader.domain.model.Candle;
import com.condortrader.domain.model.OptionContract;
import com.condortrader.exception.BrokerException;
import com.condortrader.strategy.NetCreditBar;
import com.condortrader.strategy.VwapSeedRequest;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.HistoricalData;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minute candles from the Kite historical API, for the net credit VWAP history.
 *
 * <p>Calls block and are paced by their own rate limiter (Kite allows three historical
 * requests per second); run them on the broker I/O executor, never on the decision thread.
 */
public class KiteCandleLoader {

    private static final Logger log = LoggerFactory.getLogger(KiteCandleLoader.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    /** Kite candle timestamps, e.g. 2024-01-15T09:15:00+0530. */
    private static final DateTimeFormatter CANDLE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private final KiteConnect kiteConnect;
    private final RateLimiter rateLimiter;

    public KiteCandleLoader(KiteConnect kiteConnect, RateLimiter rateLimiter) {
        this.kiteConnect = kiteConnect;
        this.rateLimiter = rateLimiter;
    }

    /** Minute candles of one instrument, oldest first. */
    public List<Candle> minuteCandles(long instrumentToken, LocalDateTime from, LocalDateTime to) {
        RateLimiter.waitForPermission(rateLimiter);
        try {
            HistoricalData data = kiteConnect.getHistoricalData(
                    toDate(from), toDate(to), String.valueOf(instrumentToken), "minute", false, false);
            if (data == null || data.dataArrayList == null) {
                return List.of();
            }
            return data.dataArrayList.stream()
                    .map(this::toCandle)
                    .flatMap(Optional::stream)
                    .toList();
        } catch (KiteException e) {
            throw KiteBrokerGateway.classify("Failed to load candles of " + instrumentToken, e);
        } catch (JSONException | IOException e) {
            throw KiteBrokerGateway.classify("Failed to load candles of " + instrumentToken, e);
        }
    }

    /**
     * Net credit bars of the requested condor, one per minute in which all four legs have a
     * candle. Empty when the history cannot be loaded; the VWAP then starts from live samples.
     */
    public List<NetCreditBar> netCreditBars(VwapSeedRequest request) {
        try {
            List<Candle> shortCalls = candles(request.getShortCall(), request);
            Map<LocalDateTime, Candle> shortPuts = byTime(candles(request.getShortPut(), request));
            Map<LocalDateTime, Candle> longCalls = byTime(candles(request.getLongCall(), request));
            Map<LocalDateTime, Candle> longPuts = byTime(candles(request.getLongPut(), request));

            List<NetCreditBar> bars = new ArrayList<>();
            for (Candle shortCall : shortCalls) {
                Candle shortPut = shortPuts.get(shortCall.getTime());
                Candle longCall = longCalls.get(shortCall.getTime());
                Candle longPut = longPuts.get(shortCall.getTime());
                if (shortPut != null && longCall != null && longPut != null) {
                    bars.add(NetCreditBar.combine(shortCall, shortPut, longCall, longPut));
                }
            }
            log.info(
                    "Net credit history loaded: bars={}, from={}, to={}",
                    bars.size(),
                    request.getFrom(),
                    request.getTo());
            return bars;
        } catch (BrokerException e) {
            log.warn("Net credit history unavailable, VWAP starts from live samples: {}", e.getMessage());
            return List.of();
        }
    }

    private List<Candle> candles(OptionContract contract, VwapSeedRequest request) {
        return minuteCandles(contract.getInstrumentToken(), request.getFrom(), request.getTo());
    }

    private Optional<Candle> toCandle(HistoricalData bar) {
        if (bar.timeStamp == null) {
            return Optional.empty();
        }
        try {
            LocalDateTime time = OffsetDateTime.parse(bar.timeStamp, CANDLE_TIME)
                    .atZoneSameInstant(IST)
                    .toLocalDateTime();
            return Optional.of(Candle.builder()
                    .time(time)
                    .open(BigDecimal.valueOf(bar.open))
                    .high(BigDecimal.valueOf(bar.high))
                    .low(BigDecimal.valueOf(bar.low))
                    .close(BigDecimal.valueOf(bar.close))
                    .volume(bar.volume)
                    .build());
        } catch (DateTimeParseException e) {
            log.debug("Skipping candle with timestamp '{}': {}", bar.timeStamp, e.getMessage());
            return Optional.empty();
        }
    }

    private static Map<LocalDateTime, Candle> byTime(List<Candle> candles) {
        return candles.stream().collect(Collectors.toMap(Candle::getTime, Function.identity(), (a, b) -> b));
    }

    private static Date toDate(LocalDateTime time) {
        return Date.from(time.atZone(IST).toInstant());
    }
}
