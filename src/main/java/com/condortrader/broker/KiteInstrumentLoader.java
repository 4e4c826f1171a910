package com.condortrader.broker;

import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.enums.OptionType;
import com.condortrader.domain.enums.RejectCode;
import com.condortrader.domain.model.OptionContract;
import com.condortrader.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Instrument;
import com.zerodhatech.models.LTPQuote;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads the option contracts of one index from the Kite instrument dump.
 *
 * <p>The dump of an F&O exchange holds tens of thousands of rows; only CE/PE rows whose
 * {@code name} is the index are kept, and only strikes within {@code strikeWindow} points of
 * the current spot, which keeps the ticker subscription small.
 */
public class KiteInstrumentLoader {

    private static final Logger log = LoggerFactory.getLogger(KiteInstrumentLoader.class);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final KiteConnect kiteConnect;

    public KiteInstrumentLoader(KiteConnect kiteConnect) {
        this.kiteConnect = kiteConnect;
    }

    public List<OptionContract> loadOptions(IndexName index, BigDecimal strikeWindow) {
        BigDecimal spot = fetchSpot(index);
        try {
            List<Instrument> instruments = kiteConnect.getInstruments(index.getExchange());
            log.info("Downloaded {} {} instruments from Kite API", instruments.size(), index.getExchange());

            List<OptionContract> contracts = instruments.stream()
                    .filter(i -> index.getInstrumentName().equals(i.name))
                    .map(i -> toContract(i, index))
                    .flatMap(Optional::stream)
                    .filter(c -> c.getStrike().subtract(spot).abs().compareTo(strikeWindow) <= 0)
                    .toList();

            log.info(
                    "Option contracts loaded: index={}, spot={}, window={}, contracts={}",
                    index,
                    spot,
                    strikeWindow,
                    contracts.size());
            return contracts;
        } catch (KiteException e) {
            throw KiteBrokerGateway.classify("Failed to download instruments", e);
        } catch (JSONException | IOException e) {
            throw KiteBrokerGateway.classify("Failed to download instruments", e);
        }
    }

    private BigDecimal fetchSpot(IndexName index) {
        try {
            Map<String, LTPQuote> quotes = kiteConnect.getLTP(new String[] {index.getSpotSymbol()});
            LTPQuote quote = quotes.get(index.getSpotSymbol());
            if (quote == null) {
                throw new BrokerException(RejectCode.BROKER_REJECTED, "No LTP for " + index.getSpotSymbol());
            }
            return BigDecimal.valueOf(quote.lastPrice);
        } catch (KiteException e) {
            throw KiteBrokerGateway.classify("Failed to fetch spot", e);
        } catch (JSONException | IOException e) {
            throw KiteBrokerGateway.classify("Failed to fetch spot", e);
        }
    }

    private Optional<OptionContract> toContract(Instrument instrument, IndexName index) {
        if (!"CE".equals(instrument.instrument_type) && !"PE".equals(instrument.instrument_type)) {
            return Optional.empty();
        }
        OptionType type = OptionType.valueOf(instrument.instrument_type);
        if (instrument.strike == null || instrument.strike.isBlank() || instrument.expiry == null) {
            return Optional.empty();
        }
        return Optional.of(OptionContract.builder()
                .instrumentToken(instrument.instrument_token)
                .tradingSymbol(instrument.tradingsymbol)
                .exchange(index.getExchange())
                .strike(new BigDecimal(instrument.strike))
                .optionType(type)
                .expiry(toLocalDate(instrument.expiry))
                .lotSize(instrument.lot_size > 0 ? instrument.lot_size : index.getDefaultLotSize())
                .build());
    }

    private static LocalDate toLocalDate(Date date) {
        return date.toInstant().atZone(IST).toLocalDate();
    }
}
