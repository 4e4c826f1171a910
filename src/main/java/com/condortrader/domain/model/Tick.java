package com.condortrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Market data tick, normalized from the Kite WebSocket (or a recorded tick file).
 *
 * <p>Immutable. The timestamp is the exchange time in IST and is the only clock the
 * decision path reads, which keeps live and replayed runs identical. Bid/ask are the best
 * depth levels and are null when the source carried no depth.
 */
@Value
@Builder(toBuilder = true)
public class Tick {

    long instrumentToken;
    BigDecimal lastPrice;
    BigDecimal bid;
    BigDecimal ask;
    long volume;
    LocalDateTime timestamp;
}
