package com.condortrader.broker;

import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Broker-neutral placement request for one order. */
@Value
@Builder
public class BrokerOrderRequest {

    /** Client order id, sent as the order tag. */
    String tag;

    String tradingSymbol;
    String exchange;
    OrderSide side;
    OrderType orderType;
    int quantity;

    /** Limit price; ignored for MARKET orders. */
    BigDecimal price;
}
