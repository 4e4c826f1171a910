package com.condortrader.domain.model;

import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.OrderIntent;
import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable instruction from the strategy to the execution layer: trade one leg.
 */
@Value
@Builder
public class LegAction {

    String clientOrderId;
    String positionId;
    String legId;
    LegRole role;
    OptionContract contract;
    OrderSide side;
    int quantity;
    OrderType orderType;

    /** Quote the decision was based on. Used as the limit price for LIMIT orders. */
    BigDecimal referencePrice;

    OrderIntent intent;

    /** Short free-text reason, e.g. ENTRY, ROLL_CLOSE, EXIT_STOP_LOSS_BREACHED. */
    String reason;
}
