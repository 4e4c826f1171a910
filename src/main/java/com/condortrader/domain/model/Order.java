package com.condortrader.domain.model;

import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.OrderIntent;
import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.enums.OrderStatus;
import com.condortrader.domain.enums.OrderType;
import com.condortrader.domain.enums.RejectCode;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Broker order for one leg action, owned by the execution manager.
 *
 * <p>The id is assigned by the strategy ({@link LegAction#getClientOrderId()}) and is sent
 * to Kite as the order tag, so push updates can be matched before the placement call
 * returns a broker id. Retry state is carried here and evaluated on every reconcile pass
 * rather than in a blocking loop:
 * <ul>
 *   <li>{@code attempts}: placements tried so far</li>
 *   <li>{@code nextRetryAt}: earliest time for the next placement</li>
 *   <li>{@code lastSentAt} and {@code inFlight}: the outstanding placement, used for the
 *       acknowledgment timeout</li>
 * </ul>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private String id;
    private String positionId;
    private String legId;
    private LegRole role;
    private OrderIntent intent;

    private long instrumentToken;
    private String tradingSymbol;
    private String exchange;
    private OrderSide side;
    private OrderType orderType;
    private int quantity;

    /** Limit price, or the reference quote for market orders. */
    private BigDecimal price;

    private OrderStatus status;
    private String brokerOrderId;

    private int attempts;
    private LocalDateTime nextRetryAt;
    private LocalDateTime lastSentAt;
    private boolean inFlight;
    private boolean cancelRequested;

    private int filledQuantity;
    private BigDecimal averagePrice;

    private RejectCode rejectCode;
    private String rejectReason;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public int remainingQuantity() {
        return quantity - filledQuantity;
    }
}
