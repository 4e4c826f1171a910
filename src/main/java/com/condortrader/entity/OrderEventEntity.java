package com.condortrader.entity;

import com.condortrader.domain.enums.LegRole;
import com.condortrader.domain.enums.OrderEventType;
import com.condortrader.domain.enums.OrderIntent;
import com.condortrader.domain.enums.OrderSide;
import com.condortrader.domain.enums.OrderStatus;
import com.condortrader.domain.enums.OrderType;
import com.condortrader.domain.enums.RejectCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the order_events table: the append-only order-event log.
 *
 * <p>Rows are inserted, never updated. The identity column doubles as the log sequence,
 * so reading by ascending id replays transitions in the order they happened.
 */
@Entity
@Table(
        name = "order_events",
        indexes = {
            @Index(name = "idx_order_events_order", columnList = "order_id"),
            @Index(name = "idx_order_events_time", columnList = "event_time")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 30)
    private OrderEventType eventType;

    @Column(name = "event_time", nullable = false)
    private LocalDateTime eventTime;

    @Column(name = "order_id", nullable = false, length = 60)
    private String orderId;

    @Column(name = "position_id", length = 40)
    private String positionId;

    @Column(name = "leg_id", length = 60)
    private String legId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private LegRole role;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private OrderIntent intent;

    @Column(name = "instrument_token")
    private Long instrumentToken;

    @Column(name = "trading_symbol", length = 50)
    private String tradingSymbol;

    @Column(length = 10)
    private String exchange;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private OrderSide side;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", length = 10)
    private OrderType orderType;

    private int quantity;

    @Column(precision = 15, scale = 2)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private OrderStatus status;

    @Column(name = "broker_order_id", length = 100)
    private String brokerOrderId;

    private int attempts;

    @Column(name = "filled_quantity")
    private int filledQuantity;

    @Column(name = "average_price", precision = 15, scale = 4)
    private BigDecimal averagePrice;

    @Column(name = "fill_quantity")
    private int fillQuantity;

    @Column(name = "fill_price", precision = 15, scale = 4)
    private BigDecimal fillPrice;

    @Column(name = "fill_seq")
    private int fillSeq;

    @Enumerated(EnumType.STRING)
    @Column(name = "reject_code", length = 30)
    private RejectCode rejectCode;

    @Column(length = 500)
    private String message;
}
