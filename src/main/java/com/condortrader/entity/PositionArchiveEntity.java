package com.condortrader.entity;

import com.condortrader.domain.enums.ExitReason;
import com.condortrader.domain.enums.IndexName;
import com.condortrader.domain.enums.PositionState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the position_archive table. One row per closed position with its
 * final realized P&L; the legs (including rolled-out ones) are kept as JSON.
 */
@Entity
@Table(name = "position_archive")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionArchiveEntity {

    @Id
    @Column(length = 40)
    private String id;

    @Column(name = "strategy_name", length = 50)
    private String strategyName;

    @Enumerated(EnumType.STRING)
    @Column(name = "index_name", length = 10)
    private IndexName index;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private PositionState state;

    @Column(name = "entry_time")
    private LocalDateTime entryTime;

    @Column(name = "exit_time")
    private LocalDateTime exitTime;

    @Column(name = "realized_pnl", precision = 15, scale = 2)
    private BigDecimal realizedPnl;

    @Column(name = "entry_credit", precision = 15, scale = 2)
    private BigDecimal entryCredit;

    @Enumerated(EnumType.STRING)
    @Column(name = "exit_reason", length = 30)
    private ExitReason exitReason;

    @Column(name = "roll_count")
    private int rollCount;

    @Lob
    @Column(name = "legs_json")
    private String legs;

    @Lob
    @Column(name = "retired_legs_json")
    private String retiredLegs;

    @Column(name = "archived_at")
    private LocalDateTime archivedAt;
}
