package com.condortrader.entity;

import com.condortrader.domain.enums.PositionState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the position_snapshots table: the latest full state of each open
 * position, overwritten on every snapshot and deleted when the position is archived.
 *
 * <p>Startup recovery loads these and replays order-event log fills newer than
 * {@code snapshotAt} on top.
 */
@Entity
@Table(name = "position_snapshots")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionSnapshotEntity {

    @Id
    @Column(name = "position_id", length = 40)
    private String positionId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private PositionState state;

    @Column(name = "snapshot_at", nullable = false)
    private LocalDateTime snapshotAt;

    /** Full Position as JSON. */
    @Lob
    @Column(nullable = false)
    private String payload;
}
