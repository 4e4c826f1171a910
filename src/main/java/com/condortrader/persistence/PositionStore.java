package com.condortrader.persistence;

import com.condortrader.domain.model.Position;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Durable state of positions: the latest snapshot of each open position and the archive
 * of closed ones.
 */
public interface PositionStore {

    /** Replaces the stored snapshot of an open position. */
    void snapshot(Position position, LocalDateTime at);

    /** Archives a closed position and drops its snapshot. */
    void archive(Position position, LocalDateTime at);

    /** Snapshots of positions that were open at the last snapshot. */
    List<StoredPosition> loadOpen();

    /** Closed positions entered on the given trading day. */
    List<Position> archivedOn(LocalDate tradingDay);
}
