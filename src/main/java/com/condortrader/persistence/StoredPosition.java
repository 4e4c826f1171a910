package com.condortrader.persistence;

import com.condortrader.domain.model.Position;
import java.time.LocalDateTime;

/** An open position as last snapshotted, with the snapshot time. */
public record StoredPosition(Position position, LocalDateTime snapshotAt) {}
