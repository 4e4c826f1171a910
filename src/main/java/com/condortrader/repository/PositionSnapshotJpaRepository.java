package com.condortrader.repository;

import com.condortrader.entity.PositionSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the position_snapshots table, keyed by position id. */
@Repository
public interface PositionSnapshotJpaRepository extends JpaRepository<PositionSnapshotEntity, String> {}
