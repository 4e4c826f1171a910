package com.condortrader.repository;

import com.condortrader.entity.PositionArchiveEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the position_archive table. */
@Repository
public interface PositionArchiveJpaRepository extends JpaRepository<PositionArchiveEntity, String> {

    List<PositionArchiveEntity> findByEntryTimeBetweenOrderByEntryTimeAsc(LocalDateTime from, LocalDateTime to);
}
