package com.condortrader.persistence;

import com.condortrader.domain.model.Position;
import com.condortrader.entity.PositionArchiveEntity;
import com.condortrader.entity.PositionSnapshotEntity;
import com.condortrader.mapper.JsonHelper;
import com.condortrader.mapper.PositionArchiveMapper;
import com.condortrader.repository.PositionArchiveJpaRepository;
import com.condortrader.repository.PositionSnapshotJpaRepository;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Position store over the position_snapshots and position_archive tables.
 */
@Component
public class JpaPositionStore implements PositionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPositionStore.class);

    private final PositionSnapshotJpaRepository positionSnapshotJpaRepository;
    private final PositionArchiveJpaRepository positionArchiveJpaRepository;
    private final PositionArchiveMapper positionArchiveMapper;

    public JpaPositionStore(
            PositionSnapshotJpaRepository positionSnapshotJpaRepository,
            PositionArchiveJpaRepository positionArchiveJpaRepository,
            PositionArchiveMapper positionArchiveMapper) {
        this.positionSnapshotJpaRepository = positionSnapshotJpaRepository;
        this.positionArchiveJpaRepository = positionArchiveJpaRepository;
        this.positionArchiveMapper = positionArchiveMapper;
    }

    @Override
    public void snapshot(Position position, LocalDateTime at) {
        positionSnapshotJpaRepository.save(PositionSnapshotEntity.builder()
                .positionId(position.getId())
                .state(position.getState())
                .snapshotAt(at)
                .payload(JsonHelper.toJson(position))
                .build());
    }

    @Override
    @Transactional
    public void archive(Position position, LocalDateTime at) {
        PositionArchiveEntity entity = positionArchiveMapper.toEntity(position);
        entity.setArchivedAt(at);
        positionArchiveJpaRepository.save(entity);
        positionSnapshotJpaRepository.deleteById(position.getId());
        log.info("Position archived: id={}, realizedPnl={}", position.getId(), position.getRealizedPnl());
    }

    @Override
    public List<StoredPosition> loadOpen() {
        return positionSnapshotJpaRepository.findAll().stream()
                .map(e -> new StoredPosition(JsonHelper.fromJson(e.getPayload(), Position.class), e.getSnapshotAt()))
                .toList();
    }

    @Override
    public List<Position> archivedOn(LocalDate tradingDay) {
        return positionArchiveMapper.toDomainList(positionArchiveJpaRepository.findByEntryTimeBetweenOrderByEntryTimeAsc(
                tradingDay.atStartOfDay(), tradingDay.plusDays(1).atStartOfDay()));
    }
}
