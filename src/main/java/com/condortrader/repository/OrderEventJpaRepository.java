package com.condortrader.repository;

import com.condortrader.entity.OrderEventEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the order_events table. Insert-only; read on startup recovery.
 */
@Repository
public interface OrderEventJpaRepository extends JpaRepository<OrderEventEntity, Long> {

    List<OrderEventEntity> findAllByOrderByIdAsc();

    List<OrderEventEntity> findByEventTimeAfterOrderByIdAsc(LocalDateTime after);
}
