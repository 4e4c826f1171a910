package com.condortrader.persistence;

import com.condortrader.entity.OrderEventEntity;
import com.condortrader.execution.OrderEventLog;
import com.condortrader.execution.OrderEventRecord;
import com.condortrader.mapper.OrderEventMapper;
import com.condortrader.repository.OrderEventJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Order-event log in the H2 order_events table. Each append is one insert; the
 * repository's identity column provides the sequence.
 */
@Component
public class JpaOrderEventLog implements OrderEventLog {

    private final OrderEventJpaRepository orderEventJpaRepository;
    private final OrderEventMapper orderEventMapper;

    public JpaOrderEventLog(OrderEventJpaRepository orderEventJpaRepository, OrderEventMapper orderEventMapper) {
        this.orderEventJpaRepository = orderEventJpaRepository;
        this.orderEventMapper = orderEventMapper;
    }

    @Override
    public OrderEventRecord append(OrderEventRecord record) {
        OrderEventEntity saved = orderEventJpaRepository.save(orderEventMapper.toEntity(record));
        return record.toBuilder().sequence(saved.getId()).build();
    }

    @Override
    public List<OrderEventRecord> readAll() {
        return orderEventMapper.toDomainList(orderEventJpaRepository.findAllByOrderByIdAsc());
    }

    @Override
    public List<OrderEventRecord> readAfter(LocalDateTime after) {
        if (after == null) {
            return readAll();
        }
        return orderEventMapper.toDomainList(orderEventJpaRepository.findByEventTimeAfterOrderByIdAsc(after));
    }

    @Override
    public void flush() {
        orderEventJpaRepository.flush();
    }
}
