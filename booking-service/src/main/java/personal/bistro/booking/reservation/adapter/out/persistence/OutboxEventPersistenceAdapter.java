package personal.bistro.booking.reservation.adapter.out.persistence;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.bistro.booking.reservation.application.port.out.OutboxEventRepository;
import personal.bistro.booking.reservation.domain.model.OutboxEvent;
import personal.bistro.booking.reservation.domain.model.OutboxEvent.OutboxEventStatus;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outbox Event Persistence Adapter
 * 한 번의 스케줄 실행에서 booking.outbox.batch-size건까지만 id 순으로 가져옴
 */
@Component
public class OutboxEventPersistenceAdapter implements OutboxEventRepository {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final int batchSize;

    public OutboxEventPersistenceAdapter(JpaOutboxEventRepository jpaOutboxEventRepository,
                                         @Value("${booking.outbox.batch-size:100}") int batchSize) {
        this.jpaOutboxEventRepository = jpaOutboxEventRepository;
        this.batchSize = batchSize;
    }

    @Override
    public OutboxEvent save(OutboxEvent outboxEvent) {
        return jpaOutboxEventRepository.save(OutboxEventEntity.fromDomain(outboxEvent)).toDomain();
    }

    @Override
    public List<OutboxEvent> findPendingEvents() {
        PageRequest firstBatch = PageRequest.of(0, batchSize, Sort.by(Sort.Direction.ASC, "id"));
        return jpaOutboxEventRepository
                .findByStatusAndRetryCountLessThan(OutboxEventStatus.PENDING, OutboxEvent.MAX_RETRY_COUNT, firstBatch)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Override
    public Map<Long, Long> findFirstAbandonedEventIds(Collection<Long> reservationIds) {
        Map<Long, Long> firstIds = new HashMap<>();
        if (reservationIds.isEmpty()) {
            return firstIds;
        }
        for (Object[] row : jpaOutboxEventRepository.findFirstIdByStatusGroupByAggregate(
                OutboxEventStatus.FAILED, reservationIds)) {
            firstIds.put(((Number) row[0]).longValue(), ((Number) row[1]).longValue());
        }
        return firstIds;
    }

    @Override
    public long countAbandoned() {
        return jpaOutboxEventRepository.countByStatus(OutboxEventStatus.FAILED);
    }
}
