package personal.bistro.booking.reservation.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.bistro.booking.reservation.domain.model.OutboxEvent.OutboxEventStatus;

import java.util.Collection;
import java.util.List;

public interface JpaOutboxEventRepository extends JpaRepository<OutboxEventEntity, Long> {

    /**
     * 한 예약에 대해 쌓인 이벤트 (생성 순)
     */
    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderByIdAsc(String aggregateType, Long aggregateId);

    /**
     * 발행 대상 묶음 조회. 정렬과 최대 건수는 Pageable로 지정
     */
    List<OutboxEventEntity> findByStatusAndRetryCountLessThan(OutboxEventStatus status,
                                                             int maxRetryCount,
                                                             Pageable pageable);

    /**
     * [aggregateId, MIN(id)]
     */
    @Query("SELECT o.aggregateId, MIN(o.id) FROM OutboxEventEntity o "
            + "WHERE o.status = :status AND o.aggregateId IN :aggregateIds GROUP BY o.aggregateId")
    List<Object[]> findFirstIdByStatusGroupByAggregate(@Param("status") OutboxEventStatus status,
                                                        @Param("aggregateIds") Collection<Long> aggregateIds);

    long countByStatus(OutboxEventStatus status);
}
