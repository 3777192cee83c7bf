package personal.bistro.booking.reservation.application.port.out;

import personal.bistro.booking.reservation.domain.model.OutboxEvent;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Outbox Event Repository (Output Port)
 * Transactional Outbox Pattern을 위한 이벤트 저장소 인터페이스
 */
public interface OutboxEventRepository {

    OutboxEvent save(OutboxEvent outboxEvent);

    /**
     * 발행 대기 중인 이벤트 조회 (생성 순)
     *
     * @return PENDING 상태이고 재시도 한도 미만인 이벤트 목록
     */
    List<OutboxEvent> findPendingEvents();

    /**
     * 예약별로 가장 먼저 포기(FAILED)된 이벤트 ID
     *
     * @return 예약 ID → 포기된 이벤트 중 최소 ID (포기된 이벤트가 없는 예약은 포함하지 않음)
     */
    Map<Long, Long> findFirstAbandonedEventIds(Collection<Long> reservationIds);

    long countAbandoned();
}
