package personal.bistro.booking.reservation.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bistro.booking.reservation.adapter.out.persistence.JpaOutboxEventRepository;
import personal.bistro.booking.reservation.adapter.out.persistence.OutboxEventEntity;
import personal.bistro.booking.reservation.adapter.out.persistence.OutboxEventFactory;
import personal.bistro.booking.reservation.application.port.out.ReservationEventPort;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationEventType;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Reservation Event Adapter
 * Outbox 패턴을 사용한 예약 이벤트 기록 구현체
 * 호출자의 트랜잭션에 참여하므로 예약 변경이 롤백되면 이벤트도 함께 롤백
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationEventAdapter implements ReservationEventPort {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;
    private final Clock clock;

    @Override
    public void publishReservationEvent(Reservation reservation, ReservationEventType eventType) {
        OutboxEventEntity outboxEvent = outboxEventFactory.create(reservation, eventType, LocalDateTime.now(clock));
        jpaOutboxEventRepository.save(outboxEvent);

        log.debug("Reservation event recorded: reservationId={}, eventType={}", reservation.id(), eventType);
    }
}
