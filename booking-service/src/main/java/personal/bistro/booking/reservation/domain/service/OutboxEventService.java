package personal.bistro.booking.reservation.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.booking.reservation.application.port.in.PublishPendingEventsUseCase;
import personal.bistro.booking.reservation.application.port.out.OutboxEventRepository;
import personal.bistro.booking.reservation.application.port.out.ReservationEventPublisher;
import personal.bistro.booking.reservation.domain.model.OutboxEvent;
import personal.bistro.booking.reservation.domain.model.ReservationEventType;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Outbox Event Service
 * PENDING 예약 이벤트를 id 순으로 발행
 *
 * 같은 예약(aggregateId)의 이벤트는 Kafka 키가 같아 순서가 유지되어야 함
 * - 앞선 이벤트가 PENDING인 채로 실패하면 같은 예약의 뒤 이벤트는 이번 실행에서 보내지 않음
 * - 앞선 이벤트가 FAILED(재시도 한도 초과)로 포기된 경우 뒤 이벤트는 발행하되
 *   소비자 쪽에 빠진 이벤트가 있음을 WARN으로 남김 (포기된 이벤트 수는 countAbandonedEvents)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService implements PublishPendingEventsUseCase {

    private final OutboxEventRepository outboxEventRepository;
    private final ReservationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    @Transactional
    public int publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findPendingEvents();
        if (pendingEvents.isEmpty()) {
            return 0;
        }
        Map<Long, Long> firstAbandonedIds = outboxEventRepository.findFirstAbandonedEventIds(
                pendingEvents.stream().map(OutboxEvent::aggregateId).collect(Collectors.toSet()));
        Set<Long> heldReservations = new HashSet<>();
        int publishedCount = 0;

        for (OutboxEvent event : pendingEvents) {
            if (heldReservations.contains(event.aggregateId())) {
                log.debug("Event held behind failed predecessor: id={}, reservationId={}",
                        event.id(), event.aggregateId());
                continue;
            }
            String topic = ReservationEventType.valueOf(event.eventType()).topic();
            Long abandonedId = firstAbandonedIds.get(event.aggregateId());
            if (abandonedId != null && abandonedId < event.id()) {
                log.warn("Publishing after abandoned predecessor, consumers miss an earlier event: "
                                + "id={}, reservationId={}, abandonedEventId={}",
                        event.id(), event.aggregateId(), abandonedId);
            }
            try {
                eventPublisher.publishRaw(topic, String.valueOf(event.aggregateId()), event.payload());
                outboxEventRepository.save(event.markAsPublished(LocalDateTime.now(clock)));
                publishedCount++;
            } catch (Exception e) {
                heldReservations.add(event.aggregateId());
                OutboxEvent failed = event.recordFailure();
                if (failed.status() == OutboxEvent.OutboxEventStatus.FAILED) {
                    log.error("Reservation event abandoned after {} attempts: id={}, reservationId={}, topic={}",
                            failed.retryCount(), event.id(), event.aggregateId(), topic, e);
                } else {
                    log.warn("Reservation event publish failed: id={}, reservationId={}, topic={}, retryCount={}, error={}",
                            event.id(), event.aggregateId(), topic, failed.retryCount(), e.getMessage());
                }
                outboxEventRepository.save(failed);
            }
        }
        return publishedCount;
    }

    @Override
    @Transactional(readOnly = true)
    public long countAbandonedEvents() {
        return outboxEventRepository.countAbandoned();
    }
}
