package personal.bistro.booking.reservation.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationEventType;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDateTime;

/**
 * Outbox Event Factory (Adapter Layer)
 * Reservation을 OutboxEventEntity로 변환하는 팩토리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventFactory {

    public static final String AGGREGATE_TYPE = "RESERVATION";

    private final ObjectMapper objectMapper;

    public OutboxEventEntity create(Reservation reservation, ReservationEventType eventType, LocalDateTime now) {
        ReservationEventPayload event = new ReservationEventPayload(
                eventType.name(),
                reservation.id(),
                reservation.guestName(),
                reservation.email(),
                reservation.partySize(),
                reservation.date().toString(),
                reservation.time(),
                reservation.seatingType().value(),
                reservation.status().value(),
                reservation.cancellationReason(),
                now.toString());

        try {
            String payload = objectMapper.writeValueAsString(event);
            return OutboxEventEntity.pending(AGGREGATE_TYPE, reservation.id(), eventType.name(), payload, now);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize outbox event: reservationId={}, eventType={}",
                    reservation.id(), eventType, e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to create outbox event");
        }
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record ReservationEventPayload(
            String eventType,
            Long reservationId,
            String guestName,
            String email,
            int partySize,
            String date,
            String time,
            String seatingType,
            String status,
            String cancellationReason,
            String occurredAt) {
    }
}
