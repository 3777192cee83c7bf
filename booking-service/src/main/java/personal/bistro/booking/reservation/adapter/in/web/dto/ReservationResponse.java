package personal.bistro.booking.reservation.adapter.in.web.dto;

import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.reservation.domain.model.SeatingType;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 예약 조회/생성 응답 DTO
 */
public record ReservationResponse(
        Long id,
        String guestName,
        String email,
        String phone,
        int partySize,
        LocalDate date,
        String time,
        SeatingType seatingType,
        ReservationStatus status,
        String specialRequests,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        LocalDateTime cancelledAt,
        String cancellationReason
) {
    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.id(),
                reservation.guestName(),
                reservation.email(),
                reservation.phone(),
                reservation.partySize(),
                reservation.date(),
                reservation.time(),
                reservation.seatingType(),
                reservation.status(),
                reservation.specialRequests(),
                reservation.createdAt(),
                reservation.updatedAt(),
                reservation.cancelledAt(),
                reservation.cancellationReason()
        );
    }
}
