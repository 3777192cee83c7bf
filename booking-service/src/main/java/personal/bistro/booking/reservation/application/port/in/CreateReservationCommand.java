package personal.bistro.booking.reservation.application.port.in;

import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Create Reservation Command
 * 예약 생성 커맨드
 */
public record CreateReservationCommand(
        String guestName,
        String email,
        String phone,
        int partySize,
        LocalDate date,
        String time,
        SeatingType seatingType,
        String specialRequests
) {
    public CreateReservationCommand {
        if (guestName == null || guestName.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Guest name cannot be blank");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Email cannot be blank");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation date cannot be null");
        }
        if (time == null || time.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation time cannot be blank");
        }
        if (seatingType == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seating type cannot be null");
        }
    }
}
