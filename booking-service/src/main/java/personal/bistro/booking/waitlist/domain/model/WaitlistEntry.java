package personal.bistro.booking.waitlist.domain.model;

import personal.bistro.booking.reservation.application.port.in.CreateReservationCommand;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Waitlist Entry Domain Model
 * 만석인 슬롯에 대한 대기 신청 (순번은 관리하지 않고 생성 순으로 정렬)
 */
public record WaitlistEntry(
        Long id,
        String guestName,
        String email,
        String phone,
        int partySize,
        LocalDate requestedDate,
        String requestedTime,
        SeatingType seatingType,
        NotificationPreference notificationPreference,
        LocalDateTime createdAt) {

    public WaitlistEntry {
        if (guestName == null || guestName.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Guest name cannot be blank");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Email cannot be blank");
        }
        if (partySize < 1) {
            throw new BusinessException(ErrorCode.INVALID_PARTY_SIZE,
                    String.format("Party size must be at least 1: partySize=%d", partySize));
        }
        if (requestedDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Requested date cannot be null");
        }
        if (requestedTime == null || requestedTime.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Requested time cannot be blank");
        }
        if (seatingType == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seating type cannot be null");
        }
        if (notificationPreference == null) {
            notificationPreference = NotificationPreference.EMAIL;
        }
    }

    public static WaitlistEntry create(String guestName, String email, String phone, int partySize,
                                       LocalDate requestedDate, String requestedTime, SeatingType seatingType,
                                       NotificationPreference notificationPreference, LocalDateTime now) {
        return new WaitlistEntry(null, guestName, email, phone, partySize, requestedDate, requestedTime,
                seatingType, notificationPreference, now);
    }

    /**
     * 예약 전환용 커맨드 (요청 사항 없음)
     */
    public CreateReservationCommand toReservationCommand() {
        return new CreateReservationCommand(guestName, email, phone, partySize, requestedDate, requestedTime,
                seatingType, null);
    }
}
