package personal.bistro.booking.reservation.domain.model;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * 예약 목록 조회 조건
 * 모든 필터는 선택 사항이며 null이면 적용하지 않음
 */
public record ReservationSearchCondition(
        ReservationStatus status,
        LocalDate date,
        String email,
        SeatingType seatingType,
        int page,
        int size) {

    public static final int DEFAULT_SIZE = 50;
    private static final int MAX_SIZE = 200;

    public ReservationSearchCondition {
        if (page < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Page must not be negative: page=%d", page));
        }
        if (size < 1 || size > MAX_SIZE) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Size must be between 1 and %d: size=%d", MAX_SIZE, size));
        }
        if (email != null && email.isBlank()) {
            email = null;
        }
    }

    public static ReservationSearchCondition all() {
        return new ReservationSearchCondition(null, null, null, null, 0, DEFAULT_SIZE);
    }
}
