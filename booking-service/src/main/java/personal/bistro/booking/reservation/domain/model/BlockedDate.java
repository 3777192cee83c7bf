package personal.bistro.booking.reservation.domain.model;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Blocked Date
 * 관리자가 예약을 막아 둔 날짜 (전체 휴무, 대관 등)
 */
public record BlockedDate(LocalDate date, String reason, LocalDateTime createdAt) {

    public BlockedDate {
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Blocked date cannot be null");
        }
    }

    public static BlockedDate of(LocalDate date, String reason, LocalDateTime now) {
        return new BlockedDate(date, reason, now);
    }
}
