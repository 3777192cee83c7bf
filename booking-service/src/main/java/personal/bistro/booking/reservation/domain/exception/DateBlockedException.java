package personal.bistro.booking.reservation.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Date Blocked Exception
 * 관리자가 차단한 날짜에 예약을 시도할 때 발생
 */
public class DateBlockedException extends BusinessException {
    public DateBlockedException(LocalDate date, String reason) {
        super(ErrorCode.DATE_BLOCKED,
                String.format("Reservations are not accepted on %s: %s", date,
                        reason == null || reason.isBlank() ? "closed" : reason));
    }
}
