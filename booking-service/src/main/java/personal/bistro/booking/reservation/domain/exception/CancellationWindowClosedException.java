package personal.bistro.booking.reservation.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * Cancellation Window Closed Exception
 * 예약 시각까지 남은 시간이 취소 가능 기준보다 짧을 때 발생
 */
public class CancellationWindowClosedException extends BusinessException {
    public CancellationWindowClosedException(int requiredHours, double hoursUntil) {
        super(ErrorCode.CANCELLATION_WINDOW_CLOSED,
                String.format("Reservations must be cancelled at least %d hours in advance. "
                        + "This reservation is in %d hours.", requiredHours, (long) Math.floor(hoursUntil)));
    }
}
