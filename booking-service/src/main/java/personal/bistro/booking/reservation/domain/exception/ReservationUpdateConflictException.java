package personal.bistro.booking.reservation.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * 읽은 뒤 다른 트랜잭션이 먼저 커밋한 예약을 덮어쓰려 할 때 발생 (409)
 */
public class ReservationUpdateConflictException extends BusinessException {
    public ReservationUpdateConflictException(Long reservationId) {
        super(ErrorCode.RESERVATION_UPDATE_CONFLICT,
                String.format("Reservation was modified by another request: reservationId=%d", reservationId));
    }
}
