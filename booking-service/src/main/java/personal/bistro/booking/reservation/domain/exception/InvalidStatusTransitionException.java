package personal.bistro.booking.reservation.domain.exception;

import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * Invalid Status Transition Exception
 * 상태 전이 테이블에 없는 전이를 시도할 때 발생
 */
public class InvalidStatusTransitionException extends BusinessException {
    public InvalidStatusTransitionException(ReservationStatus from, ReservationStatus to) {
        super(ErrorCode.INVALID_STATUS_TRANSITION,
                String.format("Cannot transition from %s to %s", from.value(), to.value()));
    }
}
