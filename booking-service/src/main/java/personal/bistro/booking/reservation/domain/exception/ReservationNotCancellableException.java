package personal.bistro.booking.reservation.domain.exception;

import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * Reservation Not Cancellable Exception
 * 이미 취소되었거나 종료 상태(완료, 노쇼)인 예약을 취소하려 할 때 발생
 */
public class ReservationNotCancellableException extends BusinessException {

    private ReservationNotCancellableException(String message) {
        super(ErrorCode.RESERVATION_NOT_CANCELLABLE, message);
    }

    public static ReservationNotCancellableException alreadyCancelled() {
        return new ReservationNotCancellableException("Reservation is already cancelled");
    }

    public static ReservationNotCancellableException terminal(ReservationStatus status) {
        return new ReservationNotCancellableException(
                String.format("Cannot cancel a reservation with status: %s", status.value()));
    }
}
