package personal.bistro.booking.reservation.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

public class InvalidTimeSlotException extends BusinessException {
    public InvalidTimeSlotException(String time) {
        super(ErrorCode.INVALID_TIME_SLOT,
                String.format("Time slot is not offered: time=%s", time));
    }
}
