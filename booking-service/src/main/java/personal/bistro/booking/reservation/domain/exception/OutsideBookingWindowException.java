package personal.bistro.booking.reservation.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;

public class OutsideBookingWindowException extends BusinessException {
    public OutsideBookingWindowException(LocalDate date, int maxAdvanceBookingDays) {
        super(ErrorCode.OUTSIDE_BOOKING_WINDOW,
                String.format("Date is outside the allowed booking window: date=%s, maxAdvanceBookingDays=%d",
                        date, maxAdvanceBookingDays));
    }
}
