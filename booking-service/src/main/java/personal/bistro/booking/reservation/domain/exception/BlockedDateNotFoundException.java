package personal.bistro.booking.reservation.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;

public class BlockedDateNotFoundException extends BusinessException {
    public BlockedDateNotFoundException(LocalDate date) {
        super(ErrorCode.BLOCKED_DATE_NOT_FOUND,
                String.format("Date is not blocked: date=%s", date));
    }
}
