package personal.bistro.booking.reservation.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

public class InvalidPartySizeException extends BusinessException {
    public InvalidPartySizeException(int partySize, int maxPartySize) {
        super(ErrorCode.INVALID_PARTY_SIZE,
                String.format("Party size must be between 1 and %d: partySize=%d", maxPartySize, partySize));
    }
}
