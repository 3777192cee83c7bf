package personal.bistro.booking.waitlist.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * Waitlist Entry Not Found Exception
 */
public class WaitlistEntryNotFoundException extends BusinessException {
    public WaitlistEntryNotFoundException(Long entryId) {
        super(ErrorCode.WAITLIST_ENTRY_NOT_FOUND,
                String.format("Waitlist entry not found: entryId=%d", entryId));
    }
}
