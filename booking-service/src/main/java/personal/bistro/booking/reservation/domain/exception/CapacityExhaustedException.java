package personal.bistro.booking.reservation.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * Capacity Exhausted Exception
 * 커밋 시점에 슬롯 잔여 좌석이 요청 인원보다 적을 때 발생 (자동 재시도 대상 아님)
 */
public class CapacityExhaustedException extends BusinessException {

    private final int remaining;

    public CapacityExhaustedException(int remaining) {
        super(ErrorCode.CAPACITY_EXHAUSTED,
                String.format("This time slot is fully booked. Only %d seats remaining.", Math.max(0, remaining)));
        this.remaining = Math.max(0, remaining);
    }

    public int getRemaining() {
        return remaining;
    }
}
