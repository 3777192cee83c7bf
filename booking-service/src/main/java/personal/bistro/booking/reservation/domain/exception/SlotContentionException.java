package personal.bistro.booking.reservation.domain.exception;

import personal.bistro.booking.reservation.domain.model.SlotKey;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * Slot Contention Exception
 * 같은 슬롯에 대한 동시 커밋 충돌이 재시도 한도를 넘었을 때 발생
 * 예약은 생성되지 않았으므로 호출자가 처음부터 다시 요청해도 안전
 */
public class SlotContentionException extends BusinessException {
    public SlotContentionException(SlotKey slotKey) {
        super(ErrorCode.SLOT_CONTENTION,
                String.format("Too many concurrent reservations for slot: slotKey=%s", slotKey.asString()));
    }
}
