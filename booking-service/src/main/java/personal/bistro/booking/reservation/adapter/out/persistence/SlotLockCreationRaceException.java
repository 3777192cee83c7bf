package personal.bistro.booking.reservation.adapter.out.persistence;

import org.springframework.dao.ConcurrencyFailureException;

/**
 * 같은 슬롯의 첫 예약 두 건이 잠금 행을 동시에 만들다 PK가 충돌한 경우
 * 다음 시도에서는 이미 생긴 행을 잠그므로 재시도 대상(ConcurrencyFailureException)으로 분류
 */
public class SlotLockCreationRaceException extends ConcurrencyFailureException {
    public SlotLockCreationRaceException(String slotKey, Throwable cause) {
        super(String.format("Slot lock row created concurrently: slotKey=%s", slotKey), cause);
    }
}
