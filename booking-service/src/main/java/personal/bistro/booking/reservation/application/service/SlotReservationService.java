package personal.bistro.booking.reservation.application.service;

import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import personal.bistro.booking.reservation.domain.exception.SlotContentionException;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.service.SlotReservationManager;

/**
 * Slot Reservation Service
 * 슬롯 트랜잭션을 트랜잭션 밖에서 재시도로 감싸는 서비스
 *
 * - Retry: ConcurrencyFailureException만 재시도 (잠금 대기 초과, 교착, 슬롯 락 최초 생성 경합
 *   SlotLockCreationRaceException). 매 시도는 새 트랜잭션
 * - 그 밖의 DataAccessException(예약 행 무결성 위반 등)은 재시도 없이 그대로 전파
 * - BusinessException(잔여 좌석 부족 등)은 재시도하지 않음 (resilience4j.retry.instances.slotReservation)
 * - 재시도 한도 초과 시 SlotContentionException (503)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotReservationService {

    private final SlotReservationManager slotReservationManager;

    @Retry(name = "slotReservation", fallbackMethod = "reserveFallback")
    public Reservation reserve(Reservation draft, int totalCapacity) {
        return slotReservationManager.reserveInTransaction(draft, totalCapacity);
    }

    private Reservation reserveFallback(Reservation draft, int totalCapacity, ConcurrencyFailureException e) {
        log.error("Slot reservation retries exhausted by lock conflict: slotKey={}, error={}",
                draft.slotKey().asString(), e.getClass().getSimpleName(), e);
        throw new SlotContentionException(draft.slotKey());
    }
}
