package personal.bistro.booking.reservation.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import personal.bistro.booking.reservation.application.port.out.SlotLockRepository;
import personal.bistro.booking.reservation.domain.model.SlotKey;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDateTime;

/**
 * Slot Lock Persistence Adapter
 * 비관적 쓰기 잠금으로 슬롯 단위 예약 생성을 직렬화
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotLockPersistenceAdapter implements SlotLockRepository {

    private final JpaSlotLockRepository jpaSlotLockRepository;

    @Override
    public void acquire(SlotKey slotKey) {
        String key = slotKey.asString();
        if (jpaSlotLockRepository.findForUpdate(key).isPresent()) {
            return;
        }

        // 최초 사용: 트랜잭션의 첫 쓰기이므로 여기서의 무결성 위반은 slot_key PK 중복뿐
        log.debug("Creating slot lock row: slotKey={}", key);
        try {
            jpaSlotLockRepository.saveAndFlush(SlotLockEntity.open(key));
        } catch (DataIntegrityViolationException e) {
            log.debug("Slot lock row created by another request: slotKey={}", key);
            throw new SlotLockCreationRaceException(key, e);
        }
        jpaSlotLockRepository.findForUpdate(key);
    }

    @Override
    public void recordCommit(SlotKey slotKey, Long reservationId, LocalDateTime committedAt) {
        SlotLockEntity lock = jpaSlotLockRepository.findById(slotKey.asString())
                .orElseThrow(() -> new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR,
                        String.format("Slot lock not acquired: slotKey=%s", slotKey.asString())));
        lock.recordCommit(reservationId, committedAt);
    }
}
