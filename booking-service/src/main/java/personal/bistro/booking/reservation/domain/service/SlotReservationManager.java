package personal.bistro.booking.reservation.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.booking.reservation.application.port.out.ReservationEventPort;
import personal.bistro.booking.reservation.application.port.out.ReservationRepository;
import personal.bistro.booking.reservation.application.port.out.SlotLockRepository;
import personal.bistro.booking.reservation.domain.exception.CapacityExhaustedException;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationEventType;
import personal.bistro.booking.reservation.domain.model.SlotKey;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Slot Reservation Domain Service (Transaction Manager)
 * 슬롯 단위 좌석 확보를 하나의 트랜잭션으로 실행
 *
 * 1. 슬롯 락 레코드를 쓰기 잠금으로 조회 (직렬화 지점)
 * 2. 같은 트랜잭션 안에서 점유 인원 재계산
 * 3. 잔여 좌석 부족 시 쓰기 없이 CapacityExhaustedException
 * 4. 예약 저장 + 슬롯 락 갱신 + Outbox 기록 후 커밋
 *
 * 충돌 재시도는 호출자(SlotReservationService)가 트랜잭션 밖에서 수행
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotReservationManager {

    private final SlotLockRepository slotLockRepository;
    private final ReservationRepository reservationRepository;
    private final ReservationEventPort reservationEventPort;
    private final Clock clock;

    /**
     * @param draft         ID가 없는 CONFIRMED 예약
     * @param totalCapacity 해당 구역의 슬롯당 수용 인원
     * @return 저장된 예약
     * @throws CapacityExhaustedException 잔여 좌석 < 인원
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public Reservation reserveInTransaction(Reservation draft, int totalCapacity) {
        SlotKey slotKey = draft.slotKey();

        // 1. 직렬화 지점: 같은 슬롯의 다른 트랜잭션은 여기서 대기
        slotLockRepository.acquire(slotKey);

        // 2. 락 획득 이후 커밋된 예약까지 포함하여 재계산
        int bookedCount = reservationRepository.sumOccupyingPartySize(slotKey);
        int remaining = totalCapacity - bookedCount;

        if (remaining < draft.partySize()) {
            log.warn("Slot capacity exhausted: slotKey={}, capacity={}, booked={}, requested={}",
                    slotKey.asString(), totalCapacity, bookedCount, draft.partySize());
            throw new CapacityExhaustedException(remaining);
        }

        // 3. 예약 저장, 슬롯 락 갱신, Outbox 기록 (all-or-nothing)
        Reservation saved = reservationRepository.save(draft);
        slotLockRepository.recordCommit(slotKey, saved.id(), LocalDateTime.now(clock));
        reservationEventPort.publishReservationEvent(saved, ReservationEventType.RESERVATION_CREATED);

        log.info("Slot reserved: reservationId={}, slotKey={}, partySize={}, remainingAfter={}",
                saved.id(), slotKey.asString(), saved.partySize(), remaining - saved.partySize());

        return saved;
    }
}
