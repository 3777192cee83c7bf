package personal.bistro.booking.reservation.application.port.out;

import personal.bistro.booking.reservation.domain.model.SlotKey;

import java.time.LocalDateTime;

/**
 * Slot Lock Repository (Output Port)
 * 슬롯별 직렬화 레코드 저장소
 * 반드시 예약 생성 트랜잭션 안에서 호출되어야 함
 */
public interface SlotLockRepository {

    /**
     * 슬롯 락 레코드를 쓰기 잠금으로 조회 (없으면 생성)
     * 같은 슬롯을 노리는 다른 트랜잭션은 커밋될 때까지 대기하거나 충돌로 실패
     *
     * @throws org.springframework.dao.ConcurrencyFailureException 잠금 대기 시간 초과, 교착 상태
     * @throws org.springframework.dao.ConcurrencyFailureException 잠금 대기 초과 또는 최초 생성 경합
     */
    void acquire(SlotKey slotKey);

    /**
     * 마지막으로 커밋한 예약 정보 기록 (버전 증가)
     */
    void recordCommit(SlotKey slotKey, Long reservationId, LocalDateTime committedAt);
}
