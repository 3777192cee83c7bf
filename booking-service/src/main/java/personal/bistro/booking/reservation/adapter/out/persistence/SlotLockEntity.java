package personal.bistro.booking.reservation.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Slot Lock JPA Entity
 * 슬롯(날짜_시간_구역)당 한 행, 예약 생성 트랜잭션의 직렬화 지점
 * 커밋할 때마다 version이 증가
 */
@Entity
@Table(name = "slot_locks")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SlotLockEntity {

    @Id
    @Column(name = "slot_key", length = 40)
    private String slotKey;

    @Version
    private Long version;

    @Column(name = "last_reservation_id")
    private Long lastReservationId;

    @Column(name = "last_reservation_at")
    private LocalDateTime lastReservationAt;

    public static SlotLockEntity open(String slotKey) {
        SlotLockEntity entity = new SlotLockEntity();
        entity.slotKey = slotKey;
        return entity;
    }

    /**
     * 영속성 컨텍스트 내에서 사용 (dirty checking으로 version 증가)
     */
    public void recordCommit(Long reservationId, LocalDateTime committedAt) {
        this.lastReservationId = reservationId;
        this.lastReservationAt = committedAt;
    }
}
