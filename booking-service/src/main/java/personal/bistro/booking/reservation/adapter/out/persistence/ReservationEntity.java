package personal.bistro.booking.reservation.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.reservation.domain.model.SeatingType;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Reservation JPA Entity
 * 예약 테이블 매핑
 */
@Entity
@Table(name = "reservations",
        indexes = {
                @Index(name = "idx_slot_status",
                        columnList = "reservation_date, reservation_time, seating_type, status"),
                @Index(name = "idx_email", columnList = "email")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "guest_name", nullable = false, length = 100)
    private String guestName;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(length = 30)
    private String phone;

    @Column(name = "party_size", nullable = false)
    private int partySize;

    @Column(name = "reservation_date", nullable = false)
    private LocalDate reservationDate;

    @Column(name = "reservation_time", nullable = false, length = 5)
    private String reservationTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "seating_type", nullable = false, length = 20)
    private SeatingType seatingType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "special_requests", length = 1000)
    private String specialRequests;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Version
    private Long version;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static ReservationEntity fromDomain(Reservation reservation) {
        ReservationEntity entity = new ReservationEntity();
        entity.id = reservation.id();
        entity.guestName = reservation.guestName();
        entity.email = reservation.email();
        entity.phone = reservation.phone();
        entity.partySize = reservation.partySize();
        entity.reservationDate = reservation.date();
        entity.reservationTime = reservation.time();
        entity.seatingType = reservation.seatingType();
        entity.status = reservation.status();
        entity.specialRequests = reservation.specialRequests();
        entity.createdAt = reservation.createdAt();
        entity.updatedAt = reservation.updatedAt();
        entity.cancelledAt = reservation.cancelledAt();
        entity.cancellationReason = reservation.cancellationReason();
        entity.version = reservation.version();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Reservation toDomain() {
        return new Reservation(id, guestName, email, phone, partySize, reservationDate, reservationTime,
                seatingType, status, specialRequests, createdAt, updatedAt, cancelledAt, cancellationReason,
                version);
    }
}
