package personal.bistro.booking.reservation.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bistro.booking.reservation.domain.model.BlockedDate;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Blocked Date JPA Entity
 */
@Entity
@Table(name = "blocked_dates")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BlockedDateEntity {

    @Id
    @Column(name = "blocked_date")
    private LocalDate blockedDate;

    @Column(length = 500)
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static BlockedDateEntity fromDomain(BlockedDate blockedDate) {
        BlockedDateEntity entity = new BlockedDateEntity();
        entity.blockedDate = blockedDate.date();
        entity.reason = blockedDate.reason();
        entity.createdAt = blockedDate.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public void changeReason(String reason) {
        this.reason = reason;
    }

    public BlockedDate toDomain() {
        return new BlockedDate(blockedDate, reason, createdAt);
    }
}
