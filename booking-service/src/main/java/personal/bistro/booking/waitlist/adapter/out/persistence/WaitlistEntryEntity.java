package personal.bistro.booking.waitlist.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.waitlist.domain.model.NotificationPreference;
import personal.bistro.booking.waitlist.domain.model.WaitlistEntry;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Waitlist Entry JPA Entity
 */
@Entity
@Table(name = "waitlist_entries",
        indexes = @Index(name = "idx_waitlist_created", columnList = "created_at"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WaitlistEntryEntity {

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

    @Column(name = "requested_date", nullable = false)
    private LocalDate requestedDate;

    @Column(name = "requested_time", nullable = false, length = 5)
    private String requestedTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "seating_type", nullable = false, length = 20)
    private SeatingType seatingType;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_preference", nullable = false, length = 10)
    private NotificationPreference notificationPreference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static WaitlistEntryEntity fromDomain(WaitlistEntry entry) {
        WaitlistEntryEntity entity = new WaitlistEntryEntity();
        entity.id = entry.id();
        entity.guestName = entry.guestName();
        entity.email = entry.email();
        entity.phone = entry.phone();
        entity.partySize = entry.partySize();
        entity.requestedDate = entry.requestedDate();
        entity.requestedTime = entry.requestedTime();
        entity.seatingType = entry.seatingType();
        entity.notificationPreference = entry.notificationPreference();
        entity.createdAt = entry.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public WaitlistEntry toDomain() {
        return new WaitlistEntry(id, guestName, email, phone, partySize, requestedDate, requestedTime,
                seatingType, notificationPreference, createdAt);
    }
}
