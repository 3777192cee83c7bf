package personal.bistro.booking.settings.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Restaurant Settings JPA Entity
 * 항상 id=1인 단일 행
 */
@Entity
@Table(name = "restaurant_settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SettingsEntity {

    public static final Long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "indoor_capacity", nullable = false)
    private int indoorCapacity;

    @Column(name = "balcony_capacity", nullable = false)
    private int balconyCapacity;

    @Convert(converter = TimeSlotListConverter.class)
    @Column(name = "time_slots", nullable = false, length = 1000)
    private List<String> timeSlots;

    @Column(name = "max_advance_booking_days", nullable = false)
    private int maxAdvanceBookingDays;

    @Column(name = "cancellation_window_hours", nullable = false)
    private int cancellationWindowHours;

    @Column(name = "max_party_size", nullable = false)
    private int maxPartySize;

    @Column(name = "email_notifications", nullable = false)
    private boolean emailNotifications;

    @Column(name = "sms_notifications", nullable = false)
    private boolean smsNotifications;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static SettingsEntity fromDomain(RestaurantSettings settings) {
        SettingsEntity entity = new SettingsEntity();
        entity.id = SINGLETON_ID;
        entity.indoorCapacity = settings.indoorCapacity();
        entity.balconyCapacity = settings.balconyCapacity();
        entity.timeSlots = settings.timeSlots();
        entity.maxAdvanceBookingDays = settings.maxAdvanceBookingDays();
        entity.cancellationWindowHours = settings.cancellationWindowHours();
        entity.maxPartySize = settings.maxPartySize();
        entity.emailNotifications = settings.emailNotifications();
        entity.smsNotifications = settings.smsNotifications();
        return entity;
    }

    @PrePersist
    @PreUpdate
    protected void onSave() {
        updatedAt = LocalDateTime.now();
    }

    public RestaurantSettings toDomain() {
        return new RestaurantSettings(indoorCapacity, balconyCapacity, timeSlots, maxAdvanceBookingDays,
                cancellationWindowHours, maxPartySize, emailNotifications, smsNotifications);
    }
}
