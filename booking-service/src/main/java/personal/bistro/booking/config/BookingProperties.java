package personal.bistro.booking.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.time.ZoneId;
import java.util.List;

/**
 * Booking 설정 Properties
 * application.yml의 booking.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "booking")
public record BookingProperties(
        ZoneId zone,
        Defaults defaults,
        Availability availability,
        Cache cache
) {
    /**
     * DB에 저장된 설정이 없을 때 사용하는 기본 운영 설정
     */
    public record Defaults(
            int indoorCapacity,
            int balconyCapacity,
            List<String> timeSlots,
            int maxAdvanceBookingDays,
            int cancellationWindowHours,
            int maxPartySize
    ) {
        public RestaurantSettings toSettings() {
            return new RestaurantSettings(indoorCapacity, balconyCapacity, timeSlots,
                    maxAdvanceBookingDays, cancellationWindowHours, maxPartySize, false, false);
        }
    }

    public record Availability(
            int executorPoolSize  // 구역별 점유 인원 병렬 조회용
    ) {}

    public record Cache(
            long settingsTtlSeconds
    ) {}
}
