package personal.bistro.booking.settings.adapter.in.web.dto;

import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.util.List;

/**
 * 운영 설정 조회 응답 DTO
 */
public record SettingsResponse(
        Capacities capacities,
        List<String> timeSlots,
        int maxAdvanceBookingDays,
        int cancellationWindowHours,
        int maxPartySize,
        boolean emailNotifications,
        boolean smsNotifications
) {
    public record Capacities(int indoor, int balcony) {}

    public static SettingsResponse from(RestaurantSettings settings) {
        return new SettingsResponse(
                new Capacities(settings.indoorCapacity(), settings.balconyCapacity()),
                settings.timeSlots(),
                settings.maxAdvanceBookingDays(),
                settings.cancellationWindowHours(),
                settings.maxPartySize(),
                settings.emailNotifications(),
                settings.smsNotifications());
    }
}
