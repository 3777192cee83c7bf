package personal.bistro.booking.settings.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.util.List;

/**
 * 운영 설정 변경 요청 DTO
 */
public record SettingsRequest(
        @Valid
        @NotNull(message = "구역별 수용 인원은 필수입니다.")
        Capacities capacities,

        @NotEmpty(message = "시간대는 하나 이상 필요합니다.")
        List<String> timeSlots,

        @Min(value = 0, message = "예약 가능 일수는 0 이상이어야 합니다.")
        int maxAdvanceBookingDays,

        @Min(value = 0, message = "취소 가능 시간은 0 이상이어야 합니다.")
        int cancellationWindowHours,

        @Min(value = 1, message = "최대 인원은 1 이상이어야 합니다.")
        int maxPartySize,

        boolean emailNotifications,
        boolean smsNotifications
) {
    public record Capacities(
            @Min(value = 0, message = "실내 수용 인원은 0 이상이어야 합니다.") int indoor,
            @Min(value = 0, message = "발코니 수용 인원은 0 이상이어야 합니다.") int balcony
    ) {}

    public RestaurantSettings toDomain() {
        return new RestaurantSettings(capacities.indoor(), capacities.balcony(), timeSlots,
                maxAdvanceBookingDays, cancellationWindowHours, maxPartySize,
                emailNotifications, smsNotifications);
    }
}
