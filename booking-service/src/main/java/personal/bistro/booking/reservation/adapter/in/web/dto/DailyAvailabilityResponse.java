package personal.bistro.booking.reservation.adapter.in.web.dto;

import personal.bistro.booking.reservation.domain.model.DailyAvailability;
import personal.bistro.booking.reservation.domain.model.TimeSlotAvailability;

import java.time.LocalDate;
import java.util.List;

/**
 * 일별 예약 가능 현황 응답 DTO
 */
public record DailyAvailabilityResponse(
        LocalDate date,
        List<TimeSlot> timeSlots,
        boolean isBlocked,
        String notes
) {
    public record TimeSlot(String time, int availableIndoor, int availableBalcony, boolean isAvailable) {

        static TimeSlot from(TimeSlotAvailability slot) {
            return new TimeSlot(slot.time(), slot.availableIndoor(), slot.availableBalcony(), slot.isAvailable());
        }
    }

    public static DailyAvailabilityResponse from(DailyAvailability daily) {
        return new DailyAvailabilityResponse(
                daily.date(),
                daily.timeSlots().stream().map(TimeSlot::from).toList(),
                daily.isBlocked(),
                daily.notes());
    }
}
