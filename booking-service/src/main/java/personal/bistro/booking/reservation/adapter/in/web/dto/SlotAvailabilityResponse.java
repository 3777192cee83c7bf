package personal.bistro.booking.reservation.adapter.in.web.dto;

import personal.bistro.booking.reservation.domain.model.AvailabilityResult;
import personal.bistro.booking.reservation.domain.model.SeatingType;

import java.time.LocalDate;

/**
 * 슬롯 잔여 좌석 응답 DTO
 */
public record SlotAvailabilityResponse(
        LocalDate date,
        String time,
        SeatingType seatingType,
        int totalCapacity,
        int bookedCount,
        int remainingCapacity,
        boolean available
) {
    public static SlotAvailabilityResponse of(LocalDate date, String time, SeatingType seatingType,
                                              AvailabilityResult result) {
        return new SlotAvailabilityResponse(date, time, seatingType, result.totalCapacity(),
                result.bookedCount(), result.remainingCapacity(), result.available());
    }
}
