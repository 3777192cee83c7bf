package personal.bistro.booking.reservation.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 하루 전체 시간대의 예약 가능 현황
 * 차단된 날짜는 시간대 목록이 비어 있고 notes에 차단 사유가 담김
 */
public record DailyAvailability(
        LocalDate date,
        List<TimeSlotAvailability> timeSlots,
        boolean isBlocked,
        String notes) {

    public static DailyAvailability blocked(LocalDate date, String reason) {
        return new DailyAvailability(date, new ArrayList<>(), true, reason);
    }

    public static DailyAvailability open(LocalDate date, List<TimeSlotAvailability> timeSlots) {
        return new DailyAvailability(date, timeSlots, false, null);
    }

    public boolean hasAnyAvailability() {
        return !isBlocked && timeSlots.stream().anyMatch(TimeSlotAvailability::isAvailable);
    }
}
