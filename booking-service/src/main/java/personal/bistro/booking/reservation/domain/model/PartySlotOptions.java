package personal.bistro.booking.reservation.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 인원수 기준으로 예약 가능한 구역별 시간대 목록
 */
public record PartySlotOptions(List<String> indoor, List<String> balcony) {

    public static PartySlotOptions none() {
        return new PartySlotOptions(new ArrayList<>(), new ArrayList<>());
    }

    public static PartySlotOptions from(DailyAvailability daily, int partySize) {
        if (daily.isBlocked()) {
            return none();
        }
        return new PartySlotOptions(
                timesFor(daily, SeatingType.INDOOR, partySize),
                timesFor(daily, SeatingType.BALCONY, partySize));
    }

    private static List<String> timesFor(DailyAvailability daily, SeatingType seatingType, int partySize) {
        return daily.timeSlots().stream()
                .filter(slot -> slot.availableFor(seatingType) >= partySize)
                .map(TimeSlotAvailability::time)
                .collect(Collectors.toList());
    }
}
