package personal.bistro.booking.reservation.domain.model;

/**
 * 시간대별 구역 잔여 좌석
 */
public record TimeSlotAvailability(
        String time,
        int availableIndoor,
        int availableBalcony,
        boolean isAvailable) {

    public static TimeSlotAvailability of(String time, int availableIndoor, int availableBalcony) {
        return new TimeSlotAvailability(time, availableIndoor, availableBalcony,
                availableIndoor > 0 || availableBalcony > 0);
    }

    public int availableFor(SeatingType seatingType) {
        return seatingType == SeatingType.INDOOR ? availableIndoor : availableBalcony;
    }
}
