package personal.bistro.booking.reservation.domain.model;

/**
 * 특정 슬롯의 잔여 좌석 계산 결과 (조회 시점 기준, 저장하지 않음)
 */
public record AvailabilityResult(
        int totalCapacity,
        int bookedCount,
        int remainingCapacity,
        boolean available) {

    /**
     * 전체 수용 인원과 점유 인원으로 계산
     * 초과 예약 데이터가 있어도 잔여 좌석은 0 미만으로 내려가지 않음
     */
    public static AvailabilityResult of(int totalCapacity, int bookedCount) {
        int remaining = Math.max(0, totalCapacity - bookedCount);
        return new AvailabilityResult(totalCapacity, bookedCount, remaining, remaining > 0);
    }

    public boolean canAccommodate(int partySize) {
        return remainingCapacity >= partySize;
    }
}
