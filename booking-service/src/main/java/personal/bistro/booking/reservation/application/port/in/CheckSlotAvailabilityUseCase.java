package personal.bistro.booking.reservation.application.port.in;

import personal.bistro.booking.reservation.domain.model.AvailabilityResult;
import personal.bistro.booking.reservation.domain.model.SeatingType;

import java.time.LocalDate;

/**
 * Check Slot Availability UseCase (Input Port)
 * 단일 슬롯의 잔여 좌석 조회 (읽기 전용, 부수 효과 없음)
 */
public interface CheckSlotAvailabilityUseCase {

    /**
     * 슬롯 잔여 좌석 계산
     *
     * @throws personal.bistro.booking.reservation.domain.exception.InvalidTimeSlotException 운영하지 않는 시간대
     */
    AvailabilityResult computeSlotAvailability(LocalDate date, String time, SeatingType seatingType);

    /**
     * 잔여 좌석 >= partySize 여부
     */
    boolean canAccommodate(LocalDate date, String time, SeatingType seatingType, int partySize);
}
