package personal.bistro.booking.reservation.application.port.in;

import personal.bistro.booking.reservation.domain.model.DailyAvailability;
import personal.bistro.booking.reservation.domain.model.PartySlotOptions;

import java.time.LocalDate;

/**
 * Get Daily Availability UseCase (Input Port)
 * 하루 단위 예약 가능 현황 조회
 */
public interface GetDailyAvailabilityUseCase {

    /**
     * 차단된 날짜면 빈 시간대 목록과 차단 사유를 반환하고 좌석 계산은 하지 않음
     */
    DailyAvailability getDailyAvailability(LocalDate date);

    /**
     * 구역별로 partySize 이상 남은 시간대 목록
     * 차단된 날짜는 예외 없이 빈 목록
     */
    PartySlotOptions listAvailableSlotsForParty(LocalDate date, int partySize);

    boolean hasAnyAvailability(LocalDate date);
}
