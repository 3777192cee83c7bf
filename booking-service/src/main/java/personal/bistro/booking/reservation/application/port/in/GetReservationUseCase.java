package personal.bistro.booking.reservation.application.port.in;

import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationPage;
import personal.bistro.booking.reservation.domain.model.ReservationSearchCondition;

import java.util.List;

/**
 * Get Reservation UseCase (Input Port)
 * 예약 단건/목록 조회
 */
public interface GetReservationUseCase {

    /**
     * @throws personal.bistro.booking.reservation.domain.exception.ReservationNotFoundException 예약이 없을 때
     */
    Reservation get(Long reservationId);

    ReservationPage list(ReservationSearchCondition condition);

    /**
     * 오늘의 CONFIRMED, SEATED 예약 (시간 오름차순)
     */
    List<Reservation> getTodayReservations();
}
