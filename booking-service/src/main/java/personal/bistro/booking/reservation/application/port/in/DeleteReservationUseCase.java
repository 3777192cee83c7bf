package personal.bistro.booking.reservation.application.port.in;

/**
 * Delete Reservation UseCase (Input Port)
 * 관리자용 영구 삭제
 */
public interface DeleteReservationUseCase {

    /**
     * @throws personal.bistro.booking.reservation.domain.exception.ReservationNotFoundException 예약이 없을 때
     */
    void delete(Long reservationId);
}
