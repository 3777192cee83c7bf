package personal.bistro.booking.reservation.application.port.in;

import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;

/**
 * Change Reservation Status UseCase (Input Port)
 * 상태 전이와 취소 정책
 */
public interface ChangeReservationStatusUseCase {

    /**
     * 상태 전이 테이블에 따라 상태 변경
     *
     * @param reason CANCELLED로 변경할 때 기록할 사유 (선택)
     * @throws personal.bistro.booking.reservation.domain.exception.ReservationNotFoundException 예약이 없을 때
     * @throws personal.bistro.booking.reservation.domain.exception.InvalidStatusTransitionException 허용되지 않는 전이
     */
    Reservation updateStatus(Long reservationId, ReservationStatus newStatus, String reason);

    /**
     * 예약 취소
     * 예약 시각까지 남은 시간이 취소 가능 기준(시간)보다 짧으면 거부
     *
     * @throws personal.bistro.booking.reservation.domain.exception.ReservationNotCancellableException 이미 취소됨, 완료, 노쇼
     * @throws personal.bistro.booking.reservation.domain.exception.CancellationWindowClosedException 취소 가능 시간 경과 (412)
     */
    Reservation cancel(Long reservationId, String reason);
}
