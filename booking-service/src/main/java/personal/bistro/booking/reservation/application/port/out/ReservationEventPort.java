package personal.bistro.booking.reservation.application.port.out;

import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationEventType;

/**
 * Reservation Event Port
 * 예약 변경 이벤트를 현재 트랜잭션의 Outbox에 기록
 */
public interface ReservationEventPort {

    void publishReservationEvent(Reservation reservation, ReservationEventType eventType);
}
