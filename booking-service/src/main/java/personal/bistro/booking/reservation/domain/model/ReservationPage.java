package personal.bistro.booking.reservation.domain.model;

import java.util.List;

/**
 * 예약 목록 조회 결과 (현재 페이지 + 전체 건수)
 */
public record ReservationPage(List<Reservation> reservations, long total) {
}
