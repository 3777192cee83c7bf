package personal.bistro.booking.reservation.domain.model;

import java.util.Map;

/**
 * 관리자 대시보드 통계
 *
 * @param todayReservations    오늘 확정/착석 예약 수
 * @param todayGuests          오늘 확정/착석 예약의 총 인원
 * @param indoorCount          오늘 실내 예약 수
 * @param balconyCount         오늘 발코니 예약 수
 * @param statusBreakdown      오늘 예약의 상태별 건수 (전체 상태)
 * @param upcomingReservations 내일 이후 좌석 점유 예약 수
 */
public record DashboardStats(
        long todayReservations,
        long todayGuests,
        long indoorCount,
        long balconyCount,
        Map<ReservationStatus, Long> statusBreakdown,
        long upcomingReservations) {
}
