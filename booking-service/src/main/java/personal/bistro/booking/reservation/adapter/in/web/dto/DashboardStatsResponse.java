package personal.bistro.booking.reservation.adapter.in.web.dto;

import personal.bistro.booking.reservation.domain.model.DashboardStats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 대시보드 통계 응답 DTO
 * statusBreakdown 키는 "confirmed", "no-show" 같은 API 표기
 */
public record DashboardStatsResponse(
        long todayReservations,
        long todayGuests,
        long indoorCount,
        long balconyCount,
        Map<String, Long> statusBreakdown,
        long upcomingReservations
) {
    public static DashboardStatsResponse from(DashboardStats stats) {
        Map<String, Long> breakdown = new LinkedHashMap<>();
        stats.statusBreakdown().forEach((status, count) -> breakdown.put(status.value(), count));

        return new DashboardStatsResponse(
                stats.todayReservations(),
                stats.todayGuests(),
                stats.indoorCount(),
                stats.balconyCount(),
                breakdown,
                stats.upcomingReservations());
    }
}
