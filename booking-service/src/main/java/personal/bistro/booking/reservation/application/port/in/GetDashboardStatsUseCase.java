package personal.bistro.booking.reservation.application.port.in;

import personal.bistro.booking.reservation.domain.model.DashboardStats;

/**
 * Get Dashboard Stats UseCase (Input Port)
 */
public interface GetDashboardStatsUseCase {

    DashboardStats getStats();
}
