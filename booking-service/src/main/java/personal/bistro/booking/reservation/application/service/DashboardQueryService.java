package personal.bistro.booking.reservation.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.booking.reservation.application.port.in.GetDashboardStatsUseCase;
import personal.bistro.booking.reservation.application.port.out.ReservationRepository;
import personal.bistro.booking.reservation.domain.model.DashboardStats;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.reservation.domain.model.SeatingType;

import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Dashboard Query Service
 * 오늘 기준 예약 집계 (서비스 시간대 기준)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DashboardQueryService implements GetDashboardStatsUseCase {

    private static final EnumSet<ReservationStatus> ACTIVE_TODAY =
            EnumSet.of(ReservationStatus.CONFIRMED, ReservationStatus.SEATED);

    private final ReservationRepository reservationRepository;
    private final Clock clock;

    @Override
    public DashboardStats getStats() {
        LocalDate today = LocalDate.now(clock);
        List<Reservation> todays = reservationRepository.findByDate(today);

        Map<ReservationStatus, Long> statusBreakdown = new EnumMap<>(ReservationStatus.class);
        for (ReservationStatus status : ReservationStatus.values()) {
            statusBreakdown.put(status, 0L);
        }

        long todayReservations = 0;
        long todayGuests = 0;
        long indoorCount = 0;
        long balconyCount = 0;

        for (Reservation reservation : todays) {
            statusBreakdown.merge(reservation.status(), 1L, Long::sum);

            if (!ACTIVE_TODAY.contains(reservation.status())) {
                continue;
            }
            todayReservations++;
            todayGuests += reservation.partySize();
            if (reservation.seatingType() == SeatingType.INDOOR) {
                indoorCount++;
            } else {
                balconyCount++;
            }
        }

        long upcoming = reservationRepository.countByDateAfterAndStatusIn(today, ReservationStatus.OCCUPYING);

        log.debug("Dashboard stats computed: date={}, todayReservations={}, todayGuests={}, upcoming={}",
                today, todayReservations, todayGuests, upcoming);

        return new DashboardStats(todayReservations, todayGuests, indoorCount, balconyCount,
                statusBreakdown, upcoming);
    }
}
