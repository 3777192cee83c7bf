package personal.bistro.booking.reservation.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.booking.reservation.application.port.in.GetReservationUseCase;
import personal.bistro.booking.reservation.application.port.out.ReservationRepository;
import personal.bistro.booking.reservation.domain.exception.ReservationNotFoundException;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationPage;
import personal.bistro.booking.reservation.domain.model.ReservationSearchCondition;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;

import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

/**
 * Reservation Query Service (SRP)
 * 단일 책임: 예약 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReservationQueryService implements GetReservationUseCase {

    private static final EnumSet<ReservationStatus> TODAY_STATUSES =
            EnumSet.of(ReservationStatus.CONFIRMED, ReservationStatus.SEATED);

    private final ReservationRepository reservationRepository;
    private final Clock clock;

    @Override
    public Reservation get(Long reservationId) {
        var reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> {
                    log.warn("Reservation not found: reservationId={}", reservationId);
                    return new ReservationNotFoundException(reservationId);
                });

        log.debug("Reservation retrieved: reservationId={}", reservationId);
        return reservation;
    }

    @Override
    public ReservationPage list(ReservationSearchCondition condition) {
        var page = reservationRepository.search(condition);
        log.debug("Reservations listed: status={}, date={}, seatingType={}, page={}, size={}, total={}",
                condition.status(), condition.date(), condition.seatingType(),
                condition.page(), condition.size(), page.total());
        return page;
    }

    @Override
    public List<Reservation> getTodayReservations() {
        return reservationRepository.findByDateAndStatusIn(LocalDate.now(clock), TODAY_STATUSES);
    }
}
