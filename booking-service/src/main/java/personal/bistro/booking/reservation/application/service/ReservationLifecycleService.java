package personal.bistro.booking.reservation.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.booking.reservation.application.port.in.ChangeReservationStatusUseCase;
import personal.bistro.booking.reservation.application.port.in.DeleteReservationUseCase;
import personal.bistro.booking.reservation.application.port.out.ReservationEventPort;
import personal.bistro.booking.reservation.application.port.out.ReservationRepository;
import personal.bistro.booking.reservation.domain.exception.CancellationWindowClosedException;
import personal.bistro.booking.reservation.domain.exception.ReservationNotCancellableException;
import personal.bistro.booking.reservation.domain.exception.ReservationNotFoundException;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationEventType;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.settings.application.port.in.SettingsProvider;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Reservation Lifecycle Service
 * 상태 전이, 취소 정책, 영구 삭제
 * 모든 변경은 Outbox 기록과 같은 트랜잭션에서 수행
 * 예약 행을 쓰기 잠금으로 읽으므로 같은 예약에 대한 변경은 순서대로 처리되고
 * 뒤에 온 요청은 앞선 요청이 커밋한 상태를 기준으로 전이 가능 여부를 판단
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationLifecycleService implements ChangeReservationStatusUseCase, DeleteReservationUseCase {

    private final ReservationRepository reservationRepository;
    private final ReservationEventPort reservationEventPort;
    private final SettingsProvider settingsProvider;
    private final DailyAvailabilityCacheService dailyAvailabilityCacheService;
    private final Clock clock;

    @Override
    @Transactional
    public Reservation updateStatus(Long reservationId, ReservationStatus newStatus, String reason) {
        Reservation reservation = findOrThrow(reservationId);
        return applyTransition(reservation, newStatus, reason);
    }

    @Override
    @Transactional
    public Reservation cancel(Long reservationId, String reason) {
        Reservation reservation = findOrThrow(reservationId);

        if (reservation.status() == ReservationStatus.CANCELLED) {
            log.warn("Reservation already cancelled: reservationId={}", reservationId);
            throw ReservationNotCancellableException.alreadyCancelled();
        }
        if (reservation.status() == ReservationStatus.COMPLETED
                || reservation.status() == ReservationStatus.NO_SHOW) {
            log.warn("Reservation not cancellable: reservationId={}, status={}",
                    reservationId, reservation.status().value());
            throw ReservationNotCancellableException.terminal(reservation.status());
        }

        int windowHours = settingsProvider.getCancellationWindowHours();
        double hoursUntil = reservation.hoursUntil(LocalDateTime.now(clock));
        if (hoursUntil < windowHours) {
            log.warn("Cancellation window closed: reservationId={}, windowHours={}, hoursUntil={}",
                    reservationId, windowHours, hoursUntil);
            throw new CancellationWindowClosedException(windowHours, hoursUntil);
        }

        return applyTransition(reservation, ReservationStatus.CANCELLED, reason);
    }

    @Override
    @Transactional
    public void delete(Long reservationId) {
        Reservation reservation = findOrThrow(reservationId);

        reservationRepository.deleteById(reservationId);
        reservationEventPort.publishReservationEvent(reservation, ReservationEventType.RESERVATION_DELETED);
        dailyAvailabilityCacheService.evict(reservation.date());

        log.info("Reservation deleted: reservationId={}, slotKey={}", reservationId, reservation.slotKey().asString());
    }

    private Reservation applyTransition(Reservation reservation, ReservationStatus newStatus, String reason) {
        ReservationStatus previous = reservation.status();
        Reservation updated = reservation.transitionTo(newStatus, reason, LocalDateTime.now(clock));
        Reservation saved = reservationRepository.save(updated);

        ReservationEventType eventType = newStatus == ReservationStatus.CANCELLED
                ? ReservationEventType.RESERVATION_CANCELLED
                : ReservationEventType.RESERVATION_STATUS_CHANGED;
        reservationEventPort.publishReservationEvent(saved, eventType);
        dailyAvailabilityCacheService.evict(saved.date());

        log.info("Reservation status changed: reservationId={}, from={}, to={}",
                saved.id(), previous.value(), newStatus.value());
        return saved;
    }

    private Reservation findOrThrow(Long reservationId) {
        return reservationRepository.findByIdForUpdate(reservationId)
                .orElseThrow(() -> {
                    log.warn("Reservation not found: reservationId={}", reservationId);
                    return new ReservationNotFoundException(reservationId);
                });
    }
}
