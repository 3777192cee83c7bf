package personal.bistro.booking.reservation.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.bistro.booking.reservation.application.port.out.ReservationRepository;
import personal.bistro.booking.reservation.domain.exception.ReservationUpdateConflictException;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationPage;
import personal.bistro.booking.reservation.domain.model.ReservationSearchCondition;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.reservation.domain.model.SlotKey;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reservation Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationPersistenceAdapter implements ReservationRepository {

    private static final Sort LIST_ORDER = Sort.by(
            Sort.Order.desc("reservationDate"),
            Sort.Order.desc("reservationTime"),
            Sort.Order.desc("id"));

    private final JpaReservationRepository jpaReservationRepository;

    @Override
    public Reservation save(Reservation reservation) {
        log.debug("Saving reservation: reservationId={}, status={}, version={}",
                reservation.id(), reservation.status(), reservation.version());
        if (reservation.id() == null) {
            return jpaReservationRepository.save(ReservationEntity.fromDomain(reservation)).toDomain();
        }
        try {
            return jpaReservationRepository.saveAndFlush(ReservationEntity.fromDomain(reservation)).toDomain();
        } catch (OptimisticLockingFailureException e) {
            log.warn("Reservation changed since it was read: reservationId={}, readVersion={}",
                    reservation.id(), reservation.version());
            throw new ReservationUpdateConflictException(reservation.id());
        }
    }

    @Override
    public Optional<Reservation> findById(Long reservationId) {
        log.debug("Finding reservation: reservationId={}", reservationId);
        return jpaReservationRepository.findById(reservationId)
                .map(ReservationEntity::toDomain);
    }

    @Override
    public Optional<Reservation> findByIdForUpdate(Long reservationId) {
        return jpaReservationRepository.findForUpdate(reservationId)
                .map(ReservationEntity::toDomain);
    }

    @Override
    public void deleteById(Long reservationId) {
        jpaReservationRepository.deleteById(reservationId);
    }

    @Override
    public int sumOccupyingPartySize(SlotKey slotKey) {
        return (int) jpaReservationRepository.sumPartySize(
                slotKey.date(), slotKey.time(), slotKey.seatingType(), ReservationStatus.OCCUPYING);
    }

    @Override
    public Map<String, Integer> sumOccupyingPartySizeByTime(LocalDate date, SeatingType seatingType) {
        List<Object[]> rows = jpaReservationRepository.sumPartySizeGroupByTime(
                date, seatingType, ReservationStatus.OCCUPYING);

        Map<String, Integer> bookedByTime = new HashMap<>();
        for (Object[] row : rows) {
            bookedByTime.put((String) row[0], ((Number) row[1]).intValue());
        }
        return bookedByTime;
    }

    @Override
    public ReservationPage search(ReservationSearchCondition condition) {
        Page<ReservationEntity> page = jpaReservationRepository.findAll(
                ReservationSpecifications.matching(condition),
                PageRequest.of(condition.page(), condition.size(), LIST_ORDER));

        List<Reservation> reservations = page.getContent().stream()
                .map(ReservationEntity::toDomain)
                .collect(Collectors.toList());
        return new ReservationPage(reservations, page.getTotalElements());
    }

    @Override
    public List<Reservation> findByDateAndStatusIn(LocalDate date, Collection<ReservationStatus> statuses) {
        return jpaReservationRepository.findByReservationDateAndStatusInOrderByReservationTimeAsc(date, statuses)
                .stream()
                .map(ReservationEntity::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public List<Reservation> findByDate(LocalDate date) {
        return jpaReservationRepository.findByReservationDate(date).stream()
                .map(ReservationEntity::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public long countByDateAfterAndStatusIn(LocalDate date, Collection<ReservationStatus> statuses) {
        return jpaReservationRepository.countByReservationDateAfterAndStatusIn(date, statuses);
    }
}
