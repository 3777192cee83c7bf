package personal.bistro.booking.reservation.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.reservation.domain.model.SeatingType;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Reservation
 */
public interface JpaReservationRepository extends JpaRepository<ReservationEntity, Long>,
        JpaSpecificationExecutor<ReservationEntity> {

    /**
     * SELECT ... FOR UPDATE
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ReservationEntity r WHERE r.id = :id")
    Optional<ReservationEntity> findForUpdate(@Param("id") Long id);

    /**
     * 슬롯의 점유 인원 합계 (예약이 없으면 0)
     */
    @Query("SELECT COALESCE(SUM(r.partySize), 0) FROM ReservationEntity r "
            + "WHERE r.reservationDate = :date AND r.reservationTime = :time "
            + "AND r.seatingType = :seatingType AND r.status IN :statuses")
    long sumPartySize(@Param("date") LocalDate date,
                      @Param("time") String time,
                      @Param("seatingType") SeatingType seatingType,
                      @Param("statuses") Collection<ReservationStatus> statuses);

    /**
     * 시간대별 점유 인원 합계 [reservationTime, sum]
     */
    @Query("SELECT r.reservationTime, SUM(r.partySize) FROM ReservationEntity r "
            + "WHERE r.reservationDate = :date AND r.seatingType = :seatingType AND r.status IN :statuses "
            + "GROUP BY r.reservationTime")
    List<Object[]> sumPartySizeGroupByTime(@Param("date") LocalDate date,
                                           @Param("seatingType") SeatingType seatingType,
                                           @Param("statuses") Collection<ReservationStatus> statuses);

    List<ReservationEntity> findByReservationDateAndStatusInOrderByReservationTimeAsc(
            LocalDate reservationDate, Collection<ReservationStatus> statuses);

    List<ReservationEntity> findByReservationDate(LocalDate reservationDate);

    long countByReservationDateAfterAndStatusIn(LocalDate reservationDate, Collection<ReservationStatus> statuses);
}
