package personal.bistro.booking.reservation.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

/**
 * Spring Data JPA Repository for Blocked Date
 */
public interface JpaBlockedDateRepository extends JpaRepository<BlockedDateEntity, LocalDate> {

    List<BlockedDateEntity> findByBlockedDateGreaterThanEqualOrderByBlockedDateAsc(LocalDate from);

    List<BlockedDateEntity> findAllByOrderByBlockedDateAsc();
}
