package personal.bistro.booking.reservation.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Spring Data JPA Repository for SlotLock
 */
public interface JpaSlotLockRepository extends JpaRepository<SlotLockEntity, String> {

    /**
     * SELECT ... FOR UPDATE
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SlotLockEntity s WHERE s.slotKey = :slotKey")
    Optional<SlotLockEntity> findForUpdate(@Param("slotKey") String slotKey);
}
