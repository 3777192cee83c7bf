package personal.bistro.booking.waitlist.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Spring Data JPA Repository for Waitlist
 */
public interface JpaWaitlistRepository extends JpaRepository<WaitlistEntryEntity, Long> {

    List<WaitlistEntryEntity> findAllByOrderByCreatedAtAscIdAsc();
}
