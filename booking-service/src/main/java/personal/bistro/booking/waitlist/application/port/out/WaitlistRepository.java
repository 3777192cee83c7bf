package personal.bistro.booking.waitlist.application.port.out;

import personal.bistro.booking.waitlist.domain.model.WaitlistEntry;

import java.util.List;
import java.util.Optional;

/**
 * Waitlist Repository (Output Port)
 */
public interface WaitlistRepository {

    WaitlistEntry save(WaitlistEntry entry);

    Optional<WaitlistEntry> findById(Long entryId);

    List<WaitlistEntry> findAllOrderByCreatedAt();

    void deleteById(Long entryId);
}
