package personal.bistro.booking.waitlist.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.bistro.booking.waitlist.application.port.out.WaitlistRepository;
import personal.bistro.booking.waitlist.domain.model.WaitlistEntry;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Waitlist Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class WaitlistPersistenceAdapter implements WaitlistRepository {

    private final JpaWaitlistRepository jpaWaitlistRepository;

    @Override
    public WaitlistEntry save(WaitlistEntry entry) {
        return jpaWaitlistRepository.save(WaitlistEntryEntity.fromDomain(entry)).toDomain();
    }

    @Override
    public Optional<WaitlistEntry> findById(Long entryId) {
        return jpaWaitlistRepository.findById(entryId)
                .map(WaitlistEntryEntity::toDomain);
    }

    @Override
    public List<WaitlistEntry> findAllOrderByCreatedAt() {
        return jpaWaitlistRepository.findAllByOrderByCreatedAtAscIdAsc().stream()
                .map(WaitlistEntryEntity::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public void deleteById(Long entryId) {
        jpaWaitlistRepository.deleteById(entryId);
    }
}
