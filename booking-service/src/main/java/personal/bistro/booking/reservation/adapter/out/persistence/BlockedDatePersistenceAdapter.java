package personal.bistro.booking.reservation.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bistro.booking.reservation.application.port.out.BlockedDateRepository;
import personal.bistro.booking.reservation.domain.model.BlockedDate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Blocked Date Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlockedDatePersistenceAdapter implements BlockedDateRepository {

    private final JpaBlockedDateRepository jpaBlockedDateRepository;

    @Override
    public Optional<BlockedDate> findByDate(LocalDate date) {
        return jpaBlockedDateRepository.findById(date)
                .map(BlockedDateEntity::toDomain);
    }

    @Override
    public BlockedDate save(BlockedDate blockedDate) {
        return jpaBlockedDateRepository.findById(blockedDate.date())
                .map(existing -> {
                    log.debug("Updating blocked date reason: date={}", blockedDate.date());
                    existing.changeReason(blockedDate.reason());
                    return existing.toDomain();
                })
                .orElseGet(() -> jpaBlockedDateRepository.save(BlockedDateEntity.fromDomain(blockedDate)).toDomain());
    }

    @Override
    public void deleteByDate(LocalDate date) {
        jpaBlockedDateRepository.deleteById(date);
    }

    @Override
    public List<BlockedDate> findAllFrom(LocalDate from) {
        List<BlockedDateEntity> entities = from == null
                ? jpaBlockedDateRepository.findAllByOrderByBlockedDateAsc()
                : jpaBlockedDateRepository.findByBlockedDateGreaterThanEqualOrderByBlockedDateAsc(from);
        return entities.stream()
                .map(BlockedDateEntity::toDomain)
                .collect(Collectors.toList());
    }
}
