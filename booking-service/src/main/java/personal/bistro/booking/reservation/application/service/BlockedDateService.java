package personal.bistro.booking.reservation.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.booking.reservation.application.port.in.ManageBlockedDatesUseCase;
import personal.bistro.booking.reservation.application.port.out.BlockedDateRepository;
import personal.bistro.booking.reservation.domain.exception.BlockedDateNotFoundException;
import personal.bistro.booking.reservation.domain.model.BlockedDate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Blocked Date Service
 * 차단 날짜 관리, 변경 시 해당 날짜의 잔여 좌석 캐시 무효화
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BlockedDateService implements ManageBlockedDatesUseCase {

    private final BlockedDateRepository blockedDateRepository;
    private final DailyAvailabilityCacheService dailyAvailabilityCacheService;
    private final Clock clock;

    @Override
    @Transactional
    public BlockedDate block(LocalDate date, String reason) {
        BlockedDate saved = blockedDateRepository.save(BlockedDate.of(date, reason, LocalDateTime.now(clock)));
        dailyAvailabilityCacheService.evict(date);

        log.info("Date blocked: date={}, reason={}", date, reason);
        return saved;
    }

    @Override
    @Transactional
    public void unblock(LocalDate date) {
        if (blockedDateRepository.findByDate(date).isEmpty()) {
            log.warn("Blocked date not found: date={}", date);
            throw new BlockedDateNotFoundException(date);
        }
        blockedDateRepository.deleteByDate(date);
        dailyAvailabilityCacheService.evict(date);

        log.info("Date unblocked: date={}", date);
    }

    @Override
    public Optional<BlockedDate> find(LocalDate date) {
        return blockedDateRepository.findByDate(date);
    }

    @Override
    public List<BlockedDate> list(LocalDate from) {
        return blockedDateRepository.findAllFrom(from);
    }
}
