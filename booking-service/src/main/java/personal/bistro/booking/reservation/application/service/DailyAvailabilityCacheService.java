package personal.bistro.booking.reservation.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import personal.bistro.booking.reservation.application.port.out.BlockedDateRepository;
import personal.bistro.booking.reservation.application.port.out.ReservationRepository;
import personal.bistro.booking.reservation.domain.model.BlockedDate;
import personal.bistro.booking.reservation.domain.model.DailyAvailability;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.reservation.domain.model.TimeSlotAvailability;
import personal.bistro.booking.settings.application.port.in.SettingsProvider;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Daily Availability Cache Service
 *
 * Spring AOP 프록시를 위해 별도 컴포넌트로 분리 (Self-invocation 방지)
 *
 * 캐시 전략:
 * - 조회: @Cacheable, 짧은 TTL (spring.cache.redis.time-to-live)
 * - 무효화: 예약 생성/상태 변경/삭제, 차단 날짜 변경 시 해당 날짜만 @CacheEvict
 * 캐시된 값이 잠시 오래되어도 생성 시점에 트랜잭션 안에서 다시 검증됨
 */
@Slf4j
@Service
public class DailyAvailabilityCacheService {

    private final ReservationRepository reservationRepository;
    private final BlockedDateRepository blockedDateRepository;
    private final SettingsProvider settingsProvider;
    private final Executor availabilityExecutor;

    public DailyAvailabilityCacheService(ReservationRepository reservationRepository,
                                         BlockedDateRepository blockedDateRepository,
                                         SettingsProvider settingsProvider,
                                         @Qualifier("availabilityExecutor") Executor availabilityExecutor) {
        this.reservationRepository = reservationRepository;
        this.blockedDateRepository = blockedDateRepository;
        this.settingsProvider = settingsProvider;
        this.availabilityExecutor = availabilityExecutor;
    }

    @Cacheable(value = "dailyAvailability", key = "#date.toString()")
    public DailyAvailability load(LocalDate date) {
        log.info("Cache MISS - Loading daily availability: date={}", date);

        Optional<BlockedDate> blocked = blockedDateRepository.findByDate(date);
        if (blocked.isPresent()) {
            log.debug("Date is blocked: date={}, reason={}", date, blocked.get().reason());
            return DailyAvailability.blocked(date, blocked.get().reason());
        }

        RestaurantSettings settings = settingsProvider.current();

        // 구역 간 순서 의존성이 없으므로 병렬 조회
        CompletableFuture<Map<String, Integer>> indoorFuture = CompletableFuture.supplyAsync(
                () -> reservationRepository.sumOccupyingPartySizeByTime(date, SeatingType.INDOOR),
                availabilityExecutor);
        CompletableFuture<Map<String, Integer>> balconyFuture = CompletableFuture.supplyAsync(
                () -> reservationRepository.sumOccupyingPartySizeByTime(date, SeatingType.BALCONY),
                availabilityExecutor);

        Map<String, Integer> indoorBooked = await(indoorFuture);
        Map<String, Integer> balconyBooked = await(balconyFuture);

        List<TimeSlotAvailability> timeSlots = settings.timeSlots().stream()
                .map(time -> TimeSlotAvailability.of(
                        time,
                        remaining(settings.indoorCapacity(), indoorBooked.getOrDefault(time, 0)),
                        remaining(settings.balconyCapacity(), balconyBooked.getOrDefault(time, 0))))
                .collect(Collectors.toList());

        return DailyAvailability.open(date, timeSlots);
    }

    @CacheEvict(value = "dailyAvailability", key = "#date.toString()")
    public void evict(LocalDate date) {
        log.debug("Evicting dailyAvailability cache: date={}", date);
    }

    private static int remaining(int capacity, int booked) {
        return Math.max(0, capacity - booked);
    }

    private static Map<String, Integer> await(CompletableFuture<Map<String, Integer>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
