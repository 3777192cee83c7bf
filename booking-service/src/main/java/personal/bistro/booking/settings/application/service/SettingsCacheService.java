package personal.bistro.booking.settings.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import personal.bistro.booking.config.BookingProperties;
import personal.bistro.booking.settings.application.port.out.SettingsRepository;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

/**
 * Settings Cache Service
 *
 * Spring AOP 프록시를 위해 별도 컴포넌트로 분리 (Self-invocation 방지)
 * - 조회: @Cacheable, 저장된 설정이 없으면 booking.defaults 사용
 * - 무효화: 설정 변경 시 settings와 dailyAvailability 전체 삭제
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsCacheService {

    private final SettingsRepository settingsRepository;
    private final BookingProperties bookingProperties;

    @Cacheable(value = "settings", key = "'current'")
    public RestaurantSettings loadSettings() {
        log.info("Cache MISS - Loading restaurant settings");
        return settingsRepository.load()
                .orElseGet(() -> {
                    log.info("No stored settings, using configured defaults");
                    return bookingProperties.defaults().toSettings();
                });
    }

    /**
     * 수용 인원이나 시간대가 바뀌면 모든 날짜의 잔여 좌석 캐시도 무효
     */
    @CacheEvict(value = {"settings", "dailyAvailability"}, allEntries = true)
    public void evictAll() {
        log.debug("Evicting settings and dailyAvailability caches");
    }
}
