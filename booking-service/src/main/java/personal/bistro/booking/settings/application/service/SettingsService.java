package personal.bistro.booking.settings.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.booking.settings.application.port.in.SettingsProvider;
import personal.bistro.booking.settings.application.port.in.UpdateSettingsUseCase;
import personal.bistro.booking.settings.application.port.out.SettingsRepository;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Settings Application Service
 * 운영 설정 조회(캐시) 및 변경
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SettingsService implements SettingsProvider, UpdateSettingsUseCase {

    private final SettingsCacheService settingsCacheService;
    private final SettingsRepository settingsRepository;
    private final Clock clock;

    @Override
    public RestaurantSettings current() {
        return settingsCacheService.loadSettings();
    }

    @Override
    public boolean isDateWithinBookingWindow(LocalDate date) {
        return current().isWithinBookingWindow(date, LocalDate.now(clock));
    }

    @Override
    @Transactional
    public RestaurantSettings update(RestaurantSettings settings) {
        log.info("Updating settings: indoorCapacity={}, balconyCapacity={}, timeSlots={}, "
                        + "maxAdvanceBookingDays={}, cancellationWindowHours={}, maxPartySize={}",
                settings.indoorCapacity(), settings.balconyCapacity(), settings.timeSlots(),
                settings.maxAdvanceBookingDays(), settings.cancellationWindowHours(), settings.maxPartySize());

        RestaurantSettings saved = settingsRepository.save(settings);
        settingsCacheService.evictAll();
        return saved;
    }
}
