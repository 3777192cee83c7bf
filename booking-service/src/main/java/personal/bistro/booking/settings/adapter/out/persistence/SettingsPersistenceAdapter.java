package personal.bistro.booking.settings.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bistro.booking.settings.application.port.out.SettingsRepository;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.util.Optional;

/**
 * Settings Persistence Adapter
 * JPA를 사용한 단일 행 설정 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettingsPersistenceAdapter implements SettingsRepository {

    private final JpaSettingsRepository jpaSettingsRepository;

    @Override
    public Optional<RestaurantSettings> load() {
        return jpaSettingsRepository.findById(SettingsEntity.SINGLETON_ID)
                .map(SettingsEntity::toDomain);
    }

    @Override
    public RestaurantSettings save(RestaurantSettings settings) {
        log.debug("Saving restaurant settings");
        return jpaSettingsRepository.save(SettingsEntity.fromDomain(settings)).toDomain();
    }
}
