package personal.bistro.booking.settings.application.port.out;

import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.util.Optional;

/**
 * Settings Repository (Output Port)
 * 단일 행으로 관리되는 운영 설정 저장소
 */
public interface SettingsRepository {

    Optional<RestaurantSettings> load();

    RestaurantSettings save(RestaurantSettings settings);
}
