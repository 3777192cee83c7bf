package personal.bistro.booking.settings.application.port.in;

import personal.bistro.booking.settings.domain.model.RestaurantSettings;

/**
 * Update Settings UseCase (Input Port)
 */
public interface UpdateSettingsUseCase {

    /**
     * 설정 저장 후 settings, dailyAvailability 캐시 무효화
     *
     * @throws personal.bistro.common.exception.BusinessException 설정값이 올바르지 않을 때 (INVALID_SETTINGS)
     */
    RestaurantSettings update(RestaurantSettings settings);
}
