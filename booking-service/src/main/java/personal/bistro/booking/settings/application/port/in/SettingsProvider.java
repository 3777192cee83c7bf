package personal.bistro.booking.settings.application.port.in;

import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.time.LocalDate;
import java.util.List;

/**
 * Settings Provider (Input Port)
 * 예약 엔진이 소비하는 운영 설정 조회 인터페이스
 * 하나의 연산 안에서는 current()를 한 번만 호출하여 같은 설정 값을 사용
 */
public interface SettingsProvider {

    /**
     * 현재 설정 (캐시됨)
     */
    RestaurantSettings current();

    default int getCapacity(SeatingType seatingType) {
        return current().capacityOf(seatingType);
    }

    default List<String> getConfiguredTimeSlots() {
        return current().timeSlots();
    }

    default int getMaxAdvanceBookingDays() {
        return current().maxAdvanceBookingDays();
    }

    default int getCancellationWindowHours() {
        return current().cancellationWindowHours();
    }

    /**
     * 서비스 시간대 기준 오늘을 사용하여 예약 가능 기간 여부 판단
     */
    boolean isDateWithinBookingWindow(LocalDate date);
}
