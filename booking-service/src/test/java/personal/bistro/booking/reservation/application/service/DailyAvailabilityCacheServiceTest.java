package personal.bistro.booking.reservation.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.bistro.booking.reservation.application.port.out.BlockedDateRepository;
import personal.bistro.booking.reservation.application.port.out.ReservationRepository;
import personal.bistro.booking.reservation.domain.model.BlockedDate;
import personal.bistro.booking.reservation.domain.model.DailyAvailability;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.reservation.domain.model.TimeSlotAvailability;
import personal.bistro.booking.settings.application.port.in.SettingsProvider;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("DailyAvailabilityCacheService 단위 테스트")
class DailyAvailabilityCacheServiceTest {

    private static final LocalDate DATE = LocalDate.of(2026, 10, 20);

    @Mock
    private ReservationRepository reservationRepository;
    @Mock
    private BlockedDateRepository blockedDateRepository;
    @Mock
    private SettingsProvider settingsProvider;

    private DailyAvailabilityCacheService dailyAvailabilityCacheService;

    @BeforeEach
    void setUp() {
        // 호출 스레드에서 바로 실행
        dailyAvailabilityCacheService = new DailyAvailabilityCacheService(
                reservationRepository, blockedDateRepository, settingsProvider, Runnable::run);
    }

    @Test
    @DisplayName("설정된 시간대 순서대로 구역별 잔여 좌석 계산, 초과 점유는 0으로 표시")
    void load_OpenDay() {
        // given
        given(blockedDateRepository.findByDate(DATE)).willReturn(Optional.empty());
        given(settingsProvider.current()).willReturn(new RestaurantSettings(
                40, 10, List.of("18:00", "19:00", "20:00"), 60, 24, 12, false, false));
        given(reservationRepository.sumOccupyingPartySizeByTime(DATE, SeatingType.INDOOR))
                .willReturn(Map.of("19:00", 38));
        given(reservationRepository.sumOccupyingPartySizeByTime(DATE, SeatingType.BALCONY))
                .willReturn(Map.of("18:00", 12, "19:00", 10));

        // when
        DailyAvailability result = dailyAvailabilityCacheService.load(DATE);

        // then
        assertThat(result.isBlocked()).isFalse();
        assertThat(result.notes()).isNull();
        assertThat(result.timeSlots()).containsExactly(
                TimeSlotAvailability.of("18:00", 40, 0),
                TimeSlotAvailability.of("19:00", 2, 0),
                TimeSlotAvailability.of("20:00", 40, 10));
        assertThat(result.hasAnyAvailability()).isTrue();
    }

    @Test
    @DisplayName("차단된 날짜는 예약 집계 없이 차단 사유만 반환")
    void load_BlockedDay() {
        // given
        given(blockedDateRepository.findByDate(DATE)).willReturn(Optional.of(
                BlockedDate.of(DATE, "Kitchen renovation", LocalDateTime.of(2026, 10, 1, 9, 0))));

        // when
        DailyAvailability result = dailyAvailabilityCacheService.load(DATE);

        // then
        assertThat(result.isBlocked()).isTrue();
        assertThat(result.notes()).isEqualTo("Kitchen renovation");
        assertThat(result.timeSlots()).isEmpty();
        verifyNoInteractions(reservationRepository, settingsProvider);
    }
}
