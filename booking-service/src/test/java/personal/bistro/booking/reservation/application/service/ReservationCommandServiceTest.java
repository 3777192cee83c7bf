package personal.bistro.booking.reservation.application.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.bistro.booking.reservation.application.port.in.CreateReservationCommand;
import personal.bistro.booking.reservation.application.port.out.BlockedDateRepository;
import personal.bistro.booking.reservation.domain.exception.CapacityExhaustedException;
import personal.bistro.booking.reservation.domain.exception.DateBlockedException;
import personal.bistro.booking.reservation.domain.exception.InvalidPartySizeException;
import personal.bistro.booking.reservation.domain.exception.InvalidTimeSlotException;
import personal.bistro.booking.reservation.domain.exception.OutsideBookingWindowException;
import personal.bistro.booking.reservation.domain.model.BlockedDate;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.settings.application.port.in.SettingsProvider;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReservationCommandService 단위 테스트")
class ReservationCommandServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Seoul");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T03:00:00Z"), ZONE);
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);
    private static final LocalDate TOMORROW = TODAY.plusDays(1);

    private static final RestaurantSettings SETTINGS = new RestaurantSettings(
            40, 10, List.of("18:00", "19:00", "20:00"), 60, 24, 12, true, false);

    @Mock
    private SettingsProvider settingsProvider;
    @Mock
    private BlockedDateRepository blockedDateRepository;
    @Mock
    private SlotReservationService slotReservationService;
    @Mock
    private DailyAvailabilityCacheService dailyAvailabilityCacheService;

    private SimpleMeterRegistry meterRegistry;
    private ReservationCommandService reservationCommandService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        reservationCommandService = new ReservationCommandService(settingsProvider, blockedDateRepository,
                slotReservationService, dailyAvailabilityCacheService, CLOCK, meterRegistry);
    }

    private CreateReservationCommand command(int partySize, LocalDate date, String time) {
        return new CreateReservationCommand("Kim", "kim@example.com", "010-1234-5678", partySize,
                date, time, SeatingType.BALCONY, "Window seat");
    }

    private double attempts(String outcome) {
        return meterRegistry.get("bistro.reservation.attempts").tag("outcome", outcome).counter().count();
    }

    @Test
    @DisplayName("예약 생성 성공 - 발코니 수용 인원으로 슬롯 트랜잭션 실행 후 해당 날짜 캐시 무효화")
    void create_Success() {
        // given
        given(settingsProvider.current()).willReturn(SETTINGS);
        given(blockedDateRepository.findByDate(TOMORROW)).willReturn(Optional.empty());
        given(slotReservationService.reserve(any(Reservation.class), eq(10)))
                .willAnswer(invocation -> {
                    Reservation draft = invocation.getArgument(0);
                    return new Reservation(1L, draft.guestName(), draft.email(), draft.phone(), draft.partySize(),
                            draft.date(), draft.time(), draft.seatingType(), draft.status(),
                            draft.specialRequests(), draft.createdAt(), draft.updatedAt(), null, null, 0L);
                });

        // when
        Reservation result = reservationCommandService.create(command(4, TOMORROW, "19:00"));

        // then
        assertThat(result.id()).isEqualTo(1L);
        assertThat(result.status()).isEqualTo(ReservationStatus.CONFIRMED);

        ArgumentCaptor<Reservation> captor = ArgumentCaptor.forClass(Reservation.class);
        verify(slotReservationService).reserve(captor.capture(), eq(10));
        assertThat(captor.getValue().id()).isNull();
        assertThat(captor.getValue().createdAt()).isEqualTo(LocalDateTime.of(2026, 10, 19, 12, 0));

        verify(dailyAvailabilityCacheService).evict(TOMORROW);
        assertThat(attempts("confirmed")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("당일 예약도 허용")
    void create_SameDay() {
        // given
        given(settingsProvider.current()).willReturn(SETTINGS);
        given(blockedDateRepository.findByDate(TODAY)).willReturn(Optional.empty());
        given(slotReservationService.reserve(any(Reservation.class), anyInt()))
                .willAnswer(invocation -> invocation.getArgument(0));

        // when
        Reservation result = reservationCommandService.create(command(2, TODAY, "18:00"));

        // then
        assertThat(result.date()).isEqualTo(TODAY);
    }

    @Test
    @DisplayName("인원 검증이 가장 먼저 - 인원과 시간대가 모두 잘못되면 인원 오류")
    void create_PartySizeCheckedFirst() {
        // given
        given(settingsProvider.current()).willReturn(SETTINGS);

        // when & then
        assertThatThrownBy(() -> reservationCommandService.create(command(13, TOMORROW, "19:30")))
                .isInstanceOf(InvalidPartySizeException.class)
                .hasMessage("Party size must be between 1 and 12: partySize=13");
        verifyNoInteractions(slotReservationService, blockedDateRepository, dailyAvailabilityCacheService);
    }

    @Test
    @DisplayName("인원 0명은 거부")
    void create_ZeroPartySize() {
        // given
        given(settingsProvider.current()).willReturn(SETTINGS);

        // when & then
        assertThatThrownBy(() -> reservationCommandService.create(command(0, TOMORROW, "19:00")))
                .isInstanceOf(InvalidPartySizeException.class);
        verifyNoInteractions(slotReservationService);
    }

    @Test
    @DisplayName("운영하지 않는 시간대는 예약 기간 검증보다 먼저 거부")
    void create_InvalidTimeSlot() {
        // given
        given(settingsProvider.current()).willReturn(SETTINGS);

        // when & then
        assertThatThrownBy(() -> reservationCommandService.create(command(2, TODAY.plusDays(100), "19:30")))
                .isInstanceOf(InvalidTimeSlotException.class)
                .hasMessage("Time slot is not offered: time=19:30");
        verifyNoInteractions(slotReservationService, blockedDateRepository);
    }

    @Test
    @DisplayName("예약 가능 기간을 벗어난 날짜는 거부 (60일 초과, 과거)")
    void create_OutsideBookingWindow() {
        // given
        given(settingsProvider.current()).willReturn(SETTINGS);

        // when & then
        assertThatThrownBy(() -> reservationCommandService.create(command(2, TODAY.plusDays(61), "19:00")))
                .isInstanceOf(OutsideBookingWindowException.class)
                .hasMessageContaining("Date is outside the allowed booking window");
        assertThatThrownBy(() -> reservationCommandService.create(command(2, TODAY.minusDays(1), "19:00")))
                .isInstanceOf(OutsideBookingWindowException.class);
        verifyNoInteractions(slotReservationService, blockedDateRepository);
    }

    @Test
    @DisplayName("차단된 날짜는 사유와 함께 거부")
    void create_DateBlocked() {
        // given
        given(settingsProvider.current()).willReturn(SETTINGS);
        given(blockedDateRepository.findByDate(TOMORROW))
                .willReturn(Optional.of(BlockedDate.of(TOMORROW, "Private event", LocalDateTime.now(CLOCK))));

        // when & then
        assertThatThrownBy(() -> reservationCommandService.create(command(2, TOMORROW, "19:00")))
                .isInstanceOf(DateBlockedException.class)
                .hasMessageContaining("Private event");
        verifyNoInteractions(slotReservationService);
    }

    @Test
    @DisplayName("잔여 좌석 부족 시 예외 전파 및 실패 카운터 증가, 캐시는 유지")
    void create_CapacityExhausted() {
        // given
        given(settingsProvider.current()).willReturn(SETTINGS);
        given(blockedDateRepository.findByDate(TOMORROW)).willReturn(Optional.empty());
        given(slotReservationService.reserve(any(Reservation.class), eq(10)))
                .willThrow(new CapacityExhaustedException(4));

        // when & then
        assertThatThrownBy(() -> reservationCommandService.create(command(6, TOMORROW, "19:00")))
                .isInstanceOf(CapacityExhaustedException.class)
                .hasMessage("This time slot is fully booked. Only 4 seats remaining.");
        verify(dailyAvailabilityCacheService, never()).evict(any());
        assertThat(attempts("capacity_exhausted")).isEqualTo(1.0);
        assertThat(attempts("confirmed")).isZero();
    }
}
