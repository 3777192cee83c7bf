package personal.bistro.booking.waitlist.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.bistro.booking.reservation.application.port.in.CreateReservationCommand;
import personal.bistro.booking.reservation.application.port.in.CreateReservationUseCase;
import personal.bistro.booking.reservation.domain.exception.CapacityExhaustedException;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.waitlist.application.port.in.JoinWaitlistCommand;
import personal.bistro.booking.waitlist.application.port.out.WaitlistRepository;
import personal.bistro.booking.waitlist.domain.exception.WaitlistEntryNotFoundException;
import personal.bistro.booking.waitlist.domain.model.NotificationPreference;
import personal.bistro.booking.waitlist.domain.model.WaitlistEntry;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("WaitlistService 단위 테스트")
class WaitlistServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T03:00:00Z"), ZoneId.of("Asia/Seoul"));
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 12, 0);
    private static final LocalDate DATE = LocalDate.of(2026, 10, 24);
    private static final Long ENTRY_ID = 5L;

    @Mock
    private WaitlistRepository waitlistRepository;
    @Mock
    private CreateReservationUseCase createReservationUseCase;

    private WaitlistService waitlistService;

    @BeforeEach
    void setUp() {
        waitlistService = new WaitlistService(waitlistRepository, createReservationUseCase, CLOCK);
    }

    private WaitlistEntry entry() {
        return new WaitlistEntry(ENTRY_ID, "Park", "park@example.com", "010-2222-3333", 4, DATE, "19:00",
                SeatingType.BALCONY, NotificationPreference.SMS, NOW.minusHours(2));
    }

    @Test
    @DisplayName("대기 등록 - 알림 방식 미지정 시 EMAIL")
    void join_DefaultsToEmail() {
        // given
        given(waitlistRepository.save(any(WaitlistEntry.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        WaitlistEntry result = waitlistService.join(new JoinWaitlistCommand(
                "Park", "park@example.com", null, 4, DATE, "19:00", SeatingType.BALCONY, null));

        // then
        assertThat(result.notificationPreference()).isEqualTo(NotificationPreference.EMAIL);
        assertThat(result.createdAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("예약 전환 성공 - 대기 정보로 예약 생성 후 대기 항목 삭제")
    void convert_Success() {
        // given
        given(waitlistRepository.findById(ENTRY_ID)).willReturn(Optional.of(entry()));
        Reservation reservation = new Reservation(100L, "Park", "park@example.com", "010-2222-3333", 4, DATE,
                "19:00", SeatingType.BALCONY, ReservationStatus.CONFIRMED, null, NOW, NOW, null, null, 0L);
        given(createReservationUseCase.create(any(CreateReservationCommand.class))).willReturn(reservation);

        // when
        Reservation result = waitlistService.convertToReservation(ENTRY_ID);

        // then
        assertThat(result.id()).isEqualTo(100L);
        ArgumentCaptor<CreateReservationCommand> captor = ArgumentCaptor.forClass(CreateReservationCommand.class);
        verify(createReservationUseCase).create(captor.capture());
        assertThat(captor.getValue().partySize()).isEqualTo(4);
        assertThat(captor.getValue().time()).isEqualTo("19:00");
        assertThat(captor.getValue().seatingType()).isEqualTo(SeatingType.BALCONY);
        verify(waitlistRepository).deleteById(ENTRY_ID);
    }

    @Test
    @DisplayName("예약 전환 실패 - 좌석 부족이면 대기 항목 유지")
    void convert_CapacityExhausted() {
        // given
        given(waitlistRepository.findById(ENTRY_ID)).willReturn(Optional.of(entry()));
        given(createReservationUseCase.create(any(CreateReservationCommand.class)))
                .willThrow(new CapacityExhaustedException(2));

        // when & then
        assertThatThrownBy(() -> waitlistService.convertToReservation(ENTRY_ID))
                .isInstanceOf(CapacityExhaustedException.class);
        verify(waitlistRepository, never()).deleteById(any());
    }

    @Test
    @DisplayName("없는 대기 항목 삭제 시 WaitlistEntryNotFoundException")
    void remove_NotFound() {
        // given
        given(waitlistRepository.findById(ENTRY_ID)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> waitlistService.remove(ENTRY_ID))
                .isInstanceOf(WaitlistEntryNotFoundException.class)
                .hasMessage("Waitlist entry not found: entryId=5");
        verify(waitlistRepository, never()).deleteById(any());
    }
}
