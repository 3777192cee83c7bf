package personal.bistro.booking.reservation.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.bistro.booking.reservation.application.port.out.ReservationEventPort;
import personal.bistro.booking.reservation.application.port.out.ReservationRepository;
import personal.bistro.booking.reservation.application.port.out.SlotLockRepository;
import personal.bistro.booking.reservation.domain.exception.CapacityExhaustedException;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationEventType;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.reservation.domain.model.SlotKey;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlotReservationManager 단위 테스트")
class SlotReservationManagerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T03:00:00Z"), ZoneId.of("Asia/Seoul"));
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 12, 0);
    private static final LocalDate DATE = LocalDate.of(2026, 10, 20);
    private static final SlotKey SLOT = SlotKey.of(DATE, "19:00", SeatingType.BALCONY);

    @Mock
    private SlotLockRepository slotLockRepository;
    @Mock
    private ReservationRepository reservationRepository;
    @Mock
    private ReservationEventPort reservationEventPort;

    private SlotReservationManager slotReservationManager;

    @BeforeEach
    void setUp() {
        slotReservationManager = new SlotReservationManager(
                slotLockRepository, reservationRepository, reservationEventPort, CLOCK);
    }

    private Reservation draft(int partySize) {
        return Reservation.create("Lee", "lee@example.com", null, partySize, DATE, "19:00",
                SeatingType.BALCONY, null, NOW);
    }

    private Reservation persisted(Reservation draft) {
        return new Reservation(11L, draft.guestName(), draft.email(), draft.phone(), draft.partySize(),
                draft.date(), draft.time(), draft.seatingType(), draft.status(), draft.specialRequests(),
                draft.createdAt(), draft.updatedAt(), null, null, 0L);
    }

    @Test
    @DisplayName("락 획득 후 점유 인원 재계산, 잔여 좌석이 충분하면 저장 + 락 갱신 + 이벤트 기록")
    void reserve_Success() {
        // given
        Reservation draft = draft(4);
        Reservation saved = persisted(draft);
        given(reservationRepository.sumOccupyingPartySize(SLOT)).willReturn(6);
        given(reservationRepository.save(draft)).willReturn(saved);

        // when
        Reservation result = slotReservationManager.reserveInTransaction(draft, 10);

        // then
        assertThat(result.id()).isEqualTo(11L);

        InOrder inOrder = inOrder(slotLockRepository, reservationRepository, reservationEventPort);
        inOrder.verify(slotLockRepository).acquire(SLOT);
        inOrder.verify(reservationRepository).sumOccupyingPartySize(SLOT);
        inOrder.verify(reservationRepository).save(draft);
        inOrder.verify(slotLockRepository).recordCommit(SLOT, 11L, NOW);
        inOrder.verify(reservationEventPort).publishReservationEvent(saved, ReservationEventType.RESERVATION_CREATED);
    }

    @Test
    @DisplayName("잔여 좌석과 인원이 같으면 성공 (10석 중 6석 점유, 4명 요청)")
    void reserve_ExactFit() {
        // given
        Reservation draft = draft(4);
        given(reservationRepository.sumOccupyingPartySize(SLOT)).willReturn(6);
        given(reservationRepository.save(draft)).willReturn(persisted(draft));

        // when & then
        assertThat(slotReservationManager.reserveInTransaction(draft, 10).partySize()).isEqualTo(4);
    }

    @Test
    @DisplayName("잔여 좌석 부족 시 아무것도 쓰지 않고 남은 좌석 수와 함께 실패")
    void reserve_CapacityExhausted() {
        // given
        given(reservationRepository.sumOccupyingPartySize(SLOT)).willReturn(6);

        // when & then
        assertThatThrownBy(() -> slotReservationManager.reserveInTransaction(draft(6), 10))
                .isInstanceOf(CapacityExhaustedException.class)
                .hasMessage("This time slot is fully booked. Only 4 seats remaining.")
                .extracting(e -> ((CapacityExhaustedException) e).getRemaining())
                .isEqualTo(4);

        verify(slotLockRepository).acquire(SLOT);
        verify(reservationRepository, never()).save(any());
        verify(slotLockRepository, never()).recordCommit(any(), any(), any());
        verify(reservationEventPort, never()).publishReservationEvent(any(), any());
    }

    @Test
    @DisplayName("수용 인원이 0인 구역은 1명도 받을 수 없음")
    void reserve_ZeroCapacity() {
        // given
        given(reservationRepository.sumOccupyingPartySize(SLOT)).willReturn(0);

        // when & then
        assertThatThrownBy(() -> slotReservationManager.reserveInTransaction(draft(1), 0))
                .isInstanceOf(CapacityExhaustedException.class)
                .hasMessage("This time slot is fully booked. Only 0 seats remaining.");
    }
}
