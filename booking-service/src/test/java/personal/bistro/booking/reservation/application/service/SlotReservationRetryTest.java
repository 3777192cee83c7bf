package personal.bistro.booking.reservation.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import personal.bistro.booking.acceptance.support.BookingTestAdapter;
import personal.bistro.booking.reservation.adapter.out.persistence.SlotLockCreationRaceException;
import personal.bistro.booking.reservation.application.port.in.CreateReservationCommand;
import personal.bistro.booking.reservation.application.port.in.CreateReservationUseCase;
import personal.bistro.booking.reservation.domain.exception.SlotContentionException;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.reservation.domain.service.SlotReservationManager;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * 슬롯 예약 재시도 정책 테스트 (resilience4j.retry.instances.slotReservation, max-attempts 5)
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("슬롯 예약 재시도 정책 테스트")
class SlotReservationRetryTest {

    @Autowired
    private SlotReservationService slotReservationService;

    @Autowired
    private CreateReservationUseCase createReservationUseCase;

    @Autowired
    private BookingTestAdapter bookingTestAdapter;

    @MockBean
    private SlotReservationManager slotReservationManager;

    private Reservation draft;

    @BeforeEach
    void setUp() {
        bookingTestAdapter.clearAllData();
        draft = Reservation.create("Kim", "kim@example.com", null, 2, LocalDate.of(2026, 10, 25), "19:00",
                SeatingType.BALCONY, null, LocalDateTime.of(2026, 10, 19, 12, 0));
    }

    private Reservation committed() {
        return new Reservation(1L, draft.guestName(), draft.email(), draft.phone(), draft.partySize(),
                draft.date(), draft.time(), draft.seatingType(), draft.status(), null,
                draft.createdAt(), draft.updatedAt(), null, null, 0L);
    }

    @Test
    @DisplayName("잠금 행 동시 생성 충돌은 재시도 후 성공")
    void retriesSlotLockCreationRace() {
        // given
        SlotLockCreationRaceException race = new SlotLockCreationRaceException("2026-10-25_19:00_balcony",
                new DataIntegrityViolationException("duplicate key"));
        given(slotReservationManager.reserveInTransaction(any(Reservation.class), anyInt()))
                .willThrow(race)
                .willReturn(committed());

        // when
        Reservation reservation = slotReservationService.reserve(draft, 10);

        // then
        assertThat(reservation.id()).isEqualTo(1L);
        verify(slotReservationManager, times(2)).reserveInTransaction(any(Reservation.class), anyInt());
    }

    @Test
    @DisplayName("예약 행의 무결성 위반은 재시도하지 않고 그대로 전파")
    void doesNotRetryOtherIntegrityViolations() {
        // given
        given(slotReservationManager.reserveInTransaction(any(Reservation.class), anyInt()))
                .willThrow(new DataIntegrityViolationException("value too long for column EMAIL"));

        // when & then
        assertThatThrownBy(() -> slotReservationService.reserve(draft, 10))
                .isInstanceOf(DataIntegrityViolationException.class);
        verify(slotReservationManager, times(1)).reserveInTransaction(any(Reservation.class), anyInt());
    }

    @Test
    @DisplayName("잠금 대기 초과가 계속되면 재시도 한도 후 SlotContentionException")
    void contentionAfterRetriesExhausted() {
        // given
        given(slotReservationManager.reserveInTransaction(any(Reservation.class), anyInt()))
                .willThrow(new CannotAcquireLockException("lock wait timeout"));

        // when & then
        assertThatThrownBy(() -> slotReservationService.reserve(draft, 10))
                .isInstanceOf(SlotContentionException.class);
        verify(slotReservationManager, times(5)).reserveInTransaction(any(Reservation.class), anyInt());
    }

    @Test
    @DisplayName("너무 긴 이메일은 슬롯 트랜잭션 전에 입력 오류(400)로 거절")
    void longEmailIsValidationError() {
        // given
        String longEmail = "guest".repeat(60) + "@example.com";
        CreateReservationCommand command = new CreateReservationCommand("Kim", longEmail, null,
                2, bookingTestAdapter.daysFromToday(7), "19:00", SeatingType.BALCONY, null);

        // when & then
        assertThatThrownBy(() -> createReservationUseCase.create(command))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_INPUT);
        verify(slotReservationManager, never()).reserveInTransaction(any(Reservation.class), anyInt());
    }
}
