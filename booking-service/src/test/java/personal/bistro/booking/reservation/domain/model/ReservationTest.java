package personal.bistro.booking.reservation.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.bistro.booking.reservation.domain.exception.InvalidStatusTransitionException;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Reservation 도메인 모델 테스트")
class ReservationTest {

    private static final LocalDate DATE = LocalDate.of(2026, 10, 20);
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 12, 0);

    private Reservation confirmed() {
        return Reservation.create("Kim", "kim@example.com", "010-0000-0000", 4, DATE, "19:00",
                SeatingType.BALCONY, null, NOW);
    }

    @Test
    @DisplayName("신규 예약은 CONFIRMED 상태로 생성된다")
    void createStartsConfirmed() {
        Reservation reservation = confirmed();

        assertThat(reservation.id()).isNull();
        assertThat(reservation.status()).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(reservation.createdAt()).isEqualTo(NOW);
        assertThat(reservation.slotKey().asString()).isEqualTo("2026-10-20_19:00_balcony");
    }

    @Test
    @DisplayName("인원이 1명 미만이면 생성할 수 없다")
    void partySizeMustBePositive() {
        assertThatThrownBy(() -> Reservation.create("Kim", "kim@example.com", null, 0, DATE, "19:00",
                SeatingType.INDOOR, null, NOW))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_PARTY_SIZE);
    }

    @Test
    @DisplayName("이메일이 255자를 넘으면 입력 오류로 생성할 수 없다")
    void emailLengthIsLimited() {
        String longEmail = "a".repeat(300) + "@example.com";

        assertThatThrownBy(() -> Reservation.create("Kim", longEmail, null, 2, DATE, "19:00",
                SeatingType.INDOOR, null, NOW))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Email must be at most 255 characters: length=312")
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("이름이 100자를 넘으면 입력 오류로 생성할 수 없다")
    void guestNameLengthIsLimited() {
        assertThatThrownBy(() -> Reservation.create("K".repeat(101), "kim@example.com", null, 2, DATE, "19:00",
                SeatingType.INDOOR, null, NOW))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("취소 사유가 500자를 넘으면 전이할 수 없다")
    void cancellationReasonLengthIsLimited() {
        Reservation reservation = confirmed();

        assertThatThrownBy(() -> reservation.transitionTo(ReservationStatus.CANCELLED, "r".repeat(501), NOW))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("상태 전이는 읽은 시점의 version을 유지한다")
    void transitionKeepsVersion() {
        Reservation loaded = new Reservation(7L, "Kim", "kim@example.com", null, 4, DATE, "19:00",
                SeatingType.BALCONY, ReservationStatus.CONFIRMED, null, NOW, NOW, null, null, 3L);

        assertThat(loaded.transitionTo(ReservationStatus.SEATED, null, NOW).version()).isEqualTo(3L);
        assertThat(loaded.transitionTo(ReservationStatus.CANCELLED, "sick", NOW).version()).isEqualTo(3L);
    }

    @Test
    @DisplayName("예약 시각까지 남은 시간을 초 단위로 계산한다")
    void hoursUntil() {
        Reservation reservation = confirmed();

        assertThat(reservation.hoursUntil(LocalDateTime.of(2026, 10, 19, 19, 0))).isEqualTo(24.0);
        assertThat(reservation.hoursUntil(LocalDateTime.of(2026, 10, 19, 19, 0, 1))).isLessThan(24.0);
        assertThat(reservation.hoursUntil(LocalDateTime.of(2026, 10, 20, 20, 0))).isEqualTo(-1.0);
    }

    @Test
    @DisplayName("CANCELLED로 전이하면 취소 시각과 사유가 기록된다")
    void cancelRecordsReason() {
        LocalDateTime cancelledAt = NOW.plusHours(1);

        Reservation cancelled = confirmed().transitionTo(ReservationStatus.CANCELLED, "schedule changed", cancelledAt);

        assertThat(cancelled.status()).isEqualTo(ReservationStatus.CANCELLED);
        assertThat(cancelled.cancelledAt()).isEqualTo(cancelledAt);
        assertThat(cancelled.cancellationReason()).isEqualTo("schedule changed");
        assertThat(cancelled.updatedAt()).isEqualTo(cancelledAt);
        assertThat(cancelled.isOccupying()).isFalse();
    }

    @Test
    @DisplayName("다른 상태로 전이하면 취소 정보는 변하지 않는다")
    void seatDoesNotTouchCancellation() {
        Reservation seated = confirmed().transitionTo(ReservationStatus.SEATED, "ignored", NOW);

        assertThat(seated.status()).isEqualTo(ReservationStatus.SEATED);
        assertThat(seated.cancelledAt()).isNull();
        assertThat(seated.cancellationReason()).isNull();
    }

    @Test
    @DisplayName("허용되지 않은 전이는 InvalidStatusTransitionException")
    void illegalTransition() {
        Reservation seated = confirmed().transitionTo(ReservationStatus.SEATED, null, NOW);

        assertThatThrownBy(() -> seated.transitionTo(ReservationStatus.CANCELLED, null, NOW))
                .isInstanceOf(InvalidStatusTransitionException.class)
                .hasMessage("Cannot transition from seated to cancelled");
    }
}
