package personal.bistro.booking.reservation.domain.model;

import personal.bistro.booking.reservation.domain.exception.InvalidStatusTransitionException;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Reservation Domain Model
 * 예약 도메인 모델 (불변)
 */
public record Reservation(
        Long id,
        String guestName,
        String email,
        String phone,
        int partySize,
        LocalDate date,
        String time,
        SeatingType seatingType,
        ReservationStatus status,
        String specialRequests,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        LocalDateTime cancelledAt,
        String cancellationReason,
        Long version) {

    public static final int MAX_GUEST_NAME_LENGTH = 100;
    public static final int MAX_EMAIL_LENGTH = 255;
    public static final int MAX_PHONE_LENGTH = 30;
    public static final int MAX_SPECIAL_REQUESTS_LENGTH = 1000;
    public static final int MAX_REASON_LENGTH = 500;

    public Reservation {
        if (guestName == null || guestName.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Guest name cannot be blank");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Email cannot be blank");
        }
        if (partySize < 1) {
            throw new BusinessException(ErrorCode.INVALID_PARTY_SIZE,
                    String.format("Party size must be at least 1: partySize=%d", partySize));
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation date cannot be null");
        }
        if (time == null || time.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation time cannot be blank");
        }
        if (seatingType == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seating type cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation status cannot be null");
        }
        checkLength("Guest name", guestName, MAX_GUEST_NAME_LENGTH);
        checkLength("Email", email, MAX_EMAIL_LENGTH);
        checkLength("Phone", phone, MAX_PHONE_LENGTH);
        checkLength("Special requests", specialRequests, MAX_SPECIAL_REQUESTS_LENGTH);
        checkLength("Cancellation reason", cancellationReason, MAX_REASON_LENGTH);
    }

    private static void checkLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("%s must be at most %d characters: length=%d", field, max, value.length()));
        }
    }

    /**
     * 신규 예약 생성 (정적 팩토리 메서드)
     * 생성 경로에는 승인 대기 단계가 없으므로 항상 CONFIRMED로 시작
     */
    public static Reservation create(String guestName, String email, String phone, int partySize,
                                     LocalDate date, String time, SeatingType seatingType,
                                     String specialRequests, LocalDateTime now) {
        return new Reservation(
                null,
                guestName,
                email,
                phone,
                partySize,
                date,
                time,
                seatingType,
                ReservationStatus.CONFIRMED,
                specialRequests,
                now,
                now,
                null,
                null,
                null);
    }

    public SlotKey slotKey() {
        return SlotKey.of(date, time, seatingType);
    }

    public LocalDateTime scheduledAt() {
        return LocalDateTime.of(date, LocalTime.parse(time));
    }

    /**
     * 현재 시각부터 예약 시각까지 남은 시간 (초 단위 정밀도)
     * 이미 지난 예약이면 음수
     */
    public double hoursUntil(LocalDateTime now) {
        return Duration.between(now, scheduledAt()).getSeconds() / 3600.0;
    }

    /**
     * 상태 전이
     * 전이 테이블에 없는 경우 InvalidStatusTransitionException
     * CANCELLED로 전이 시 취소 시각과 사유 기록
     * version은 읽은 시점의 값을 유지하여 저장 시 그 사이의 변경을 감지
     */
    public Reservation transitionTo(ReservationStatus next, String reason, LocalDateTime now) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidStatusTransitionException(status, next);
        }
        if (next == ReservationStatus.CANCELLED) {
            return new Reservation(id, guestName, email, phone, partySize, date, time, seatingType,
                    next, specialRequests, createdAt, now, now, reason, version);
        }
        return new Reservation(id, guestName, email, phone, partySize, date, time, seatingType,
                next, specialRequests, createdAt, now, cancelledAt, cancellationReason, version);
    }

    public boolean isOccupying() {
        return status.isOccupying();
    }
}
