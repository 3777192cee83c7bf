package personal.bistro.booking.reservation.domain.model;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Slot Key
 * (날짜, 시간, 좌석 구역) 단위의 예약 가능 용량 식별자
 */
public record SlotKey(LocalDate date, String time, SeatingType seatingType) {

    private static final DateTimeFormatter DATE_KEY_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    public SlotKey {
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot date cannot be null");
        }
        if (time == null || time.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot time cannot be blank");
        }
        if (seatingType == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seating type cannot be null");
        }
    }

    public static SlotKey of(LocalDate date, String time, SeatingType seatingType) {
        return new SlotKey(date, time, seatingType);
    }

    /**
     * 시간대 정보 없는 날짜 문자열 (yyyy-MM-dd)
     */
    public String dateKey() {
        return date.format(DATE_KEY_FORMAT);
    }

    /**
     * 슬롯 락 레코드의 키 (예: 2026-10-20_19:00_balcony)
     */
    public String asString() {
        return dateKey() + "_" + time + "_" + seatingType.value();
    }
}
