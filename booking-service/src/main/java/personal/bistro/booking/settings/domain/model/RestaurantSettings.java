package personal.bistro.booking.settings.domain.model;

import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Restaurant Settings
 * 예약 엔진의 운영 파라미터 (구역별 수용 인원, 시간대, 예약/취소 가능 기간)
 * 연산 단위로 한 번 조회하여 값으로 전달
 */
public record RestaurantSettings(
        int indoorCapacity,
        int balconyCapacity,
        List<String> timeSlots,
        int maxAdvanceBookingDays,
        int cancellationWindowHours,
        int maxPartySize,
        boolean emailNotifications,
        boolean smsNotifications) {

    private static final Pattern TIME_SLOT_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    public RestaurantSettings {
        if (indoorCapacity < 0 || balconyCapacity < 0) {
            throw new BusinessException(ErrorCode.INVALID_SETTINGS,
                    String.format("Capacity must not be negative: indoor=%d, balcony=%d",
                            indoorCapacity, balconyCapacity));
        }
        if (timeSlots == null || timeSlots.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_SETTINGS, "At least one time slot is required");
        }
        for (String slot : timeSlots) {
            if (slot == null || !TIME_SLOT_PATTERN.matcher(slot).matches()) {
                throw new BusinessException(ErrorCode.INVALID_SETTINGS,
                        String.format("Time slot must be HH:mm: slot=%s", slot));
            }
        }
        if (new HashSet<>(timeSlots).size() != timeSlots.size()) {
            throw new BusinessException(ErrorCode.INVALID_SETTINGS, "Time slots must be unique");
        }
        if (maxAdvanceBookingDays < 0) {
            throw new BusinessException(ErrorCode.INVALID_SETTINGS,
                    String.format("Max advance booking days must not be negative: %d", maxAdvanceBookingDays));
        }
        if (cancellationWindowHours < 0) {
            throw new BusinessException(ErrorCode.INVALID_SETTINGS,
                    String.format("Cancellation window must not be negative: %d", cancellationWindowHours));
        }
        if (maxPartySize < 1) {
            throw new BusinessException(ErrorCode.INVALID_SETTINGS,
                    String.format("Max party size must be at least 1: %d", maxPartySize));
        }
        timeSlots = new ArrayList<>(timeSlots);
    }

    public int capacityOf(SeatingType seatingType) {
        return switch (seatingType) {
            case INDOOR -> indoorCapacity;
            case BALCONY -> balconyCapacity;
        };
    }

    public boolean offersTimeSlot(String time) {
        return timeSlots.contains(time);
    }

    /**
     * 오늘부터 maxAdvanceBookingDays일 후까지 (양 끝 포함)
     */
    public boolean isWithinBookingWindow(LocalDate date, LocalDate today) {
        return !date.isBefore(today) && !date.isAfter(today.plusDays(maxAdvanceBookingDays));
    }

    public boolean acceptsPartySize(int partySize) {
        return partySize >= 1 && partySize <= maxPartySize;
    }
}
