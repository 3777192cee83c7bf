package personal.bistro.booking.reservation.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Reservation Status
 * 예약 상태와 허용된 상태 전이 테이블
 */
public enum ReservationStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    SEATED("seated"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    NO_SHOW("no-show");

    private static final Map<ReservationStatus, Set<ReservationStatus>> TRANSITIONS =
            new EnumMap<>(ReservationStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(CONFIRMED, CANCELLED));
        TRANSITIONS.put(CONFIRMED, EnumSet.of(PENDING, SEATED, CANCELLED, NO_SHOW));
        TRANSITIONS.put(SEATED, EnumSet.of(COMPLETED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(ReservationStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(ReservationStatus.class));
        TRANSITIONS.put(NO_SHOW, EnumSet.noneOf(ReservationStatus.class));
    }

    /**
     * 좌석을 점유하는 상태 (잔여 좌석 계산에 포함)
     */
    public static final Set<ReservationStatus> OCCUPYING =
            Collections.unmodifiableSet(EnumSet.of(PENDING, CONFIRMED, SEATED));

    private final String value;

    ReservationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ReservationStatus from(String raw) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(raw) || status.name().equalsIgnoreCase(raw))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT,
                        String.format("Unknown reservation status: %s", raw)));
    }

    public Set<ReservationStatus> allowedNext() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(ReservationStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public boolean isOccupying() {
        return OCCUPYING.contains(this);
    }
}
