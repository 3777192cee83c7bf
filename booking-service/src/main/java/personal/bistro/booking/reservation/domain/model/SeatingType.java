package personal.bistro.booking.reservation.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.util.Arrays;

/**
 * Seating Type
 * 좌석 구역 (실내 / 발코니)
 */
public enum SeatingType {
    INDOOR("indoor"),
    BALCONY("balcony");

    private final String value;

    SeatingType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * "indoor", "BALCONY" 등 대소문자 구분 없이 변환
     */
    @JsonCreator
    public static SeatingType from(String raw) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(raw) || type.name().equalsIgnoreCase(raw))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT,
                        String.format("Unknown seating type: %s", raw)));
    }
}
