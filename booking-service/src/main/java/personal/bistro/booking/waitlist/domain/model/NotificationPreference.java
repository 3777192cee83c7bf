package personal.bistro.booking.waitlist.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.util.Arrays;

/**
 * 대기 고객 연락 수단
 */
public enum NotificationPreference {
    EMAIL("email"),
    SMS("sms"),
    BOTH("both");

    private final String value;

    NotificationPreference(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static NotificationPreference from(String raw) {
        return Arrays.stream(values())
                .filter(preference -> preference.value.equalsIgnoreCase(raw))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT,
                        String.format("Unknown notification preference: %s", raw)));
    }
}
