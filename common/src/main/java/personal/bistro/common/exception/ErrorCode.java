package personal.bistro.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C002", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C003", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C004", "서버 내부 오류가 발생했습니다."),

    // Reservation Domain (Rxxx)
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, "R001", "예약을 찾을 수 없습니다."),
    INVALID_STATUS_TRANSITION(HttpStatus.BAD_REQUEST, "R002", "허용되지 않는 예약 상태 변경입니다."),
    RESERVATION_NOT_CANCELLABLE(HttpStatus.BAD_REQUEST, "R003", "취소할 수 없는 예약입니다."),
    OUTSIDE_BOOKING_WINDOW(HttpStatus.BAD_REQUEST, "R004", "예약 가능 기간을 벗어난 날짜입니다."),
    DATE_BLOCKED(HttpStatus.BAD_REQUEST, "R005", "예약이 차단된 날짜입니다."),
    INVALID_TIME_SLOT(HttpStatus.BAD_REQUEST, "R006", "운영하지 않는 시간대입니다."),
    INVALID_PARTY_SIZE(HttpStatus.BAD_REQUEST, "R007", "예약 인원이 올바르지 않습니다."),
    CAPACITY_EXHAUSTED(HttpStatus.CONFLICT, "R008", "해당 시간대의 좌석이 부족합니다."),
    CANCELLATION_WINDOW_CLOSED(HttpStatus.PRECONDITION_FAILED, "R009", "취소 가능 시간이 지났습니다."),
    SLOT_CONTENTION(HttpStatus.SERVICE_UNAVAILABLE, "R010", "예약 요청이 몰려 처리하지 못했습니다. 다시 시도해주세요."),
    RESERVATION_UPDATE_CONFLICT(HttpStatus.CONFLICT, "R011", "다른 요청이 먼저 예약을 변경했습니다. 다시 조회 후 시도해주세요."),

    // Calendar / Settings (Sxxx)
    BLOCKED_DATE_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "차단된 날짜가 아닙니다."),
    INVALID_SETTINGS(HttpStatus.BAD_REQUEST, "S002", "설정값이 올바르지 않습니다."),

    // Waitlist (Wxxx)
    WAITLIST_ENTRY_NOT_FOUND(HttpStatus.NOT_FOUND, "W001", "대기 명단을 찾을 수 없습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
