package personal.bistro.common.exception;

/**
 * 비즈니스 예외의 최상위 타입
 * ErrorCode로 HTTP 상태와 코드를, message로 상세 사유를 전달
 */
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
