package com.playmarket.ecommerce.common.exception;

/**
 * 비즈니스 예외의 최상위 클래스
 *
 * 예외 계층:
 * BizException
 * ├─ DomainException (도메인 규칙 위반, 4XX)
 * ├─ ApplicationException (유스케이스 처리 실패)
 * └─ SystemException (락, 인프라 오류)
 *
 * GlobalExceptionHandler가 errorCode의 statusCode로 HTTP 응답을 결정한다.
 */
public abstract class BizException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BizException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage) {
        super(errorCode.getMessage() + " | " + detailMessage);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return errorCode.getStatusCode();
    }

    public String getErrorCodeValue() {
        return errorCode.getCode();
    }
}
