package com.playmarket.ecommerce.common.exception;

/**
 * 시스템 오류 (분산락 획득 실패 등)
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
