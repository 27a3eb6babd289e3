package com.playmarket.ecommerce.common.exception;

/**
 * 요청 값 검증 실패 (400)
 *
 * 장바구니 형식 오류, 필터 값 오류 등 호출자에게 상세 메시지와 함께 그대로 전달된다.
 */
public class InvalidRequestException extends DomainException {

    public InvalidRequestException(String detailMessage) {
        super(ErrorCode.INVALID_REQUEST, detailMessage);
    }

    protected InvalidRequestException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
