package com.playmarket.ecommerce.common.exception;

/**
 * 도메인 규칙 위반 예외
 *
 * 사용 예:
 * - ProductNotFoundException: 상품 조회 실패
 * - InsufficientStockException: 주문 수량이 재고 초과
 * - DuplicateVariantException: 같은 옵션 조합의 상품 중복 등록
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
