package com.playmarket.ecommerce.common.exception;

/**
 * 에러 코드 정의
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_PRODUCT_NOT_FOUND, APP_CHECKOUT_FAILED
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // 공통 요청 검증
    INVALID_REQUEST("DOMAIN_INVALID_REQUEST", "잘못된 요청입니다", 400),

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    DUPLICATE_VARIANT("DOMAIN_PRODUCT_DUPLICATE_VARIANT", "이미 존재하는 상품 옵션 조합입니다", 409),
    INSUFFICIENT_STOCK("DOMAIN_PRODUCT_INSUFFICIENT_STOCK", "재고가 부족합니다", 400),

    // Customer Domain
    CUSTOMER_NOT_FOUND("DOMAIN_CUSTOMER_NOT_FOUND", "고객을 찾을 수 없습니다", 404),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),

    // Review Domain
    REVIEW_NOT_FOUND("DOMAIN_REVIEW_NOT_FOUND", "리뷰를 찾을 수 없습니다", 404),

    // ========== Application Layer Errors (5XX) ==========

    CHECKOUT_FAILED("APP_CHECKOUT_FAILED", "주문서 생성에 실패했습니다", 500),

    // ========== System Errors (5XX) ==========

    LOCK_ACQUISITION_FAILED("SYSTEM_LOCK_ACQUISITION_FAILED", "분산락 획득에 실패했습니다", 500),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
