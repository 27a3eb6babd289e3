package com.playmarket.ecommerce.infrastructure.config;

import java.time.Duration;

/**
 * Redis 캐시 이름과 TTL
 */
public final class CacheNames {

    /**
     * 상품 상세 (slug 키). 관리자 상품 변경, 리뷰 작성 시 전체 무효화
     */
    public static final String PRODUCT_DETAIL = "productDetail";
    public static final Duration PRODUCT_DETAIL_TTL = Duration.ofMinutes(30);

    private CacheNames() {
    }
}
