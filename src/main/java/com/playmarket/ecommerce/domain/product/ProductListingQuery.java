package com.playmarket.ecommerce.domain.product;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 목록 조회 필터
 *
 * null인 필드는 조건에서 제외된다.
 * productRef가 있으면 해당 상품군의 변형(variant = true)만, 없으면 기본 상품만 후보가 된다.
 */
@Getter
@Builder
public class ProductListingQuery {
    private final String productType;
    private final String brand;
    private final String condition;
    private final String search;
    private final BigDecimal minPrice;
    private final BigDecimal maxPrice;
    private final String productRef;

    public boolean isVariantListing() {
        return productRef != null;
    }
}
