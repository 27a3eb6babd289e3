package com.playmarket.ecommerce.application.product.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 목록 조회 쿼리 파라미터 (가공 전 문자열)
 *
 * 숫자 변환과 기본값 적용은 ProductListingService가 담당한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductListFilter {
    private String productType;
    private String brand;
    private String condition;
    private String search;
    private String minPrice;
    private String maxPrice;
    private String productRef;
    private String sort;
    private String page;
    private String limit;
}
