package com.playmarket.ecommerce.application.product.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * ID 목록 조회 결과 (요청한 상품 + 같은 상품군의 다른 변형)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductLookupResponse {
    private List<ProductSummaryResponse> products;
    private List<ProductSummaryResponse> variants;
}
