package com.playmarket.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.playmarket.ecommerce.domain.product.ModelGroup;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 홈 화면 모델 카드 (대표 상품 필드 + 모델 최저 정가)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HomeProductResponse {

    @JsonUnwrapped
    private ProductSummaryResponse product;

    @JsonProperty("min_price")
    private BigDecimal minPrice;

    public static HomeProductResponse from(ModelGroup group) {
        return HomeProductResponse.builder()
                .product(ProductSummaryResponse.from(group.getRepresentative()))
                .minPrice(group.getMinPrice())
                .build();
    }
}
