package com.playmarket.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 연관 상품 (상품군 대표 + 대표의 정가, 할인가 미반영)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelatedProductResponse {
    private String name;
    private String slug;

    @JsonProperty("product_type")
    private String productType;

    private String brand;
    private String image;
    private Integer order;

    @JsonProperty("min_price")
    private BigDecimal minPrice;
}
