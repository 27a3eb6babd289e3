package com.playmarket.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 상품 상세 응답
 *
 * options: 속성별("models", "controllers", "conditions", "memories") 값과 가격 차이
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductDetailResponse {
    private ProductSummaryResponse product;
    private Map<String, List<OptionDeltaResponse>> options;
    private ReviewSummary reviews;

    @JsonProperty("related_products")
    private List<RelatedProductResponse> relatedProducts;

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReviewSummary {
        @JsonProperty("average_rating")
        private BigDecimal averageRating;

        private long count;
    }
}
