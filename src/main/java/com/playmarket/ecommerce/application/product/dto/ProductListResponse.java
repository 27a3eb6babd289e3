package com.playmarket.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 상품 목록 응답
 *
 * {
 *   "products": [...],
 *   "meta": {
 *     "pagination": {...},
 *     "product_meta": {...},   // 패싯
 *     "current": {...}         // 적용된 필터
 *   }
 * }
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductListResponse {
    private List<ProductSummaryResponse> products;
    private Meta meta;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Meta {
        private Pagination pagination;

        @JsonProperty("product_meta")
        private Facets productMeta;

        private CurrentFilters current;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pagination {
        @JsonProperty("total_product_count")
        private long totalProductCount;

        @JsonProperty("total_pages")
        private int totalPages;

        @JsonProperty("current_page")
        private int currentPage;

        @JsonProperty("current_product_limit")
        private int currentProductLimit;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Facets {
        @JsonProperty("product_types")
        private List<String> productTypes;

        private List<String> brands;
        private List<String> conditions;

        @JsonProperty("min_price")
        private BigDecimal minPrice;

        @JsonProperty("max_price")
        private BigDecimal maxPrice;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CurrentFilters {
        @JsonProperty("product_type")
        private String productType;

        private String brand;
        private String condition;
        private String search;

        @JsonProperty("min_price")
        private BigDecimal minPrice;

        @JsonProperty("max_price")
        private BigDecimal maxPrice;

        @JsonProperty("product_ref")
        private String productRef;

        private String sort;
    }
}
