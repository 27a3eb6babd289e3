package com.playmarket.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.playmarket.ecommerce.domain.product.ProductFamily;
import com.playmarket.ecommerce.domain.product.ProductVariant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 상품 변형 요약 (목록 항목, 상세의 product 필드)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductSummaryResponse {
    private Long id;
    private String slug;
    private String name;

    @JsonProperty("product_type")
    private String productType;

    private String brand;
    private String description;
    private String model;
    private String controller;
    private String condition;
    private String memory;
    private BigDecimal price;

    @JsonProperty("offer_price")
    private BigDecimal offerPrice;

    @JsonProperty("effective_price")
    private BigDecimal effectivePrice;

    private Integer quantity;

    @JsonProperty("is_variant")
    private boolean variant;

    @JsonProperty("product_ref")
    private String productRef;

    private Integer order;
    private BigDecimal ratings;

    @JsonProperty("review_count")
    private Integer reviewCount;

    private List<String> images;

    public static ProductSummaryResponse from(ProductVariant variant) {
        ProductFamily family = variant.getFamily();
        return ProductSummaryResponse.builder()
                .id(variant.getId())
                .slug(variant.getSlug())
                .name(family.getName())
                .productType(family.getProductType())
                .brand(family.getBrand())
                .description(family.getDescription())
                .model(variant.getAttributes().getModel())
                .controller(variant.getAttributes().getController())
                .condition(variant.getAttributes().getCondition())
                .memory(variant.getAttributes().getMemory())
                .price(variant.getPrice())
                .offerPrice(variant.getOfferPrice())
                .effectivePrice(variant.effectivePrice())
                .quantity(variant.getQuantity())
                .variant(variant.isVariant())
                .productRef(variant.getProductRef())
                .order(family.getDisplayOrder())
                .ratings(family.getRatings())
                .reviewCount(family.getReviewCount())
                .images(new ArrayList<>(variant.getImages()))
                .build();
    }
}
