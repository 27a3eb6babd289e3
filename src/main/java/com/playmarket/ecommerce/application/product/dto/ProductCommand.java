package com.playmarket.ecommerce.application.product.dto;

import com.playmarket.ecommerce.domain.product.VariantAttributes;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 관리자 상품 등록/수정 입력
 *
 * 이미지는 업로드 처리 후 저장된 경로 목록으로 전달된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductCommand {
    private String name;
    private String productType;
    private String brand;
    private String description;
    private String model;
    private String controller;
    private String condition;
    private String memory;
    private BigDecimal price;
    private BigDecimal offerPrice;
    private Integer quantity;
    private List<String> images;

    public VariantAttributes toAttributes() {
        return VariantAttributes.of(model, controller, condition, memory);
    }

    public boolean hasImages() {
        return images != null && !images.isEmpty();
    }
}
