package com.playmarket.ecommerce.presentation.admin.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.playmarket.ecommerce.application.product.dto.ProductCommand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 관리자 상품 등록/수정 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {
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

    private Integer quantity;
    private List<String> images;

    public ProductCommand toCommand() {
        return ProductCommand.builder()
                .name(name)
                .productType(productType)
                .brand(brand)
                .description(description)
                .model(model)
                .controller(controller)
                .condition(condition)
                .memory(memory)
                .price(price)
                .offerPrice(offerPrice)
                .quantity(quantity)
                .images(images)
                .build();
    }
}
