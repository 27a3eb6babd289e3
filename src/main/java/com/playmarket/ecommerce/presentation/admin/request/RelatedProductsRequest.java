package com.playmarket.ecommerce.presentation.admin.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 연관 상품 지정 요청 DTO (상품군 이름 목록)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RelatedProductsRequest {
    @JsonProperty("related_products")
    private List<String> relatedProducts;
}
