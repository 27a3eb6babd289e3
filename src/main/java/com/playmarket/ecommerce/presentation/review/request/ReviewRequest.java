package com.playmarket.ecommerce.presentation.review.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 리뷰 작성 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRequest {
    @JsonProperty("product_name")
    private String productName;

    private Integer rating;
    private String comment;
}
