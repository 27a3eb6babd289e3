package com.playmarket.ecommerce.application.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.playmarket.ecommerce.domain.review.Review;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewResponse {
    private Long id;

    @JsonProperty("customer_id")
    private Long customerId;

    @JsonProperty("product_name")
    private String productName;

    private Integer rating;
    private String comment;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("customer_avatar")
    private String customerAvatar;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static ReviewResponse from(Review review) {
        return ReviewResponse.builder()
                .id(review.getId())
                .customerId(review.getCustomerId())
                .productName(review.getProductName())
                .rating(review.getRating())
                .comment(review.getComment())
                .customerName(review.getCustomerName())
                .customerAvatar(review.getCustomerAvatar())
                .updatedAt(review.getUpdatedAt())
                .build();
    }
}
