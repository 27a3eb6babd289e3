package com.playmarket.ecommerce.presentation.admin.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.playmarket.ecommerce.application.review.dto.ReviewCommand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 관리자 리뷰 등록/수정 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminReviewRequest {
    @JsonProperty("product_name")
    private String productName;

    private Integer rating;
    private String comment;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("customer_avatar")
    private String customerAvatar;

    public ReviewCommand toCommand() {
        return ReviewCommand.builder()
                .productName(productName)
                .rating(rating)
                .comment(comment)
                .customerName(customerName)
                .customerAvatar(customerAvatar)
                .build();
    }
}
