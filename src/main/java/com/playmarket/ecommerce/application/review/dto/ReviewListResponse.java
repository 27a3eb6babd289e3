package com.playmarket.ecommerce.application.review.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ReviewListResponse {
    private List<ReviewResponse> reviews;
    private long total;
    private int page;
    private int limit;

    @JsonProperty("total_pages")
    private int totalPages;
}
