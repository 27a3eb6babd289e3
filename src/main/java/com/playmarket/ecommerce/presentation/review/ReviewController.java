package com.playmarket.ecommerce.presentation.review;

import com.playmarket.ecommerce.application.review.ReviewService;
import com.playmarket.ecommerce.application.review.dto.ReviewListResponse;
import com.playmarket.ecommerce.application.review.dto.ReviewResponse;
import com.playmarket.ecommerce.presentation.review.request.ReviewRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * ReviewController - 상품 리뷰 API
 * POST   /reviews             - 작성 (고객당 상품군 하나, 재작성 시 갱신)
 * GET    /reviews             - 목록 (product_name 필터, 최신순)
 * DELETE /reviews/{review_id} - 삭제
 */
@RestController
@RequestMapping("/reviews")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @PostMapping
    public ResponseEntity<ReviewResponse> storeReview(
            @RequestHeader("X-USER-ID") Long customerId,
            @RequestBody ReviewRequest request) {
        ReviewResponse response = reviewService.store(
                customerId, request.getProductName(), request.getRating(), request.getComment());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<ReviewListResponse> getReviews(
            @RequestParam(value = "page", required = false) String page,
            @RequestParam(value = "limit", required = false) String limit,
            @RequestParam(value = "product_name", required = false) String productName) {
        return ResponseEntity.ok(reviewService.list(page, limit, productName));
    }

    @DeleteMapping("/{review_id}")
    public ResponseEntity<Void> deleteReview(@PathVariable("review_id") Long reviewId) {
        reviewService.delete(reviewId);
        return ResponseEntity.noContent().build();
    }
}
