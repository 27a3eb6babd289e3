package com.playmarket.ecommerce.presentation.admin;

import com.playmarket.ecommerce.application.review.ReviewService;
import com.playmarket.ecommerce.application.review.dto.ReviewResponse;
import com.playmarket.ecommerce.presentation.admin.request.AdminReviewRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AdminReviewController - 관리자 리뷰 API
 * POST /admin/reviews             - 고객 없이 리뷰 등록 (작성자 이름/아바타 지정)
 * PUT  /admin/reviews/{review_id} - 부분 수정 (아바타 교체 시 기존 파일 삭제)
 */
@RestController
@RequestMapping("/admin/reviews")
public class AdminReviewController {

    private final ReviewService reviewService;

    public AdminReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @PostMapping
    public ResponseEntity<ReviewResponse> createReview(@RequestBody AdminReviewRequest request) {
        ReviewResponse response = reviewService.create(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{review_id}")
    public ResponseEntity<ReviewResponse> updateReview(
            @PathVariable("review_id") Long reviewId,
            @RequestBody AdminReviewRequest request) {
        return ResponseEntity.ok(reviewService.update(reviewId, request.toCommand()));
    }
}
