package com.playmarket.ecommerce.domain.review;

import com.playmarket.ecommerce.common.util.PageParams;

import java.util.List;
import java.util.Optional;

/**
 * 리뷰 저장소 (Port)
 */
public interface ReviewRepository {

    Optional<Review> findById(Long reviewId);

    Optional<Review> findByCustomerIdAndProductName(Long customerId, String productName);

    /**
     * 최신순 페이지 조회
     *
     * @param productName null이면 전체
     */
    List<Review> findPage(String productName, PageParams pageParams);

    long count(String productName);

    /**
     * 상품군의 평점 요약
     */
    RatingSummary summarize(String productName);

    /**
     * 유니크 제약 위반은 DataIntegrityViolationException으로 전달된다.
     */
    Review saveAndFlush(Review review);

    void delete(Review review);
}
