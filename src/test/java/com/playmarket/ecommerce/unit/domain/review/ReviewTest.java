package com.playmarket.ecommerce.unit.domain.review;

import com.playmarket.ecommerce.domain.review.RatingSummary;
import com.playmarket.ecommerce.domain.review.Review;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Review / RatingSummary 도메인 테스트")
class ReviewTest {

    @Test
    @DisplayName("write - 평점은 1 ~ 5")
    void testWrite_RatingRange() {
        assertThrows(IllegalArgumentException.class, () -> Review.write(1L, "PS5", 0, "c", "Kim", null));
        assertThrows(IllegalArgumentException.class, () -> Review.write(1L, "PS5", 6, "c", "Kim", null));
        Review review = Review.write(1L, "PS5", 5, "최고", "Kim", "uploads/a.png");
        assertTrue(review.hasCustomerReference());
    }

    @Test
    @DisplayName("rewrite - 평점, 내용, 고객 스냅샷 갱신")
    void testRewrite() {
        Review review = Review.write(1L, "PS5", 3, "보통", "Kim", null);

        review.rewrite(4, "괜찮음", "Kim Minsu", "uploads/new.png");

        assertEquals(4, review.getRating());
        assertEquals("괜찮음", review.getComment());
        assertEquals("Kim Minsu", review.getCustomerName());
        assertEquals("uploads/new.png", review.getCustomerAvatar());
    }

    @Test
    @DisplayName("RatingSummary - 소수점 첫째 자리 반올림, 리뷰가 없으면 0.0 / 0")
    void testRatingSummary() {
        RatingSummary summary = RatingSummary.of(4.25, 4);
        assertEquals(new BigDecimal("4.3"), summary.getAverage());
        assertEquals(4, summary.getCount());

        assertEquals(new BigDecimal("0.0"), RatingSummary.of(null, 0).getAverage());
        assertSame(RatingSummary.EMPTY, RatingSummary.of(3.0, 0));
    }
}
