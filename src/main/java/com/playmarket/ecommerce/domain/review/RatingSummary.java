package com.playmarket.ecommerce.domain.review;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 평균 평점(소수점 첫째 자리 반올림)과 리뷰 수
 */
public final class RatingSummary {

    public static final RatingSummary EMPTY = new RatingSummary(BigDecimal.ZERO.setScale(1), 0);

    private final BigDecimal average;
    private final long count;

    private RatingSummary(BigDecimal average, long count) {
        this.average = average;
        this.count = count;
    }

    public static RatingSummary of(Double rawAverage, long count) {
        if (rawAverage == null || count == 0) {
            return EMPTY;
        }
        return new RatingSummary(BigDecimal.valueOf(rawAverage).setScale(1, RoundingMode.HALF_UP), count);
    }

    public BigDecimal getAverage() {
        return average;
    }

    public long getCount() {
        return count;
    }
}
