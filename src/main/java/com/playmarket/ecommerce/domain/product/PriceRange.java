package com.playmarket.ecommerce.domain.product;

import java.math.BigDecimal;

/**
 * 실구매가 범위. 대상이 없으면 0 ~ 0
 */
public final class PriceRange {

    public static final PriceRange EMPTY = new PriceRange(BigDecimal.ZERO, BigDecimal.ZERO);

    private final BigDecimal min;
    private final BigDecimal max;

    public PriceRange(BigDecimal min, BigDecimal max) {
        this.min = min;
        this.max = max;
    }

    public static PriceRange ofNullable(BigDecimal min, BigDecimal max) {
        if (min == null || max == null) {
            return EMPTY;
        }
        return new PriceRange(min, max);
    }

    public BigDecimal getMin() {
        return min;
    }

    public BigDecimal getMax() {
        return max;
    }
}
