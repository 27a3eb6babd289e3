package com.playmarket.ecommerce.domain.product;

import java.util.Comparator;

/**
 * 목록 정렬 방식
 *
 * 가격 정렬은 그룹핑/페이지 절단 이후 해당 페이지 안에서만 적용된다.
 */
public enum ListingSort {
    MAX_PRICE("max_price"),
    MIN_PRICE("min_price"),
    ORDER("order");

    private final String parameter;

    ListingSort(String parameter) {
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }

    /**
     * 알 수 없는 값이나 null은 기본 정렬(ORDER)
     */
    public static ListingSort fromParameter(String value) {
        if (value != null) {
            for (ListingSort sort : values()) {
                if (sort.parameter.equalsIgnoreCase(value.trim())) {
                    return sort;
                }
            }
        }
        return ORDER;
    }

    public Comparator<ProductVariant> comparator() {
        return switch (this) {
            case MAX_PRICE -> Comparator.comparing(ProductVariant::effectivePrice).reversed();
            case MIN_PRICE -> Comparator.comparing(ProductVariant::effectivePrice);
            case ORDER -> ProductListing.DISPLAY_ORDER;
        };
    }
}
