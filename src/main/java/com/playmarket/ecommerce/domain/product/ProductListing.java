package com.playmarket.ecommerce.domain.product;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 목록 페이지 정렬 규칙
 *
 * 상품군별 대표 선정과 페이지 절단은 저장소에서 끝난 상태로 들어오고,
 * 정렬은 잘린 페이지 안에서만 적용한다.
 */
public final class ProductListing {

    /**
     * 노출 순서 오름차순, 순서 미지정은 마지막, 같으면 ID 순
     */
    static final Comparator<ProductVariant> DISPLAY_ORDER = Comparator
            .comparing((ProductVariant v) -> v.getFamily().getDisplayOrder(),
                    Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ProductVariant::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private ProductListing() {
    }

    public static List<ProductVariant> sortPage(List<ProductVariant> page, ListingSort sort) {
        List<ProductVariant> sorted = new ArrayList<>(page);
        sorted.sort(sort.comparator());
        return sorted;
    }
}
