package com.playmarket.ecommerce.domain.product;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 모델별 묶음 (홈 화면 카드)
 *
 * 기본 상품들을 model 값으로 묶는다. model이 없는 상품끼리도 하나로 묶인다.
 * 대표는 입력 순서상 첫 상품, 최저가는 정가(price) 기준이다.
 */
public final class ModelGroup {

    private final ProductVariant representative;
    private final BigDecimal minPrice;

    private ModelGroup(ProductVariant representative, BigDecimal minPrice) {
        this.representative = representative;
        this.minPrice = minPrice;
    }

    /**
     * @param bases 노출 순서로 정렬된 기본 상품
     * @return 노출 순서(미지정은 마지막), 최저가 순으로 정렬된 모델 묶음
     */
    public static List<ModelGroup> group(List<ProductVariant> bases) {
        Map<String, ProductVariant> firstByModel = new LinkedHashMap<>();
        Map<String, BigDecimal> minByModel = new HashMap<>();
        for (ProductVariant base : bases) {
            String model = Objects.toString(base.getAttributes().getModel(), "");
            firstByModel.putIfAbsent(model, base);
            minByModel.merge(model, base.getPrice(), BigDecimal::min);
        }

        List<ModelGroup> groups = new ArrayList<>();
        firstByModel.forEach((model, first) -> groups.add(new ModelGroup(first, minByModel.get(model))));
        groups.sort(Comparator
                .comparing((ModelGroup g) -> g.representative.getFamily().getDisplayOrder(),
                        Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(ModelGroup::getMinPrice));
        return groups;
    }

    public ProductVariant getRepresentative() {
        return representative;
    }

    public BigDecimal getMinPrice() {
        return minPrice;
    }
}
