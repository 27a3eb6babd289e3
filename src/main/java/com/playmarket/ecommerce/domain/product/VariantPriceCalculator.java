package com.playmarket.ecommerce.domain.product;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 상품군 옵션별 가격 차이 계산 (도메인 서비스)
 *
 * 현재 보고 있는 변형 P와 속성 A, 후보 값 V에 대해:
 * 1. V가 P의 A 값과 같으면 "+0"
 * 2. 나머지 속성은 P와 같고 A만 V인 구성원을 찾는다. 없으면 "+0"
 *    (구매할 수 없는 조합이라도 목록에서 빼지 않고 가격 힌트만 생략)
 * 3. 있으면 effective(match) - effective(P)
 *
 * 상품군 전체가 이미 로딩되어 있다는 전제로 메모리에서 비교한다.
 */
public class VariantPriceCalculator {

    /**
     * @param viewed 현재 보고 있는 변형 (상품군 구성원이어야 함)
     * @param family 같은 상품군의 모든 구성원 (기본 상품 우선 순서)
     * @return 속성별 (값, 가격 차이) 목록. 속성 순서는 VariantAttribute 선언 순서
     */
    public Map<VariantAttribute, List<PriceDelta>> calculate(ProductVariant viewed, List<ProductVariant> family) {
        Objects.requireNonNull(viewed, "viewed는 null이 될 수 없습니다");
        Objects.requireNonNull(family, "family는 null이 될 수 없습니다");

        Map<VariantAttribute, List<PriceDelta>> options = new EnumMap<>(VariantAttribute.class);
        for (VariantAttribute attribute : VariantAttribute.values()) {
            List<PriceDelta> deltas = new ArrayList<>();
            for (String value : distinctValues(family, attribute)) {
                deltas.add(deltaFor(viewed, family, attribute, value));
            }
            options.put(attribute, deltas);
        }
        return options;
    }

    PriceDelta deltaFor(ProductVariant viewed, List<ProductVariant> family,
                        VariantAttribute attribute, String value) {
        if (Objects.equals(viewed.valueOf(attribute), value)) {
            return PriceDelta.neutral(value);
        }

        VariantAttributes wanted = viewed.getAttributes().with(attribute, value);
        Optional<ProductVariant> match = family.stream()
                .filter(member -> member.getAttributes().equals(wanted))
                .findFirst();
        if (match.isEmpty()) {
            return PriceDelta.neutral(value);
        }

        BigDecimal difference = match.get().effectivePrice().subtract(viewed.effectivePrice());
        return PriceDelta.of(value, difference);
    }

    private Set<String> distinctValues(List<ProductVariant> family, VariantAttribute attribute) {
        Set<String> values = new LinkedHashSet<>();
        for (ProductVariant member : family) {
            String value = member.valueOf(attribute);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
}
