package com.playmarket.ecommerce.unit.domain.product;

import com.playmarket.ecommerce.domain.product.ModelGroup;
import com.playmarket.ecommerce.domain.product.ProductFamily;
import com.playmarket.ecommerce.domain.product.ProductVariant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static com.playmarket.ecommerce.config.TestDataFactory.attrs;
import static com.playmarket.ecommerce.config.TestDataFactory.family;
import static com.playmarket.ecommerce.config.TestDataFactory.variant;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ModelGroup 도메인 테스트")
class ModelGroupTest {

    @Test
    @DisplayName("group - 같은 모델은 첫 상품이 대표, 최저가는 할인 전 정가")
    void testGroup_SameModel() {
        // Given
        ProductVariant ally = variant(family(1L, "Ally", "handheld", "Asus", 2), 11L,
                attrs("Z1", null, "New", null), "599.00", null, 3, false);
        ProductVariant legion = variant(family(2L, "Legion", "handheld", "Lenovo", 3), 21L,
                attrs("Z1", null, "New", null), "549.00", "399.00", 3, false);

        // When
        List<ModelGroup> groups = ModelGroup.group(List.of(ally, legion));

        // Then
        assertEquals(1, groups.size());
        assertSame(ally, groups.get(0).getRepresentative());
        assertEquals(new BigDecimal("549.00"), groups.get(0).getMinPrice());
    }

    @Test
    @DisplayName("group - 모델이 없는 상품끼리 묶이고, 노출 순서 미지정은 마지막")
    void testGroup_NullModelAndOrdering() {
        // Given
        ProductFamily unordered = family(3L, "Aya", "handheld", "Aya", null);
        ProductVariant aya = variant(unordered, 31L, attrs(null, null, "New", null), "299.00", null, 3, false);
        ProductVariant grip = variant(family(4L, "Grip", "handheld", "Nitro", 5), 41L,
                attrs(null, null, "New", null), "19.99", null, 3, false);
        ProductVariant deck = variant(family(5L, "Deck", "handheld", "Valve", 1), 51L,
                attrs("OLED", null, "New", null), "549.00", null, 3, false);
        ProductVariant onyx = variant(family(6L, "Onyx", "handheld", "Onyx", 1), 61L,
                attrs("S1", null, "New", null), "449.00", null, 3, false);

        // When
        List<ModelGroup> groups = ModelGroup.group(List.of(aya, grip, deck, onyx));

        // Then: 같은 노출 순서면 최저가 순
        assertEquals(List.of(onyx, deck, aya), groups.stream()
                .map(ModelGroup::getRepresentative)
                .collect(Collectors.toList()));
        assertEquals(new BigDecimal("19.99"), groups.get(2).getMinPrice());
    }

    @Test
    @DisplayName("group - 빈 입력은 빈 목록")
    void testGroup_Empty() {
        assertTrue(ModelGroup.group(List.of()).isEmpty());
    }
}
