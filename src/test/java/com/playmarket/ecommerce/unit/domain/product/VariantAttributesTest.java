package com.playmarket.ecommerce.unit.domain.product;

import com.playmarket.ecommerce.domain.product.VariantAttributes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.playmarket.ecommerce.config.TestDataFactory.attrs;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VariantAttributes 도메인 테스트")
class VariantAttributesTest {

    // ========== 유니크 키 ==========

    @Test
    @DisplayName("key - 64자 16진수, 같은 조합이면 같은 값")
    void testKey_Stable() {
        String key = attrs("Disc", null, "New", "825GB").key();

        assertEquals(64, key.length());
        assertTrue(key.matches("[0-9a-f]{64}"));
        assertEquals(key, attrs("Disc", null, "New", "825GB").key());
    }

    @Test
    @DisplayName("key - 비어 있는 값과 공백 값은 null과 같은 키")
    void testKey_BlankEqualsNull() {
        VariantAttributes allNull = attrs(null, null, null, null);

        assertEquals(allNull.key(), attrs(" ", "", null, "  ").key());
        assertEquals(attrs("Disc", null, null, null).key(), attrs(" Disc ", null, null, null).key());
    }

    @Test
    @DisplayName("key - 값의 위치와 구분자가 섞인 값을 구분")
    void testKey_PositionSensitive() {
        assertNotEquals(attrs("Disc", null, null, null).key(), attrs(null, "Disc", null, null).key());
        assertNotEquals(attrs("a|b", null, null, null).key(), attrs("a", "b", null, null).key());
        assertNotEquals(attrs("~", null, null, null).key(), attrs(null, null, null, null).key());
    }
}
