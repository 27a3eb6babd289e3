package com.playmarket.ecommerce.domain.product;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * 옵션 값 하나와, 그 값을 선택했을 때의 실구매가 차이
 *
 * 표기:
 * - 차이가 없거나 해당 조합이 없으면 "+0"
 * - 양수: "+20.00", 음수: "-20.00" (소수점 둘째 자리)
 */
public final class PriceDelta {

    public static final String NEUTRAL = "+0";

    private final String value;
    private final String delta;

    private PriceDelta(String value, String delta) {
        this.value = value;
        this.delta = delta;
    }

    public static PriceDelta neutral(String value) {
        return new PriceDelta(value, NEUTRAL);
    }

    public static PriceDelta of(String value, BigDecimal difference) {
        return new PriceDelta(value, format(difference));
    }

    static String format(BigDecimal difference) {
        int sign = difference.signum();
        if (sign == 0) {
            return NEUTRAL;
        }
        String scaled = difference.setScale(2, RoundingMode.HALF_UP).toPlainString();
        return sign > 0 ? "+" + scaled : scaled;
    }

    public String getValue() {
        return value;
    }

    public String getDelta() {
        return delta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PriceDelta)) return false;
        PriceDelta that = (PriceDelta) o;
        return Objects.equals(value, that.value) && Objects.equals(delta, that.delta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, delta);
    }

    @Override
    public String toString() {
        return value + "(" + delta + ")";
    }
}
