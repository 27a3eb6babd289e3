package com.playmarket.ecommerce.domain.order;

import com.playmarket.ecommerce.common.exception.InvalidRequestException;
import lombok.Getter;

import java.util.Locale;

/**
 * 주문 상태
 *
 * PENDING → SHIPPED | SUCCESS | CANCEL
 * SUCCESS는 결제 정산으로만 도달한다.
 */
@Getter
public enum OrderState {
    PENDING("pending"),
    SHIPPED("shipped"),
    SUCCESS("success"),
    CANCEL("cancel");

    private final String value;

    OrderState(String value) {
        this.value = value;
    }

    /**
     * 쿼리 파라미터 값("pending" 등)으로 변환
     */
    public static OrderState fromValue(String value) {
        if (value == null) {
            throw new InvalidRequestException("주문 상태 값이 없습니다");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (OrderState state : values()) {
            if (state.value.equals(normalized)) {
                return state;
            }
        }
        throw new InvalidRequestException("유효하지 않은 주문 상태입니다: " + value);
    }
}
