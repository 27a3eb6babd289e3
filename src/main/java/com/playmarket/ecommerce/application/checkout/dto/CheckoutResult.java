package com.playmarket.ecommerce.application.checkout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.playmarket.ecommerce.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * checkout 결과. 결제 세션 생성 시 orderId를 참조값으로 사용한다.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutResult {
    @JsonProperty("order_id")
    private Long orderId;

    private BigDecimal amount;

    public static CheckoutResult from(Order order) {
        return new CheckoutResult(order.getId(), order.getAmount());
    }
}
