package com.playmarket.ecommerce.unit.domain.order;

import com.playmarket.ecommerce.common.exception.InvalidRequestException;
import com.playmarket.ecommerce.domain.customer.Address;
import com.playmarket.ecommerce.domain.order.Order;
import com.playmarket.ecommerce.domain.order.OrderLine;
import com.playmarket.ecommerce.domain.order.OrderState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OrderTest - 주문 생성과 상태 전이
 */
@DisplayName("Order 도메인 테스트")
class OrderTest {

    private static final Long CUSTOMER_ID = 7L;

    private static List<OrderLine> lines() {
        return List.of(
                OrderLine.snapshot(11L, "PlayStation 5", "playstation-5-disc", "uploads/ps5.jpg",
                        new BigDecimal("499.99"), 1),
                OrderLine.snapshot(21L, "DualSense", "dualsense-white", null, new BigDecimal("69.50"), 2)
        );
    }

    // ========== 생성 ==========

    @Test
    @DisplayName("createPending - 금액은 단가 × 수량 합계, PENDING, pending_key = 고객 ID")
    void testCreatePending() {
        // When
        Order order = Order.createPending(CUSTOMER_ID, lines(), new Address("a", "z", "c", "KR"));

        // Then
        assertEquals(new BigDecimal("638.99"), order.getAmount());
        assertEquals(OrderState.PENDING, order.getState());
        assertEquals(CUSTOMER_ID, order.getPendingKey());
        assertTrue(order.isPending());
        assertNull(order.getTransactionId());
        assertEquals("KR", order.getShippingAddress().getCountry());
    }

    @Test
    @DisplayName("createPending - 항목이 없거나 고객이 없으면 거부")
    void testCreatePending_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> Order.createPending(CUSTOMER_ID, List.of(), null));
        assertThrows(IllegalArgumentException.class, () -> Order.createPending(null, lines(), null));
    }

    @Test
    @DisplayName("OrderLine.snapshot - 수량 1 미만, 음수 단가 거부")
    void testOrderLine_Invalid() {
        assertThrows(IllegalArgumentException.class, () ->
                OrderLine.snapshot(1L, "n", "s", null, BigDecimal.ONE, 0));
        assertThrows(IllegalArgumentException.class, () ->
                OrderLine.snapshot(1L, "n", "s", null, new BigDecimal("-1"), 1));
    }

    // ========== 상태 전이 ==========

    @Test
    @DisplayName("cancel - 두 번 호출해도 CANCEL, pending_key 해제")
    void testCancel_Idempotent() {
        Order order = Order.createPending(CUSTOMER_ID, lines(), null);

        order.cancel();
        order.cancel();

        assertEquals(OrderState.CANCEL, order.getState());
        assertNull(order.getPendingKey());
    }

    @Test
    @DisplayName("ship - 현재 상태와 무관하게 SHIPPED")
    void testShip() {
        Order order = Order.createPending(CUSTOMER_ID, lines(), null);
        order.cancel();

        order.ship();

        assertEquals(OrderState.SHIPPED, order.getState());
        assertNull(order.getPendingKey());
    }

    @Test
    @DisplayName("settle - SUCCESS 전환, 거래 ID/결제 수단 기록, 금액은 그대로")
    void testSettle() {
        Order order = Order.createPending(CUSTOMER_ID, lines(), null);

        order.settle(9001L, "card");

        assertEquals(OrderState.SUCCESS, order.getState());
        assertEquals(9001L, order.getTransactionId());
        assertEquals("card", order.getPaymentMethod());
        assertEquals(new BigDecimal("638.99"), order.getAmount());
        assertNull(order.getPendingKey());
        assertThrows(IllegalArgumentException.class, () -> order.settle(null, "card"));
    }

    @Test
    @DisplayName("OrderState.fromValue - 대소문자 무시, 알 수 없는 값은 400")
    void testOrderStateFromValue() {
        assertEquals(OrderState.SUCCESS, OrderState.fromValue("Success"));
        assertEquals(OrderState.CANCEL, OrderState.fromValue(" cancel "));
        assertThrows(InvalidRequestException.class, () -> OrderState.fromValue("refunded"));
    }
}
