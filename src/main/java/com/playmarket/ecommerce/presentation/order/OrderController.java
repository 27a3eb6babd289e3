package com.playmarket.ecommerce.presentation.order;

import com.playmarket.ecommerce.application.order.OrderLifecycleService;
import com.playmarket.ecommerce.application.order.dto.OrderListResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * OrderController - 주문 상태 전이, 목록 조회
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderLifecycleService orderLifecycleService;

    public OrderController(OrderLifecycleService orderLifecycleService) {
        this.orderLifecycleService = orderLifecycleService;
    }

    /**
     * 주문 취소. 이미 취소된 주문에 다시 호출해도 성공
     */
    @PatchMapping("/{order_id}/cancel")
    public ResponseEntity<Void> cancelOrder(@PathVariable("order_id") Long orderId) {
        orderLifecycleService.cancelOrder(orderId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{order_id}/ship")
    public ResponseEntity<Void> shipOrder(@PathVariable("order_id") Long orderId) {
        orderLifecycleService.shipOrder(orderId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    public ResponseEntity<OrderListResponse> getOrderList(
            @RequestParam(value = "state", required = false) String state,
            @RequestParam(value = "page", required = false) String page,
            @RequestParam(value = "limit", required = false) String limit) {
        return ResponseEntity.ok(orderLifecycleService.listOrders(state, page, limit));
    }
}
