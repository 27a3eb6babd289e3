package com.playmarket.ecommerce.presentation.checkout;

import com.playmarket.ecommerce.application.checkout.CheckoutService;
import com.playmarket.ecommerce.application.checkout.dto.CheckoutResult;
import com.playmarket.ecommerce.presentation.checkout.request.CheckoutRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CheckoutController - 결제 대기 주문 생성 (POST /api/checkout)
 *
 * 같은 고객이 다시 호출하면 기존 PENDING 주문을 그대로 돌려준다.
 * 결제 세션 생성은 클라이언트가 응답의 order_id, amount로 결제사와 직접 진행한다.
 */
@RestController
@RequestMapping("/checkout")
public class CheckoutController {

    private final CheckoutService checkoutService;

    public CheckoutController(CheckoutService checkoutService) {
        this.checkoutService = checkoutService;
    }

    @PostMapping
    public ResponseEntity<CheckoutResult> checkout(
            @RequestHeader("X-USER-ID") Long customerId,
            @RequestBody CheckoutRequest request) {
        return ResponseEntity.ok(checkoutService.checkout(customerId, request.toCommands()));
    }
}
