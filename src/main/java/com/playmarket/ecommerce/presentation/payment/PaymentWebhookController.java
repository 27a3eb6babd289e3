package com.playmarket.ecommerce.presentation.payment;

import com.playmarket.ecommerce.application.payment.PaymentReconciliationService;
import com.playmarket.ecommerce.application.payment.dto.PaymentEvent;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * PaymentWebhookController - 결제사 웹훅 수신 (POST /api/payments/webhook)
 *
 * 서명 검증은 앞단 게이트웨이가 담당한다.
 * 처리 대상이 아닌 이벤트, 이미 정산된 주문도 200으로 응답해 결제사의 재전송을 멈춘다.
 */
@RestController
@RequestMapping("/payments")
public class PaymentWebhookController {

    private final PaymentReconciliationService paymentReconciliationService;

    public PaymentWebhookController(PaymentReconciliationService paymentReconciliationService) {
        this.paymentReconciliationService = paymentReconciliationService;
    }

    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Boolean>> receive(@RequestBody PaymentEvent event) {
        paymentReconciliationService.reconcile(event);
        return ResponseEntity.ok(Map.of("received", true));
    }
}
