package com.playmarket.ecommerce.application.payment;

import com.playmarket.ecommerce.application.payment.dto.PaymentEvent;
import com.playmarket.ecommerce.domain.payment.ReceiptNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 결제사 이벤트 → 주문 확정
 *
 * 처리 정책:
 * - checkout.session.completed 이외 이벤트는 무시
 * - 세션에서 주문 ID를 찾을 수 없거나 주문이 없으면 로그만 남기고 종료 (재전송, 취소된 장바구니)
 * - 같은 결제사 거래 ID의 재전송은 아무것도 바꾸지 않음
 * - 정산 커밋 이후 영수증 발송 요청. 발송 실패는 정산에 영향을 주지 않음
 */
@Service
public class PaymentReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PaymentReconciliationService.class);

    private final PaymentSettlementService paymentSettlementService;
    private final ReceiptNotifier receiptNotifier;

    public PaymentReconciliationService(PaymentSettlementService paymentSettlementService,
                                        ReceiptNotifier receiptNotifier) {
        this.paymentSettlementService = paymentSettlementService;
        this.receiptNotifier = receiptNotifier;
    }

    public void reconcile(PaymentEvent event) {
        if (event == null || !event.isCheckoutCompleted()) {
            log.info("[PaymentReconciliationService] 처리 대상이 아닌 이벤트 - type={}",
                    event == null ? null : event.getType());
            return;
        }

        Optional<PaymentEvent.CheckoutSession> session = event.session();
        Optional<Long> orderId = session.flatMap(PaymentEvent.CheckoutSession::orderId);
        if (orderId.isEmpty()) {
            log.warn("[PaymentReconciliationService] 주문 ID를 확인할 수 없는 이벤트 - eventId={}", event.getId());
            return;
        }

        String providerTransactionId = session.get().getPaymentIntent();
        if (providerTransactionId == null || providerTransactionId.isBlank()) {
            log.warn("[PaymentReconciliationService] payment_intent 없는 이벤트 - eventId={}, orderId={}",
                    event.getId(), orderId.get());
            return;
        }

        SettlementOutcome outcome;
        try {
            outcome = paymentSettlementService.settle(orderId.get(), providerTransactionId,
                    session.get().paymentMethod());
        } catch (DataIntegrityViolationException e) {
            log.warn("[PaymentReconciliationService] 동시 정산 감지 (이미 처리됨) - orderId={}, providerTransactionId={}",
                    orderId.get(), providerTransactionId);
            return;
        }

        switch (outcome) {
            case SETTLED -> notifyReceipt(orderId.get());
            case ORDER_NOT_FOUND -> log.warn("[PaymentReconciliationService] 존재하지 않는 주문 - orderId={}, eventId={}",
                    orderId.get(), event.getId());
            case ALREADY_SETTLED -> log.info("[PaymentReconciliationService] 중복 이벤트 무시 - orderId={}, eventId={}",
                    orderId.get(), event.getId());
        }
    }

    private void notifyReceipt(Long orderId) {
        try {
            receiptNotifier.sendReceipt(orderId);
        } catch (RuntimeException e) {
            log.error("[PaymentReconciliationService] 영수증 발송 요청 실패 (정산은 유지) - orderId={}, error={}",
                    orderId, e.getMessage(), e);
        }
    }
}
