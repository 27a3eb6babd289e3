package com.playmarket.ecommerce.domain.payment;

/**
 * 결제 영수증 발송 요청 (Port)
 *
 * 호출 측은 결과를 기다리지 않으며, 실패해도 이미 끝난 정산은 되돌리지 않는다.
 */
public interface ReceiptNotifier {

    void sendReceipt(Long orderId);
}
