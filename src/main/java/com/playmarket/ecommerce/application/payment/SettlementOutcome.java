package com.playmarket.ecommerce.application.payment;

/**
 * 결제 정산 처리 결과
 */
public enum SettlementOutcome {
    /** 거래 기록 생성 + 주문 SUCCESS 전환 */
    SETTLED,
    /** 같은 결제사 거래 ID로 이미 정산됨 (재전송) */
    ALREADY_SETTLED,
    /** 이벤트의 주문이 존재하지 않음 */
    ORDER_NOT_FOUND
}
