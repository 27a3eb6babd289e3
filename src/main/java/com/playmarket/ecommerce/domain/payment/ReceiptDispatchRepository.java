package com.playmarket.ecommerce.domain.payment;

/**
 * 영수증 발송 기록 저장소 (Port)
 */
public interface ReceiptDispatchRepository {

    boolean existsByOrderId(Long orderId);

    /**
     * 유니크 제약 위반은 DataIntegrityViolationException으로 전달된다.
     */
    ReceiptDispatch insert(ReceiptDispatch dispatch);
}
