package com.playmarket.ecommerce.domain.payment;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 결제 거래 저장소 (Port). 추가와 조회만 제공한다.
 */
public interface PaymentTransactionRepository {

    Optional<PaymentTransaction> findByProviderTransactionId(String providerTransactionId);

    Optional<PaymentTransaction> findByOrderId(Long orderId);

    List<PaymentTransaction> findAllByIds(Collection<Long> transactionIds);

    /**
     * 유니크 제약 위반은 DataIntegrityViolationException으로 전달된다.
     */
    PaymentTransaction insert(PaymentTransaction transaction);
}
