package com.playmarket.ecommerce.infrastructure.persistence.payment;

import com.playmarket.ecommerce.domain.payment.PaymentTransaction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PaymentTransactionJpaRepository extends JpaRepository<PaymentTransaction, Long> {

    Optional<PaymentTransaction> findByProviderTransactionId(String providerTransactionId);

    Optional<PaymentTransaction> findByOrderId(Long orderId);
}
