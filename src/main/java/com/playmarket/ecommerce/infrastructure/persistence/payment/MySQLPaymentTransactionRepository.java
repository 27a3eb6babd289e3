package com.playmarket.ecommerce.infrastructure.persistence.payment;

import com.playmarket.ecommerce.domain.payment.PaymentTransaction;
import com.playmarket.ecommerce.domain.payment.PaymentTransactionRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@Primary
public class MySQLPaymentTransactionRepository implements PaymentTransactionRepository {

    private final PaymentTransactionJpaRepository transactionJpaRepository;

    public MySQLPaymentTransactionRepository(PaymentTransactionJpaRepository transactionJpaRepository) {
        this.transactionJpaRepository = transactionJpaRepository;
    }

    @Override
    public Optional<PaymentTransaction> findByProviderTransactionId(String providerTransactionId) {
        return transactionJpaRepository.findByProviderTransactionId(providerTransactionId);
    }

    @Override
    public Optional<PaymentTransaction> findByOrderId(Long orderId) {
        return transactionJpaRepository.findByOrderId(orderId);
    }

    @Override
    public List<PaymentTransaction> findAllByIds(Collection<Long> transactionIds) {
        if (transactionIds.isEmpty()) {
            return List.of();
        }
        return transactionJpaRepository.findAllById(transactionIds);
    }

    @Override
    public PaymentTransaction insert(PaymentTransaction transaction) {
        // 즉시 flush해서 유니크 제약 위반을 이 시점에 드러낸다
        return transactionJpaRepository.saveAndFlush(transaction);
    }
}
