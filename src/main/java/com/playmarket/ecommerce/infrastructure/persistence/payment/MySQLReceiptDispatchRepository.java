package com.playmarket.ecommerce.infrastructure.persistence.payment;

import com.playmarket.ecommerce.domain.payment.ReceiptDispatch;
import com.playmarket.ecommerce.domain.payment.ReceiptDispatchRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class MySQLReceiptDispatchRepository implements ReceiptDispatchRepository {

    private final ReceiptDispatchJpaRepository receiptDispatchJpaRepository;

    public MySQLReceiptDispatchRepository(ReceiptDispatchJpaRepository receiptDispatchJpaRepository) {
        this.receiptDispatchJpaRepository = receiptDispatchJpaRepository;
    }

    @Override
    public boolean existsByOrderId(Long orderId) {
        return receiptDispatchJpaRepository.existsByOrderId(orderId);
    }

    @Override
    public ReceiptDispatch insert(ReceiptDispatch dispatch) {
        return receiptDispatchJpaRepository.saveAndFlush(dispatch);
    }
}
