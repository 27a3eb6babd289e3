package com.playmarket.ecommerce.infrastructure.persistence.payment;

import com.playmarket.ecommerce.domain.payment.ReceiptDispatch;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReceiptDispatchJpaRepository extends JpaRepository<ReceiptDispatch, Long> {

    boolean existsByOrderId(Long orderId);
}
