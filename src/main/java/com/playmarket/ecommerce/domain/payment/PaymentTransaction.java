package com.playmarket.ecommerce.domain.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 결제 거래 기록 (불변)
 *
 * 결제 완료 이벤트 하나당 정확히 하나 생성되며 수정, 삭제되지 않는다.
 *
 * 멱등성 보장:
 * - provider_transaction_id 유니크: 같은 결제 이벤트 재전송 시 중복 INSERT 방지
 * - order_id 유니크: 주문과 1:1
 */
@Entity
@Immutable
@Table(
        name = "transactions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_tx_provider_id", columnNames = {"provider_transaction_id"}),
                @UniqueConstraint(name = "uk_tx_order_id", columnNames = {"order_id"})
        }
)
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "transaction_id")
    private Long id;

    @Column(name = "provider_transaction_id", nullable = false, length = 128)
    private String providerTransactionId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    private TransactionType type;

    @Column(name = "payment_method")
    private String paymentMethod;

    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static PaymentTransaction sell(String providerTransactionId, Long orderId, String paymentMethod,
                                          BigDecimal amount, Long customerId) {
        if (providerTransactionId == null || providerTransactionId.isBlank()) {
            throw new IllegalArgumentException("결제사 거래 ID는 필수입니다");
        }
        return PaymentTransaction.builder()
                .providerTransactionId(providerTransactionId)
                .orderId(orderId)
                .type(TransactionType.SELL)
                .paymentMethod(paymentMethod)
                .amount(amount)
                .customerId(customerId)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
