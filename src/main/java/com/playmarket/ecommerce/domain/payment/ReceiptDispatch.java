package com.playmarket.ecommerce.domain.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 영수증 발송 처리 기록
 *
 * order_id 유니크 제약으로 같은 주문의 영수증 메시지가 다시 들어와도 한 번만 처리된다.
 */
@Entity
@Table(
        name = "receipt_dispatches",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_receipt_order", columnNames = {"order_id"})
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReceiptDispatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "receipt_dispatch_id")
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "dispatched_at", nullable = false)
    private LocalDateTime dispatchedAt;

    private ReceiptDispatch(Long orderId) {
        this.orderId = orderId;
        this.dispatchedAt = LocalDateTime.now();
    }

    public static ReceiptDispatch of(Long orderId) {
        return new ReceiptDispatch(orderId);
    }
}
