package com.playmarket.ecommerce.domain.payment.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 영수증 발송 요청 메시지 (Kafka order.receipts 토픽)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ReceiptRequestedEvent {
    private Long orderId;
    private LocalDateTime requestedAt;

    public static ReceiptRequestedEvent of(Long orderId) {
        return new ReceiptRequestedEvent(orderId, LocalDateTime.now());
    }
}
