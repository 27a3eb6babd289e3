package com.playmarket.ecommerce.infrastructure.kafka;

import com.playmarket.ecommerce.domain.payment.ReceiptDispatch;
import com.playmarket.ecommerce.domain.payment.ReceiptDispatchRepository;
import com.playmarket.ecommerce.domain.payment.event.ReceiptRequestedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * 영수증 발송 요청 Consumer
 *
 * 메일 발송 자체는 외부 협력자 담당이며 여기서는 발송 처리 기록만 남긴다.
 *
 * 커밋 정책:
 * - 처리 성공 → ack
 * - 이미 처리된 주문 (유니크 제약 위반) → 중복으로 보고 ack
 * - 그 외 실패 → ack 하지 않음, 재수신 후 재처리
 */
@Service
public class ReceiptEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(ReceiptEventConsumer.class);

    private final ReceiptDispatchRepository receiptDispatchRepository;

    public ReceiptEventConsumer(ReceiptDispatchRepository receiptDispatchRepository) {
        this.receiptDispatchRepository = receiptDispatchRepository;
    }

    @KafkaListener(
            topics = "${kafka.topics.order-receipts}",
            groupId = "${kafka.consumer.group-id}",
            containerFactory = "receiptListenerContainerFactory"
    )
    public void listen(@Payload ReceiptRequestedEvent event,
                       @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
                       @Header(KafkaHeaders.OFFSET) long offset,
                       Acknowledgment acknowledgment) {
        log.info("[ReceiptEventConsumer] 메시지 수신 - partition={}, offset={}, orderId={}",
                partition, offset, event.getOrderId());

        try {
            handle(event);
            acknowledgment.acknowledge();
        } catch (DataIntegrityViolationException e) {
            log.warn("[ReceiptEventConsumer] 중복 메시지 (이미 처리됨) - partition={}, offset={}, orderId={}",
                    partition, offset, event.getOrderId());
            acknowledgment.acknowledge();
        } catch (Exception e) {
            log.error("[ReceiptEventConsumer] 처리 실패 (재처리 예정) - partition={}, offset={}, orderId={}, error={}",
                    partition, offset, event.getOrderId(), e.getMessage(), e);
        }
    }

    void handle(ReceiptRequestedEvent event) {
        if (receiptDispatchRepository.existsByOrderId(event.getOrderId())) {
            log.info("[ReceiptEventConsumer] 이미 발송된 영수증 - orderId={}", event.getOrderId());
            return;
        }
        receiptDispatchRepository.insert(ReceiptDispatch.of(event.getOrderId()));
        log.info("[ReceiptEventConsumer] 영수증 발송 처리 완료 - orderId={}, requestedAt={}",
                event.getOrderId(), event.getRequestedAt());
    }
}
