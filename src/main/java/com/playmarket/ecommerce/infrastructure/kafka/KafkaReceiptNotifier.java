package com.playmarket.ecommerce.infrastructure.kafka;

import com.playmarket.ecommerce.domain.payment.ReceiptNotifier;
import com.playmarket.ecommerce.domain.payment.event.ReceiptRequestedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 영수증 발송 요청을 Kafka로 발행하는 ReceiptNotifier 구현
 *
 * - Key: orderId → 같은 주문은 같은 파티션
 * - 비동기 전송, 결과는 콜백에서 로그로만 확인
 */
@Component
public class KafkaReceiptNotifier implements ReceiptNotifier {

    private static final Logger log = LoggerFactory.getLogger(KafkaReceiptNotifier.class);

    private final KafkaTemplate<String, ReceiptRequestedEvent> kafkaTemplate;
    private final String topicName;

    public KafkaReceiptNotifier(KafkaTemplate<String, ReceiptRequestedEvent> kafkaTemplate,
                                @Value("${kafka.topics.order-receipts}") String topicName) {
        this.kafkaTemplate = kafkaTemplate;
        this.topicName = topicName;
    }

    @Override
    public void sendReceipt(Long orderId) {
        String key = String.valueOf(orderId);
        CompletableFuture<SendResult<String, ReceiptRequestedEvent>> future =
                kafkaTemplate.send(topicName, key, ReceiptRequestedEvent.of(orderId));

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                var metadata = result.getRecordMetadata();
                log.info("[KafkaReceiptNotifier] 영수증 요청 발행 - topic={}, partition={}, offset={}, orderId={}",
                        metadata.topic(), metadata.partition(), metadata.offset(), orderId);
            } else {
                log.error("[KafkaReceiptNotifier] 영수증 요청 발행 실패 - topic={}, orderId={}, error={}",
                        topicName, orderId, ex.getMessage(), ex);
            }
        });
    }
}
