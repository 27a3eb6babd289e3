package com.playmarket.ecommerce.infrastructure.config;

import com.playmarket.ecommerce.domain.payment.event.ReceiptRequestedEvent;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka Producer/Consumer 설정 (영수증 발송 요청)
 *
 * Producer:
 * - Key: orderId, Value: ReceiptRequestedEvent (JSON)
 * - acks=all, enable.idempotence=true, retries=3
 *
 * Consumer:
 * - enable-auto-commit=false, AckMode.MANUAL: 처리 성공 후 커밋 (at-least-once)
 * - 중복 수신은 ReceiptDispatch 유니크 제약으로 걸러낸다
 */
@EnableKafka
@Configuration
public class KafkaConfig {

    @Value("${kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${kafka.consumer.group-id}")
    private String consumerGroupId;

    @Value("${kafka.listener.auto-startup:true}")
    private boolean listenerAutoStartup;

    @Bean
    public ProducerFactory<String, ReceiptRequestedEvent> receiptProducerFactory() {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);

        configProps.put(ProducerConfig.ACKS_CONFIG, "all");
        configProps.put(ProducerConfig.RETRIES_CONFIG, 3);
        configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        configProps.put(ProducerConfig.LINGER_MS_CONFIG, 10);

        // 브로커 장애 시 send()가 요청 스레드를 오래 붙잡지 않도록 메타데이터 대기 시간 제한
        configProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, 3000);

        return new DefaultKafkaProducerFactory<>(configProps);
    }

    @Bean
    public KafkaTemplate<String, ReceiptRequestedEvent> receiptKafkaTemplate() {
        return new KafkaTemplate<>(receiptProducerFactory());
    }

    @Bean
    public ConsumerFactory<String, ReceiptRequestedEvent> receiptConsumerFactory() {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroupId);
        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 10);

        JsonDeserializer<ReceiptRequestedEvent> valueDeserializer =
                new JsonDeserializer<>(ReceiptRequestedEvent.class, false);
        valueDeserializer.addTrustedPackages("com.playmarket.ecommerce.domain.payment.event");

        return new DefaultKafkaConsumerFactory<>(configProps, new StringDeserializer(), valueDeserializer);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, ReceiptRequestedEvent> receiptListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, ReceiptRequestedEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(receiptConsumerFactory());
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        factory.setConcurrency(2);
        factory.setAutoStartup(listenerAutoStartup);
        return factory;
    }
}
