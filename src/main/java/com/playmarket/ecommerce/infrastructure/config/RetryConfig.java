package com.playmarket.ecommerce.infrastructure.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Spring Retry 활성화
 *
 * 재시도 정책은 각 메서드의 @Retryable에서 정의한다.
 * - PaymentSettlementService.settle, OrderLifecycleService.cancelOrder/shipOrder: 낙관적 락 충돌
 * - ReviewTransactionService.upsert: 동시 최초 작성으로 인한 유니크 제약 충돌
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
