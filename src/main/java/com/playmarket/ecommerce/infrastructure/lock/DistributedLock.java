package com.playmarket.ecommerce.infrastructure.lock;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * Redisson 분산락 어노테이션
 *
 * 사용 예:
 * <pre>
 * &#64;DistributedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
 * public CheckoutResult checkout(Long customerId, List&lt;CartLineCommand&gt; cart) { ... }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    /**
     * 락 키 (Spring EL). #p0, #p1 ... 으로 메서드 파라미터 참조
     */
    String key();

    /**
     * 락 획득 대기 시간
     */
    long waitTime() default 5;

    /**
     * 락 점유 시간. 초과하면 자동 해제
     */
    long leaseTime() default 3;

    TimeUnit timeUnit() default TimeUnit.SECONDS;
}
