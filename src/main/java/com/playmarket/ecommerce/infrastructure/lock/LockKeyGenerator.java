package com.playmarket.ecommerce.infrastructure.lock;

/**
 * 분산락 키 규칙: resource_type:resource_id
 */
public final class LockKeyGenerator {

    /**
     * 고객별 checkout 락
     * 예: checkout(customerId=10, ...) → "checkout:customer:10"
     */
    public static final String CHECKOUT_KEY_TEMPLATE = "'checkout:customer:' + #p0";

    private LockKeyGenerator() {
    }
}
