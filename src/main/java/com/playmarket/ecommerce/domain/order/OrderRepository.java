package com.playmarket.ecommerce.domain.order;

import com.playmarket.ecommerce.common.util.PageParams;

import java.util.List;
import java.util.Optional;

/**
 * 주문 저장소 (Port)
 */
public interface OrderRepository {

    Optional<Order> findById(Long orderId);

    /**
     * 고객의 PENDING 주문 (최대 하나)
     */
    Optional<Order> findPendingByCustomerId(Long customerId);

    /**
     * 최신순 페이지 조회
     *
     * @param state null이면 전체 상태
     */
    List<Order> findPage(OrderState state, PageParams pageParams);

    long count(OrderState state);

    /**
     * 저장 후 즉시 flush. pending_key 유니크 제약 위반은
     * DataIntegrityViolationException으로 호출자에게 전달된다.
     */
    Order saveAndFlush(Order order);

    Order save(Order order);
}
