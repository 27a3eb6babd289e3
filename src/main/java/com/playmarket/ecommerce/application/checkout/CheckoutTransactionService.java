package com.playmarket.ecommerce.application.checkout;

import com.playmarket.ecommerce.domain.customer.Address;
import com.playmarket.ecommerce.domain.order.Order;
import com.playmarket.ecommerce.domain.order.OrderLine;
import com.playmarket.ecommerce.domain.order.OrderRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * PENDING 주문 저장 (트랜잭션 경계)
 *
 * CheckoutService가 별도 Bean으로 호출한다 (같은 클래스 내부 호출에는 프록시가 적용되지 않음).
 * pending_key 유니크 제약 위반 시 DataIntegrityViolationException이 그대로 전파되고 트랜잭션은 롤백된다.
 */
@Service
public class CheckoutTransactionService {

    private final OrderRepository orderRepository;

    public CheckoutTransactionService(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    @Transactional(propagation = Propagation.REQUIRED, rollbackFor = Exception.class)
    public Order createPendingOrder(Long customerId, List<OrderLine> lines, Address shippingAddress) {
        return orderRepository.saveAndFlush(Order.createPending(customerId, lines, shippingAddress));
    }
}
