package com.playmarket.ecommerce.infrastructure.persistence.order;

import com.playmarket.ecommerce.common.util.PageParams;
import com.playmarket.ecommerce.domain.order.Order;
import com.playmarket.ecommerce.domain.order.OrderRepository;
import com.playmarket.ecommerce.domain.order.OrderState;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 */
@Repository
@Primary
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findById(orderId);
    }

    @Override
    public Optional<Order> findPendingByCustomerId(Long customerId) {
        return orderJpaRepository.findByPendingKey(customerId);
    }

    @Override
    public List<Order> findPage(OrderState state, PageParams pageParams) {
        // page는 1부터 시작, PageRequest는 0부터 시작
        Pageable pageable = PageRequest.of(pageParams.getPage() - 1, pageParams.getLimit(),
                Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "id")));
        return orderJpaRepository.findPage(state, pageable);
    }

    @Override
    public long count(OrderState state) {
        return orderJpaRepository.countByState(state);
    }

    @Override
    public Order saveAndFlush(Order order) {
        return orderJpaRepository.saveAndFlush(order);
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }
}
