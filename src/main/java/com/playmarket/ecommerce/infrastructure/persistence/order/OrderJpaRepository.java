package com.playmarket.ecommerce.infrastructure.persistence.order;

import com.playmarket.ecommerce.domain.order.Order;
import com.playmarket.ecommerce.domain.order.OrderState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    /**
     * pending_key 유니크 인덱스로 조회 (고객당 최대 1건)
     */
    Optional<Order> findByPendingKey(Long pendingKey);

    @Query("SELECT o FROM Order o WHERE (:state IS NULL OR o.state = :state)")
    List<Order> findPage(@Param("state") OrderState state, Pageable pageable);

    @Query("SELECT COUNT(o) FROM Order o WHERE (:state IS NULL OR o.state = :state)")
    long countByState(@Param("state") OrderState state);
}
