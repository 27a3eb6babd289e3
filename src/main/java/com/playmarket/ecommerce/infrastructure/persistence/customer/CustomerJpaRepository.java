package com.playmarket.ecommerce.infrastructure.persistence.customer;

import com.playmarket.ecommerce.domain.customer.Customer;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CustomerJpaRepository extends JpaRepository<Customer, Long> {
}
