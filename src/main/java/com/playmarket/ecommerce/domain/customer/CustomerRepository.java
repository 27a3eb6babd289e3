package com.playmarket.ecommerce.domain.customer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 고객 저장소 (Port)
 */
public interface CustomerRepository {

    Optional<Customer> findById(Long customerId);

    List<Customer> findAllByIds(Collection<Long> customerIds);

    Customer save(Customer customer);
}
