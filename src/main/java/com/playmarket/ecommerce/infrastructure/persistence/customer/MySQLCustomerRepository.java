package com.playmarket.ecommerce.infrastructure.persistence.customer;

import com.playmarket.ecommerce.domain.customer.Customer;
import com.playmarket.ecommerce.domain.customer.CustomerRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@Primary
public class MySQLCustomerRepository implements CustomerRepository {

    private final CustomerJpaRepository customerJpaRepository;

    public MySQLCustomerRepository(CustomerJpaRepository customerJpaRepository) {
        this.customerJpaRepository = customerJpaRepository;
    }

    @Override
    public Optional<Customer> findById(Long customerId) {
        return customerJpaRepository.findById(customerId);
    }

    @Override
    public List<Customer> findAllByIds(Collection<Long> customerIds) {
        if (customerIds.isEmpty()) {
            return List.of();
        }
        return customerJpaRepository.findAllById(customerIds);
    }

    @Override
    public Customer save(Customer customer) {
        return customerJpaRepository.save(customer);
    }
}
