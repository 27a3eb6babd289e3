package com.playmarket.ecommerce.infrastructure.persistence.customer;

import com.playmarket.ecommerce.domain.customer.Customer;
import com.playmarket.ecommerce.domain.customer.CustomerRepository;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemoryCustomerRepository - 고객 저장소 (테스트용 인메모리)
 */
public class InMemoryCustomerRepository implements CustomerRepository {

    private final ConcurrentHashMap<Long, Customer> customers = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(100L);

    @Override
    public Optional<Customer> findById(Long customerId) {
        return Optional.ofNullable(customers.get(customerId));
    }

    @Override
    public List<Customer> findAllByIds(Collection<Long> customerIds) {
        return customerIds.stream()
                .map(customers::get)
                .filter(customer -> customer != null)
                .collect(Collectors.toList());
    }

    @Override
    public Customer save(Customer customer) {
        if (customer.getId() == null) {
            ReflectionTestUtils.setField(customer, "id", sequence.incrementAndGet());
        }
        customers.put(customer.getId(), customer);
        return customer;
    }
}
