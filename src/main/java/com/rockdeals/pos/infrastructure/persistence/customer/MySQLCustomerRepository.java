package com.rockdeals.pos.infrastructure.persistence.customer;

import com.rockdeals.pos.domain.customer.Customer;
import com.rockdeals.pos.domain.customer.CustomerRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Customer Repository 구현
 */
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
    public boolean existsById(Long customerId) {
        return customerJpaRepository.existsById(customerId);
    }

    @Override
    public Customer save(Customer customer) {
        return customerJpaRepository.save(customer);
    }

    @Override
    public List<Customer> findAll() {
        return customerJpaRepository.findAllByOrderByNameAscCustomerIdAsc();
    }
}
