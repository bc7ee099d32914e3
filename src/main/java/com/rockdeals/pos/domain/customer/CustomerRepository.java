package com.rockdeals.pos.domain.customer;

import java.util.List;
import java.util.Optional;

/**
 * CustomerRepository - Customer 저장소 (Port)
 */
public interface CustomerRepository {

    Optional<Customer> findById(Long customerId);

    boolean existsById(Long customerId);

    Customer save(Customer customer);

    /**
     * 전체 고객 (이름순)
     */
    List<Customer> findAll();
}
