package com.rockdeals.pos.infrastructure.persistence.customer;

import com.rockdeals.pos.domain.customer.Customer;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CustomerJpaRepository extends JpaRepository<Customer, Long> {

    List<Customer> findAllByOrderByNameAscCustomerIdAsc();
}
