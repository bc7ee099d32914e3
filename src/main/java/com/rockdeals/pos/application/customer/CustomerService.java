package com.rockdeals.pos.application.customer;

import com.rockdeals.pos.domain.customer.Customer;
import com.rockdeals.pos.domain.customer.CustomerNotFoundException;
import com.rockdeals.pos.domain.customer.CustomerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * CustomerService - 고객 등록/조회
 */
@Slf4j
@Service
public class CustomerService {

    private final CustomerRepository customerRepository;
    private final Clock clock;

    public CustomerService(CustomerRepository customerRepository, Clock clock) {
        this.customerRepository = customerRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<Customer> findCustomer(Long customerId) {
        if (customerId == null) {
            return Optional.empty();
        }
        return customerRepository.findById(customerId);
    }

    /**
     * @throws CustomerNotFoundException 고객이 없는 경우
     */
    @Transactional(readOnly = true)
    public Customer getCustomer(Long customerId) {
        return findCustomer(customerId)
                .orElseThrow(() -> new CustomerNotFoundException(customerId));
    }

    @Transactional(readOnly = true)
    public List<Customer> listCustomers() {
        return customerRepository.findAll();
    }

    /**
     * 고객 등록
     *
     * @throws IllegalArgumentException 이름이 비어 있는 경우
     */
    @Transactional
    public Customer createCustomer(String name, String email, String phone, String address) {
        Customer customer = customerRepository.save(
                Customer.create(name, email, phone, address, LocalDateTime.now(clock)));
        log.info("[CustomerService] 고객 등록 - customerId={}", customer.getCustomerId());
        return customer;
    }
}
