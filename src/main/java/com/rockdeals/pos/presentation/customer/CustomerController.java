package com.rockdeals.pos.presentation.customer;

import com.rockdeals.pos.application.customer.CustomerService;
import com.rockdeals.pos.presentation.customer.request.CustomerCreateRequest;
import com.rockdeals.pos.presentation.customer.response.CustomerResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * CustomerController - 고객 등록/조회 API
 */
@RestController
@RequestMapping("/customers")
public class CustomerController {

    private final CustomerService customerService;

    public CustomerController(CustomerService customerService) {
        this.customerService = customerService;
    }

    /**
     * GET /customers - 전체 고객 (이름순)
     */
    @GetMapping
    public ResponseEntity<List<CustomerResponse>> listCustomers() {
        return ResponseEntity.ok(customerService.listCustomers().stream()
                .map(CustomerResponse::from)
                .collect(Collectors.toList()));
    }

    /**
     * GET /customers/{customer_id}
     */
    @GetMapping("/{customer_id}")
    public ResponseEntity<CustomerResponse> getCustomer(@PathVariable("customer_id") Long customerId) {
        return ResponseEntity.ok(CustomerResponse.from(customerService.getCustomer(customerId)));
    }

    /**
     * POST /customers - 고객 등록
     */
    @PostMapping
    public ResponseEntity<CustomerResponse> createCustomer(@RequestBody CustomerCreateRequest request) {
        CustomerResponse response = CustomerResponse.from(customerService.createCustomer(
                request.getName(), request.getEmail(), request.getPhone(), request.getAddress()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
