package com.rockdeals.pos.domain.customer;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Customer 도메인 엔티티
 * 판매에 선택적으로 연결되는 고객 (영수증 표시용)
 */
@Entity
@Table(name = "customers")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Customer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "email")
    private String email;

    @Column(name = "phone", length = 32)
    private String phone;

    @Column(name = "address")
    private String address;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static Customer create(String name, String email, String phone, String address,
                                  LocalDateTime createdAt) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("고객 이름은 비어 있을 수 없습니다");
        }
        return Customer.builder()
                .name(name.trim())
                .email(email)
                .phone(phone)
                .address(address)
                .createdAt(createdAt)
                .build();
    }
}
