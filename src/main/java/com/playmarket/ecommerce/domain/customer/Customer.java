package com.playmarket.ecommerce.domain.customer;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 고객 엔티티
 *
 * 가입, 인증은 외부 협력자가 담당하며 이 서비스는 조회와 스냅샷 복사만 한다.
 */
@Entity
@Table(name = "customers")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Customer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "customer_id")
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Column(name = "phone")
    private String phone;

    @Column(name = "avatar")
    private String avatar;

    @Embedded
    private Address address;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static Customer create(String name, String email, String phone, String avatar, Address address) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("고객 이름은 필수입니다");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("이메일은 필수입니다");
        }
        return Customer.builder()
                .name(name)
                .email(email)
                .phone(phone)
                .avatar(avatar)
                .address(address)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
