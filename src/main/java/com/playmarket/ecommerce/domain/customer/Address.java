package com.playmarket.ecommerce.domain.customer;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 배송지 주소 (고객 프로필과 주문 스냅샷에서 공통 사용)
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Address {

    @Column(name = "address")
    private String address;

    @Column(name = "zip_code")
    private String zipCode;

    @Column(name = "city")
    private String city;

    @Column(name = "country")
    private String country;

    /**
     * 값 복사본. 주문 스냅샷이 고객 정보 변경의 영향을 받지 않도록 한다.
     */
    public Address copy() {
        return new Address(address, zipCode, city, country);
    }
}
