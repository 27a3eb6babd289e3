package com.playmarket.ecommerce.domain.customer;

import com.playmarket.ecommerce.common.exception.DomainException;
import com.playmarket.ecommerce.common.exception.ErrorCode;

public class CustomerNotFoundException extends DomainException {

    public CustomerNotFoundException(Long customerId) {
        super(ErrorCode.CUSTOMER_NOT_FOUND, "Customer ID: " + customerId);
    }
}
