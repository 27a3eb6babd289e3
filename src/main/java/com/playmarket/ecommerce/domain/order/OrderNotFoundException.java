package com.playmarket.ecommerce.domain.order;

import com.playmarket.ecommerce.common.exception.DomainException;
import com.playmarket.ecommerce.common.exception.ErrorCode;

public class OrderNotFoundException extends DomainException {

    public OrderNotFoundException(Long orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "Order ID: " + orderId);
    }
}
