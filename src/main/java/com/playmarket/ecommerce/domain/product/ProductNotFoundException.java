package com.playmarket.ecommerce.domain.product;

import com.playmarket.ecommerce.common.exception.DomainException;
import com.playmarket.ecommerce.common.exception.ErrorCode;

public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(String identifier) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "상품: " + identifier);
    }
}
