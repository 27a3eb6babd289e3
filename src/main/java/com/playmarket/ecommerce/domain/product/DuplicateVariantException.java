package com.playmarket.ecommerce.domain.product;

import com.playmarket.ecommerce.common.exception.DomainException;
import com.playmarket.ecommerce.common.exception.ErrorCode;

/**
 * (상품 타입, 상품명, 옵션 조합)이 이미 등록된 경우 (409)
 */
public class DuplicateVariantException extends DomainException {

    public DuplicateVariantException(String productName, VariantAttributes attributes) {
        super(ErrorCode.DUPLICATE_VARIANT, productName + " " + attributes);
    }
}
