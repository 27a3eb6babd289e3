package com.playmarket.ecommerce.domain.product;

import com.playmarket.ecommerce.common.exception.ErrorCode;
import com.playmarket.ecommerce.common.exception.InvalidRequestException;

/**
 * 주문 수량이 현재 재고를 넘는 경우
 *
 * 요청 검증 오류의 하위 타입이며 주문 저장 전에 발생한다.
 */
public class InsufficientStockException extends InvalidRequestException {

    public InsufficientStockException(ProductVariant variant, int requested) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                String.format("상품: %s, 요청 수량: %d, 재고: %d", variant.getSlug(), requested, variant.getQuantity()));
    }
}
