package com.playmarket.ecommerce.application.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 한 줄 (상품 변형 ID, 수량)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class CartLineCommand {
    private Long productId;
    private Integer quantity;
}
