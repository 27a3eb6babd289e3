package com.playmarket.ecommerce.presentation.checkout.request;

import com.playmarket.ecommerce.application.checkout.dto.CartLineCommand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 체크아웃 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {
    private List<CheckoutItemRequest> items;

    public List<CartLineCommand> toCommands() {
        if (items == null) {
            return new ArrayList<>();
        }
        return items.stream()
                .map(item -> new CartLineCommand(item.getProductId(), item.getQuantity()))
                .collect(Collectors.toList());
    }
}
