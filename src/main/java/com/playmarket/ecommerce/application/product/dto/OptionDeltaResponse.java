package com.playmarket.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.playmarket.ecommerce.domain.product.PriceDelta;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class OptionDeltaResponse {
    private String value;

    @JsonProperty("price_delta")
    private String priceDelta;

    public static OptionDeltaResponse from(PriceDelta delta) {
        return new OptionDeltaResponse(delta.getValue(), delta.getDelta());
    }
}
