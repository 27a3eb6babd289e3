package com.playmarket.ecommerce.application.payment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * 결제사 웹훅 이벤트
 *
 * {
 *   "id": "evt_...",
 *   "type": "checkout.session.completed",
 *   "data": { "object": { "id": "cs_...", "payment_intent": "pi_...",
 *                         "client_reference_id": "42",
 *                         "payment_method_types": ["card"],
 *                         "line_items": [ { "description": "42" } ] } }
 * }
 *
 * 주문 ID는 첫 번째 line item의 description에, 없으면 client_reference_id에 실려 온다.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentEvent {

    public static final String CHECKOUT_COMPLETED = "checkout.session.completed";

    private String id;
    private String type;
    private EventData data;

    public boolean isCheckoutCompleted() {
        return CHECKOUT_COMPLETED.equals(type);
    }

    public Optional<CheckoutSession> session() {
        return Optional.ofNullable(data).map(EventData::getObject);
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventData {
        private CheckoutSession object;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CheckoutSession {
        private String id;

        @JsonProperty("payment_intent")
        private String paymentIntent;

        @JsonProperty("client_reference_id")
        private String clientReferenceId;

        @JsonProperty("payment_method_types")
        private List<String> paymentMethodTypes;

        @JsonProperty("line_items")
        private List<LineItem> lineItems;

        /**
         * 세션에 실린 주문 ID. 숫자가 아니면 empty
         */
        public Optional<Long> orderId() {
            String raw = null;
            if (lineItems != null && !lineItems.isEmpty() && lineItems.get(0) != null) {
                raw = lineItems.get(0).getDescription();
            }
            if (raw == null || raw.isBlank()) {
                raw = clientReferenceId;
            }
            if (raw == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(Long.parseLong(raw.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        public String paymentMethod() {
            if (paymentMethodTypes == null || paymentMethodTypes.isEmpty()) {
                return null;
            }
            return paymentMethodTypes.get(0);
        }
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LineItem {
        private String description;
    }
}
