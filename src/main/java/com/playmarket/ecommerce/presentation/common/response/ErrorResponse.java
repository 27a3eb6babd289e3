package com.playmarket.ecommerce.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.playmarket.ecommerce.common.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * API 에러 응답
 *
 * {"error_code": "DOMAIN_PRODUCT_NOT_FOUND", "error_message": "...", "timestamp": "...", "request_id": "req-..."}
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @JsonProperty("request_id")
    private String requestId;

    public static ErrorResponse of(String errorCode, String errorMessage) {
        return new ErrorResponse(errorCode, errorMessage, Instant.now(), newRequestId());
    }

    /**
     * message가 비어 있으면 ErrorCode의 기본 메시지
     */
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        String resolved = (message == null || message.isBlank()) ? errorCode.getMessage() : message;
        return of(errorCode.getCode(), resolved);
    }

    private static String newRequestId() {
        return "req-" + UUID.randomUUID().toString().substring(0, 12);
    }
}
