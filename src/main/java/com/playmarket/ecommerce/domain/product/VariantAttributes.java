package com.playmarket.ecommerce.domain.product;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * 옵션 조합 값 객체 (model, controller, condition, memory)
 *
 * 모든 값은 null 허용이며, 빈 문자열은 null로 정규화한다.
 * 같은 상품군 안에서 옵션 조합은 유일하다.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VariantAttributes {

    @Column(name = "model")
    private String model;

    @Column(name = "controller")
    private String controller;

    // condition은 MySQL 예약어
    @Column(name = "item_condition")
    private String condition;

    @Column(name = "memory")
    private String memory;

    private VariantAttributes(String model, String controller, String condition, String memory) {
        this.model = blankToNull(model);
        this.controller = blankToNull(controller);
        this.condition = blankToNull(condition);
        this.memory = blankToNull(memory);
    }

    public static VariantAttributes of(String model, String controller, String condition, String memory) {
        return new VariantAttributes(model, controller, condition, memory);
    }

    public String valueOf(VariantAttribute attribute) {
        return switch (attribute) {
            case MODEL -> model;
            case CONTROLLER -> controller;
            case CONDITION -> condition;
            case MEMORY -> memory;
        };
    }

    /**
     * 지정한 속성만 value로 바꾼 새 조합
     */
    public VariantAttributes with(VariantAttribute attribute, String value) {
        return switch (attribute) {
            case MODEL -> new VariantAttributes(value, controller, condition, memory);
            case CONTROLLER -> new VariantAttributes(model, value, condition, memory);
            case CONDITION -> new VariantAttributes(model, controller, value, memory);
            case MEMORY -> new VariantAttributes(model, controller, condition, value);
        };
    }

    /**
     * 유니크 제약용 조합 키 (SHA-256 hex, 64자)
     *
     * null과 빈 값은 같은 키가 되고, 값의 위치가 다르면 다른 키가 된다.
     */
    public String key() {
        String canonical = String.join("|", encode(model), encode(controller), encode(condition), encode(memory));
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256을 사용할 수 없습니다", e);
        }
    }

    // null은 "~", 값은 "길이:값"
    private static String encode(String value) {
        return value == null ? "~" : value.length() + ":" + value;
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariantAttributes)) return false;
        VariantAttributes that = (VariantAttributes) o;
        return Objects.equals(model, that.model)
                && Objects.equals(controller, that.controller)
                && Objects.equals(condition, that.condition)
                && Objects.equals(memory, that.memory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, controller, condition, memory);
    }

    @Override
    public String toString() {
        return "VariantAttributes{model=" + model + ", controller=" + controller
                + ", condition=" + condition + ", memory=" + memory + "}";
    }
}
