package com.playmarket.ecommerce.domain.product;

/**
 * 상품군 안에서 변형(variant)을 구분하는 옵션 속성
 *
 * 선언 순서가 상세 화면의 옵션 목록 순서이다.
 */
public enum VariantAttribute {
    MODEL("model"),
    CONTROLLER("controller"),
    CONDITION("condition"),
    MEMORY("memory");

    private final String fieldName;

    VariantAttribute(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
