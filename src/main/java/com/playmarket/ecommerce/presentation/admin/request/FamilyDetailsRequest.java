package com.playmarket.ecommerce.presentation.admin.request;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 상품군 공통 정보 수정 요청 DTO. 생략한 필드는 기존 값 유지
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class FamilyDetailsRequest {
    private String brand;
    private String description;
}
