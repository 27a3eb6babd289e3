package com.playmarket.ecommerce.application.review.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 관리자 리뷰 등록/수정 명령 (고객 참조 없이 작성자 이름/아바타를 직접 지정)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewCommand {
    private String productName;
    private Integer rating;
    private String comment;
    private String customerName;
    private String customerAvatar;
}
