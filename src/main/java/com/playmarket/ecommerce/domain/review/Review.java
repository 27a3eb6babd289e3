package com.playmarket.ecommerce.domain.review;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 상품 리뷰 엔티티
 *
 * 핵심 비즈니스 규칙:
 * - (고객, 상품군 이름) 조합당 리뷰는 하나. 같은 고객이 다시 작성하면 내용을 갱신한다.
 * - 고객 이름, 아바타는 작성 시점 스냅샷
 * - 평점은 1 ~ 5
 */
@Entity
@Table(
        name = "reviews",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_review_customer_product", columnNames = {"customer_id", "product_name"})
        },
        indexes = {
                @Index(name = "idx_review_product", columnList = "product_name")
        }
)
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Review {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "review_id")
    private Long id;

    /**
     * 작성 고객. 관리자가 등록한 리뷰는 null
     */
    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "rating", nullable = false)
    private Integer rating;

    @Column(name = "comment", length = 2000)
    private String comment;

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Column(name = "customer_avatar")
    private String customerAvatar;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Review write(Long customerId, String productName, int rating, String comment,
                               String customerName, String customerAvatar) {
        validateRating(rating);
        LocalDateTime now = LocalDateTime.now();
        return Review.builder()
                .customerId(customerId)
                .productName(productName)
                .rating(rating)
                .comment(comment)
                .customerName(customerName)
                .customerAvatar(customerAvatar)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 재작성. 고객 스냅샷도 현재 값으로 다시 복사한다.
     */
    public void rewrite(int rating, String comment, String customerName, String customerAvatar) {
        validateRating(rating);
        this.rating = rating;
        this.comment = comment;
        this.customerName = customerName;
        this.customerAvatar = customerAvatar;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 부분 수정. null 필드는 기존 값을 유지한다.
     *
     * @return 교체되어 더 이상 참조되지 않는 기존 아바타 경로, 없으면 null
     */
    public String edit(Integer rating, String comment, String customerName, String customerAvatar) {
        if (rating != null) {
            validateRating(rating);
            this.rating = rating;
        }
        if (comment != null) {
            this.comment = comment;
        }
        if (customerName != null && !customerName.isBlank()) {
            this.customerName = customerName;
        }
        String replacedAvatar = null;
        if (customerAvatar != null && !customerAvatar.equals(this.customerAvatar)) {
            replacedAvatar = this.customerAvatar;
            this.customerAvatar = customerAvatar;
        }
        this.updatedAt = LocalDateTime.now();
        return replacedAvatar;
    }

    public boolean hasCustomerReference() {
        return customerId != null;
    }

    private static void validateRating(int rating) {
        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw new IllegalArgumentException("평점은 1 이상 5 이하여야 합니다: " + rating);
        }
    }
}
