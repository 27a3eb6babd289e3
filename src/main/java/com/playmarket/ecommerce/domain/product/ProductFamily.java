package com.playmarket.ecommerce.domain.product;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 상품군(Family) 엔티티
 *
 * 같은 이름을 공유하는 상품 변형들의 묶음이다.
 * 상품군이 공통 정보(이름, 타입, 브랜드, 설명, 노출 순서, 평점, 연관 상품)를 소유하고
 * 각 ProductVariant는 옵션 조합과 가격/재고만 가진다.
 *
 * 핵심 비즈니스 규칙:
 * - 상품군 이름은 전체에서 유일
 * - 상품군마다 기본 상품(variant = false)은 정확히 하나
 * - 노출 순서(displayOrder)가 없으면 목록에서 마지막에 정렬
 */
@Entity
@Table(name = "product_families")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductFamily {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "family_id")
    private Long id;

    @Column(name = "name", nullable = false, unique = true)
    private String name;

    @Column(name = "product_type", nullable = false)
    private String productType;

    @Column(name = "brand")
    private String brand;

    @Column(name = "description", length = 4000)
    private String description;

    @Column(name = "display_order")
    private Integer displayOrder;

    @Column(name = "ratings", precision = 2, scale = 1)
    @Builder.Default
    private BigDecimal ratings = BigDecimal.ZERO;

    @Column(name = "review_count", nullable = false)
    @Builder.Default
    private Integer reviewCount = 0;

    @ElementCollection
    @CollectionTable(name = "product_family_related", joinColumns = @JoinColumn(name = "family_id"))
    @OrderColumn(name = "position")
    @Column(name = "related_name")
    @Builder.Default
    private List<String> relatedProducts = new ArrayList<>();

    @OneToMany(mappedBy = "family", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<ProductVariant> variants = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static ProductFamily create(String name, String productType, String brand,
                                       String description, Integer displayOrder) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
        if (productType == null || productType.isBlank()) {
            throw new IllegalArgumentException("상품 타입은 필수입니다");
        }

        LocalDateTime now = LocalDateTime.now();
        return ProductFamily.builder()
                .name(name.trim())
                .productType(productType.trim())
                .brand(brand)
                .description(description)
                .displayOrder(displayOrder)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    void addVariant(ProductVariant variant) {
        this.variants.add(variant);
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 구성원 제거. 기본 상품이 제거되면 남은 구성원 중 ID가 가장 작은 변형이 기본 상품이 된다.
     */
    public void removeVariant(ProductVariant variant) {
        this.variants.remove(variant);
        if (!variant.isVariant() && !variants.isEmpty()) {
            membersBaseFirst().get(0).markAsBase();
        }
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isEmpty() {
        return variants.isEmpty();
    }

    /**
     * 기본 상품 (variant = false)
     */
    public Optional<ProductVariant> findBase() {
        return variants.stream()
                .filter(v -> !v.isVariant())
                .findFirst();
    }

    public Optional<ProductVariant> findVariant(VariantAttributes attributes) {
        return variants.stream()
                .filter(v -> v.getAttributes().equals(attributes))
                .findFirst();
    }

    public boolean hasVariant(VariantAttributes attributes) {
        return findVariant(attributes).isPresent();
    }

    /**
     * 기본 상품을 먼저, 나머지는 ID 순서로 정렬한 구성원 목록
     */
    public List<ProductVariant> membersBaseFirst() {
        List<ProductVariant> members = new ArrayList<>(variants);
        members.sort(Comparator.comparing(ProductVariant::isVariant)
                .thenComparing(ProductVariant::getId, Comparator.nullsLast(Comparator.naturalOrder())));
        return members;
    }

    public void updateDetails(String brand, String description) {
        if (brand != null) {
            this.brand = brand;
        }
        if (description != null) {
            this.description = description;
        }
        this.updatedAt = LocalDateTime.now();
    }

    public void replaceRelatedProducts(List<String> names) {
        this.relatedProducts.clear();
        if (names != null) {
            names.stream()
                    .filter(n -> n != null && !n.isBlank())
                    .map(String::trim)
                    .filter(n -> !n.equals(this.name))
                    .distinct()
                    .forEach(this.relatedProducts::add);
        }
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 리뷰 요약 반영 (평균 평점, 리뷰 수)
     */
    public void applyReviewSummary(BigDecimal averageRating, int count) {
        this.ratings = averageRating;
        this.reviewCount = count;
        this.updatedAt = LocalDateTime.now();
    }
}
