package com.playmarket.ecommerce.domain.product;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.BatchSize;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 상품 변형(Variant) 엔티티
 *
 * 상품군 안의 구매 가능한 하나의 옵션 조합이다.
 * 가격, 할인가, 재고, 이미지, slug를 소유한다.
 *
 * 핵심 비즈니스 규칙:
 * - 실구매가(effective price) = 할인가(offerPrice)가 있으면 할인가, 없으면 정가(price)
 * - 가격은 0 이상, 할인가는 있을 경우 0 이상
 * - 재고는 음수 불가
 * - 상품군 안에서 옵션 조합(VariantAttributes)은 유일
 *   NULL 속성은 MySQL 유니크 인덱스에서 서로 다른 값으로 취급되므로
 *   옵션 조합을 attributes_key 컬럼으로 정규화해 (family_id, attributes_key)에 유니크 제약을 건다.
 */
@Entity
@Table(
        name = "product_variants",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_variant_attributes",
                        columnNames = {"family_id", "attributes_key"}
                )
        },
        indexes = {
                @Index(name = "idx_variant_family", columnList = "family_id, is_variant")
        }
)
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductVariant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "variant_id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "family_id", nullable = false)
    private ProductFamily family;

    @Column(name = "slug", nullable = false, unique = true)
    private String slug;

    @Embedded
    private VariantAttributes attributes;

    @Column(name = "attributes_key", nullable = false, length = 64)
    private String attributesKey;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "offer_price", precision = 12, scale = 2)
    private BigDecimal offerPrice;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "is_variant", nullable = false)
    private boolean variant;

    @ElementCollection
    @CollectionTable(name = "product_variant_images", joinColumns = @JoinColumn(name = "variant_id"))
    @OrderColumn(name = "position")
    @Column(name = "path")
    @BatchSize(size = 50)
    @Builder.Default
    private List<String> images = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 상품군에 새 변형을 추가하는 팩토리 메서드
     *
     * @param variant false면 상품군의 기본 상품
     */
    public static ProductVariant create(ProductFamily family, String slug, VariantAttributes attributes,
                                        BigDecimal price, BigDecimal offerPrice, Integer quantity,
                                        List<String> images, boolean variant) {
        if (family == null) {
            throw new IllegalArgumentException("상품군은 필수입니다");
        }
        validatePrice(price, offerPrice);
        validateQuantity(quantity);

        LocalDateTime now = LocalDateTime.now();
        ProductVariant created = ProductVariant.builder()
                .family(family)
                .slug(slug)
                .attributes(attributes)
                .attributesKey(attributes.key())
                .price(price)
                .offerPrice(offerPrice)
                .quantity(quantity)
                .variant(variant)
                .images(images == null ? new ArrayList<>() : new ArrayList<>(images))
                .createdAt(now)
                .updatedAt(now)
                .build();
        family.addVariant(created);
        return created;
    }

    public BigDecimal effectivePrice() {
        return offerPrice != null ? offerPrice : price;
    }

    public boolean hasStock(int requested) {
        return quantity != null && quantity >= requested;
    }

    public String getName() {
        return family.getName();
    }

    public String getProductType() {
        return family.getProductType();
    }

    public String getBrand() {
        return family.getBrand();
    }

    /**
     * 변형이면 기본 상품의 상품군 이름, 기본 상품이면 null
     */
    public String getProductRef() {
        return variant ? family.getName() : null;
    }

    public String valueOf(VariantAttribute attribute) {
        return attributes.valueOf(attribute);
    }

    public String firstImage() {
        return images.isEmpty() ? null : images.get(0);
    }

    void markAsBase() {
        this.variant = false;
        this.updatedAt = LocalDateTime.now();
    }

    public void changePricing(BigDecimal price, BigDecimal offerPrice, Integer quantity) {
        BigDecimal nextPrice = price != null ? price : this.price;
        validatePrice(nextPrice, offerPrice);
        if (quantity != null) {
            validateQuantity(quantity);
            this.quantity = quantity;
        }
        this.price = nextPrice;
        this.offerPrice = offerPrice;
        this.updatedAt = LocalDateTime.now();
    }

    public void changeAttributes(VariantAttributes attributes, String slug) {
        this.attributes = attributes;
        this.attributesKey = attributes.key();
        this.slug = slug;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 이미지 교체
     *
     * @return 교체되어 더 이상 참조되지 않는 기존 이미지 경로
     */
    public List<String> replaceImages(List<String> newImages) {
        List<String> removed = new ArrayList<>(this.images);
        this.images.clear();
        this.images.addAll(newImages);
        removed.removeAll(newImages);
        this.updatedAt = LocalDateTime.now();
        return removed;
    }

    private static void validatePrice(BigDecimal price, BigDecimal offerPrice) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("가격은 0 이상이어야 합니다");
        }
        if (offerPrice != null && offerPrice.signum() < 0) {
            throw new IllegalArgumentException("할인가는 0 이상이어야 합니다");
        }
    }

    private static void validateQuantity(Integer quantity) {
        if (quantity == null || quantity < 0) {
            throw new IllegalArgumentException("재고는 0 이상이어야 합니다");
        }
    }
}
