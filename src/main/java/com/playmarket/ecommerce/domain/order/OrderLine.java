package com.playmarket.ecommerce.domain.order;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 주문 항목 스냅샷
 *
 * 주문 시점의 상품명, 이미지, 단가를 복사해 둔다.
 * 이후 상품 가격이나 이름이 바뀌어도 주문 금액은 다시 계산하지 않는다.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderLine {

    @Column(name = "variant_id", nullable = false)
    private Long variantId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "slug", nullable = false)
    private String slug;

    @Column(name = "image")
    private String image;

    @Column(name = "unit_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    private OrderLine(Long variantId, String productName, String slug, String image,
                      BigDecimal unitPrice, Integer quantity) {
        this.variantId = variantId;
        this.productName = productName;
        this.slug = slug;
        this.image = image;
        this.unitPrice = unitPrice;
        this.quantity = quantity;
    }

    public static OrderLine snapshot(Long variantId, String productName, String slug, String image,
                                     BigDecimal unitPrice, int quantity) {
        if (quantity < 1) {
            throw new IllegalArgumentException("주문 수량은 1 이상이어야 합니다");
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new IllegalArgumentException("단가는 0 이상이어야 합니다");
        }
        return new OrderLine(variantId, productName, slug, image, unitPrice, quantity);
    }

    public BigDecimal subtotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
