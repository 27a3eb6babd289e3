package com.playmarket.ecommerce.domain.order;

import com.playmarket.ecommerce.domain.customer.Address;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문 엔티티
 *
 * 핵심 비즈니스 규칙:
 * - 생성 시 항상 PENDING, 금액은 항목 스냅샷의 합계로 고정
 * - 고객당 PENDING 주문은 최대 하나 (pending_key 유니크 컬럼)
 * - 생성 후 변경 가능한 값은 state, transactionId, paymentMethod뿐
 * - 취소/배송 처리는 현재 상태와 무관하게 같은 값을 쓰는 멱등 연산
 */
@Entity
@Table(
        name = "orders",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_orders_pending_key", columnNames = {"pending_key"})
        },
        indexes = {
                @Index(name = "idx_orders_customer_state", columnList = "customer_id, state"),
                @Index(name = "idx_orders_state_created", columnList = "state, created_at")
        }
)
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long id;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @ElementCollection
    @CollectionTable(name = "order_lines", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "line_no")
    @Builder.Default
    private List<OrderLine> lines = new ArrayList<>();

    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private OrderState state;

    /**
     * PENDING인 동안 customerId, 그 외에는 null.
     * MySQL 유니크 인덱스는 NULL을 중복 허용하므로 고객당 PENDING 하나만 강제된다.
     */
    @Column(name = "pending_key")
    private Long pendingKey;

    @Column(name = "transaction_id")
    private Long transactionId;

    @Column(name = "payment_method")
    private String paymentMethod;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "address", column = @Column(name = "ship_address")),
            @AttributeOverride(name = "zipCode", column = @Column(name = "ship_zip_code")),
            @AttributeOverride(name = "city", column = @Column(name = "ship_city")),
            @AttributeOverride(name = "country", column = @Column(name = "ship_country"))
    })
    private Address shippingAddress;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * PENDING 주문 생성
     *
     * 비즈니스 규칙:
     * - 항목은 1개 이상
     * - 금액 = Σ(단가 × 수량)
     */
    public static Order createPending(Long customerId, List<OrderLine> lines, Address shippingAddress) {
        if (customerId == null) {
            throw new IllegalArgumentException("고객 ID는 필수입니다");
        }
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("주문 항목은 1개 이상이어야 합니다");
        }

        BigDecimal amount = lines.stream()
                .map(OrderLine::subtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        LocalDateTime now = LocalDateTime.now();
        return Order.builder()
                .customerId(customerId)
                .lines(new ArrayList<>(lines))
                .amount(amount)
                .state(OrderState.PENDING)
                .pendingKey(customerId)
                .shippingAddress(shippingAddress == null ? null : shippingAddress.copy())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isPending() {
        return state == OrderState.PENDING;
    }

    public void cancel() {
        changeState(OrderState.CANCEL);
    }

    public void ship() {
        changeState(OrderState.SHIPPED);
    }

    /**
     * 결제 정산 반영
     *
     * 결제 정산 흐름에서만 호출된다. 고객 요청으로 SUCCESS에 도달하는 경로는 없다.
     */
    public void settle(Long transactionId, String paymentMethod) {
        if (transactionId == null) {
            throw new IllegalArgumentException("거래 ID는 필수입니다");
        }
        this.transactionId = transactionId;
        this.paymentMethod = paymentMethod;
        changeState(OrderState.SUCCESS);
    }

    private void changeState(OrderState next) {
        this.state = next;
        this.pendingKey = next == OrderState.PENDING ? customerId : null;
        this.updatedAt = LocalDateTime.now();
    }
}
