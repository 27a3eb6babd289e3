package com.playmarket.ecommerce.application.checkout;

import com.playmarket.ecommerce.application.checkout.dto.CartLineCommand;
import com.playmarket.ecommerce.application.checkout.dto.CheckoutResult;
import com.playmarket.ecommerce.common.exception.ApplicationException;
import com.playmarket.ecommerce.common.exception.ErrorCode;
import com.playmarket.ecommerce.common.exception.InvalidRequestException;
import com.playmarket.ecommerce.domain.customer.Customer;
import com.playmarket.ecommerce.domain.customer.CustomerNotFoundException;
import com.playmarket.ecommerce.domain.customer.CustomerRepository;
import com.playmarket.ecommerce.domain.order.Order;
import com.playmarket.ecommerce.domain.order.OrderLine;
import com.playmarket.ecommerce.domain.order.OrderRepository;
import com.playmarket.ecommerce.domain.product.InsufficientStockException;
import com.playmarket.ecommerce.domain.product.ProductRepository;
import com.playmarket.ecommerce.domain.product.ProductVariant;
import com.playmarket.ecommerce.infrastructure.lock.DistributedLock;
import com.playmarket.ecommerce.infrastructure.lock.LockKeyGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checkout 오케스트레이터
 *
 * 순서 (각 단계가 다음 단계의 전제 조건):
 * 1. 장바구니 형식 검증
 * 2. 고객 확인
 * 3. 상품 일괄 조회. 하나도 없으면 거부, 찾지 못한 줄은 건너뜀
 * 4. 재고 확인 (조회만, 차감/예약 없음)
 * 5. 주문 시점 실구매가로 단가 스냅샷
 * 6. 이미 PENDING 주문이 있으면 그 주문을 그대로 반환
 * 7. 없으면 PENDING 주문 생성
 *
 * 동시성:
 * - 고객별 분산락으로 같은 고객의 요청을 직렬화
 * - 락이 풀린 경우에도 pending_key 유니크 제약이 두 번째 INSERT를 막고,
 *   패배한 요청은 이긴 요청의 주문을 다시 읽어 반환
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final ProductRepository productRepository;
    private final CustomerRepository customerRepository;
    private final OrderRepository orderRepository;
    private final CheckoutTransactionService checkoutTransactionService;

    public CheckoutService(ProductRepository productRepository,
                           CustomerRepository customerRepository,
                           OrderRepository orderRepository,
                           CheckoutTransactionService checkoutTransactionService) {
        this.productRepository = productRepository;
        this.customerRepository = customerRepository;
        this.orderRepository = orderRepository;
        this.checkoutTransactionService = checkoutTransactionService;
    }

    @DistributedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
    public CheckoutResult checkout(Long customerId, List<CartLineCommand> cart) {
        validateCart(cart);

        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new CustomerNotFoundException(customerId));

        List<OrderLine> lines = priceLines(cart);

        Optional<Order> pending = orderRepository.findPendingByCustomerId(customerId);
        if (pending.isPresent()) {
            log.info("[CheckoutService] 기존 PENDING 주문 반환 - customerId={}, orderId={}",
                    customerId, pending.get().getId());
            return CheckoutResult.from(pending.get());
        }

        try {
            Order created = checkoutTransactionService.createPendingOrder(customerId, lines, customer.getAddress());
            log.info("[CheckoutService] PENDING 주문 생성 - customerId={}, orderId={}, amount={}",
                    customerId, created.getId(), created.getAmount());
            return CheckoutResult.from(created);
        } catch (DataIntegrityViolationException e) {
            // 동시 요청이 먼저 PENDING 주문을 만든 경우
            log.warn("[CheckoutService] PENDING 주문 동시 생성 감지 - customerId={}", customerId);
            return orderRepository.findPendingByCustomerId(customerId)
                    .map(CheckoutResult::from)
                    .orElseThrow(() -> new ApplicationException(ErrorCode.CHECKOUT_FAILED, e));
        }
    }

    private void validateCart(List<CartLineCommand> cart) {
        if (cart == null || cart.isEmpty()) {
            throw new InvalidRequestException("장바구니가 비어 있습니다");
        }
        for (int i = 0; i < cart.size(); i++) {
            CartLineCommand line = cart.get(i);
            if (line == null || line.getProductId() == null) {
                throw new InvalidRequestException("장바구니 " + (i + 1) + "번째 항목에 상품이 없습니다");
            }
            if (line.getQuantity() == null || line.getQuantity() < 1) {
                throw new InvalidRequestException("장바구니 " + (i + 1) + "번째 항목의 수량은 1 이상이어야 합니다");
            }
        }
    }

    /**
     * 상품 일괄 조회 → 재고 확인 → 단가 스냅샷
     *
     * 재고 부족은 주문 저장 전에 InsufficientStockException으로 거부된다.
     */
    private List<OrderLine> priceLines(List<CartLineCommand> cart) {
        Set<Long> ids = cart.stream()
                .map(CartLineCommand::getProductId)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Map<Long, ProductVariant> resolved = productRepository.findAllByIds(ids).stream()
                .collect(Collectors.toMap(ProductVariant::getId, Function.identity()));
        if (resolved.isEmpty()) {
            throw new InvalidRequestException("유효한 상품이 없습니다");
        }

        List<OrderLine> lines = new ArrayList<>();
        for (CartLineCommand line : cart) {
            ProductVariant variant = resolved.get(line.getProductId());
            if (variant == null) {
                log.warn("[CheckoutService] 존재하지 않는 상품은 제외 - productId={}", line.getProductId());
                continue;
            }
            if (!variant.hasStock(line.getQuantity())) {
                throw new InsufficientStockException(variant, line.getQuantity());
            }
            lines.add(OrderLine.snapshot(
                    variant.getId(),
                    variant.getName(),
                    variant.getSlug(),
                    variant.firstImage(),
                    variant.effectivePrice(),
                    line.getQuantity()
            ));
        }
        return lines;
    }
}
