package com.playmarket.ecommerce.application.order;

import com.playmarket.ecommerce.application.order.dto.OrderListResponse;
import com.playmarket.ecommerce.application.order.dto.OrderSummaryResponse;
import com.playmarket.ecommerce.common.util.PageParams;
import com.playmarket.ecommerce.domain.customer.Customer;
import com.playmarket.ecommerce.domain.customer.CustomerRepository;
import com.playmarket.ecommerce.domain.order.Order;
import com.playmarket.ecommerce.domain.order.OrderNotFoundException;
import com.playmarket.ecommerce.domain.order.OrderRepository;
import com.playmarket.ecommerce.domain.order.OrderState;
import com.playmarket.ecommerce.domain.payment.PaymentTransaction;
import com.playmarket.ecommerce.domain.payment.PaymentTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 주문 상태 전환 (취소, 배송) 및 주문 목록 조회
 *
 * 취소/배송은 현재 상태를 확인하지 않는 멱등 쓰기다.
 * 같은 요청을 두 번 보내도 같은 상태로 끝나며 오류가 나지 않는다.
 * 정산 트랜잭션과 버전 충돌이 나면 재시도한다.
 */
@Service
public class OrderLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleService.class);

    private static final int DEFAULT_LIMIT = 10;
    private static final int MAX_LIMIT = 100;

    private final OrderRepository orderRepository;
    private final CustomerRepository customerRepository;
    private final PaymentTransactionRepository transactionRepository;

    public OrderLifecycleService(OrderRepository orderRepository,
                                 CustomerRepository customerRepository,
                                 PaymentTransactionRepository transactionRepository) {
        this.orderRepository = orderRepository;
        this.customerRepository = customerRepository;
        this.transactionRepository = transactionRepository;
    }

    @Transactional
    @Retryable(
            retryFor = ObjectOptimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 500, random = true)
    )
    public void cancelOrder(Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        OrderState previous = order.getState();
        order.cancel();
        orderRepository.save(order);
        log.info("[OrderLifecycleService] 주문 취소 - orderId={}, {} → {}", orderId, previous, order.getState());
    }

    @Transactional
    @Retryable(
            retryFor = ObjectOptimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 500, random = true)
    )
    public void shipOrder(Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        OrderState previous = order.getState();
        order.ship();
        orderRepository.save(order);
        log.info("[OrderLifecycleService] 배송 처리 - orderId={}, {} → {}", orderId, previous, order.getState());
    }

    /**
     * 주문 목록 (최신순)
     *
     * @param state null 또는 빈 값이면 전체 상태
     */
    @Transactional(readOnly = true)
    public OrderListResponse listOrders(String state, String page, String limit) {
        OrderState stateFilter = state == null || state.isBlank() ? null : OrderState.fromValue(state);
        PageParams pageParams = PageParams.parse(page, limit, DEFAULT_LIMIT, MAX_LIMIT);

        List<Order> orders = orderRepository.findPage(stateFilter, pageParams);
        long total = orderRepository.count(stateFilter);

        Set<Long> customerIds = orders.stream().map(Order::getCustomerId).collect(Collectors.toSet());
        Map<Long, Customer> customers = customerRepository.findAllByIds(customerIds).stream()
                .collect(Collectors.toMap(Customer::getId, Function.identity()));

        Set<Long> transactionIds = orders.stream()
                .map(Order::getTransactionId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<Long, PaymentTransaction> transactions = transactionRepository.findAllByIds(transactionIds).stream()
                .collect(Collectors.toMap(PaymentTransaction::getId, Function.identity()));

        List<OrderSummaryResponse> summaries = orders.stream()
                .map(order -> toSummary(order, customers.get(order.getCustomerId()),
                        order.getTransactionId() == null ? null : transactions.get(order.getTransactionId())))
                .collect(Collectors.toList());

        return new OrderListResponse(summaries, new OrderListResponse.Meta(
                total, pageParams.getPage(), pageParams.getLimit(), pageParams.totalPages(total)));
    }

    private OrderSummaryResponse toSummary(Order order, Customer customer, PaymentTransaction transaction) {
        return OrderSummaryResponse.builder()
                .orderId(order.getId())
                .customerId(order.getCustomerId())
                .customerName(customer == null ? null : customer.getName())
                .lines(order.getLines().stream()
                        .map(line -> new OrderSummaryResponse.Line(
                                line.getProductName(), line.getImage(), line.getUnitPrice(), line.getQuantity()))
                        .collect(Collectors.toList()))
                .amount(order.getAmount())
                .state(order.getState().getValue())
                .paymentMethod(order.getPaymentMethod())
                .transactionId(transaction == null ? null : transaction.getProviderTransactionId())
                .createdAt(order.getCreatedAt())
                .build();
    }
}
