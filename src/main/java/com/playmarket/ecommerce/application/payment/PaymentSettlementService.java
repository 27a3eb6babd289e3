package com.playmarket.ecommerce.application.payment;

import com.playmarket.ecommerce.domain.order.Order;
import com.playmarket.ecommerce.domain.order.OrderRepository;
import com.playmarket.ecommerce.domain.payment.PaymentTransaction;
import com.playmarket.ecommerce.domain.payment.PaymentTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 결제 정산 (트랜잭션 경계)
 *
 * 하나의 트랜잭션에서:
 * 1. 결제사 거래 ID로 기존 거래 확인 → 있으면 ALREADY_SETTLED
 * 2. 주문 조회 → 없으면 ORDER_NOT_FOUND
 * 3. 주문에 이미 거래가 있으면 ALREADY_SETTLED
 * 4. 거래 기록 INSERT (provider_transaction_id, order_id 유니크)
 * 5. 주문 SUCCESS 전환, 거래 ID와 결제 수단 기록
 *
 * 동시에 같은 이벤트가 들어와 4에서 유니크 제약이 위반되면
 * DataIntegrityViolationException이 호출자에게 전파된다.
 */
@Service
public class PaymentSettlementService {

    private static final Logger log = LoggerFactory.getLogger(PaymentSettlementService.class);

    private final OrderRepository orderRepository;
    private final PaymentTransactionRepository transactionRepository;

    public PaymentSettlementService(OrderRepository orderRepository,
                                    PaymentTransactionRepository transactionRepository) {
        this.orderRepository = orderRepository;
        this.transactionRepository = transactionRepository;
    }

    @Transactional(propagation = Propagation.REQUIRED, rollbackFor = Exception.class)
    @Retryable(
            retryFor = ObjectOptimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 1000, random = true)
    )
    public SettlementOutcome settle(Long orderId, String providerTransactionId, String paymentMethod) {
        if (transactionRepository.findByProviderTransactionId(providerTransactionId).isPresent()) {
            log.info("[PaymentSettlementService] 이미 정산된 결제 - providerTransactionId={}, orderId={}",
                    providerTransactionId, orderId);
            return SettlementOutcome.ALREADY_SETTLED;
        }

        Optional<Order> found = orderRepository.findById(orderId);
        if (found.isEmpty()) {
            return SettlementOutcome.ORDER_NOT_FOUND;
        }
        Order order = found.get();
        if (transactionRepository.findByOrderId(order.getId()).isPresent()) {
            log.info("[PaymentSettlementService] 주문에 이미 거래가 있음 - orderId={}, providerTransactionId={}",
                    orderId, providerTransactionId);
            return SettlementOutcome.ALREADY_SETTLED;
        }

        PaymentTransaction transaction = transactionRepository.insert(PaymentTransaction.sell(
                providerTransactionId,
                order.getId(),
                paymentMethod,
                order.getAmount(),
                order.getCustomerId()
        ));

        order.settle(transaction.getId(), paymentMethod);
        orderRepository.save(order);

        log.info("[PaymentSettlementService] 정산 완료 - orderId={}, transactionId={}, amount={}, method={}",
                order.getId(), transaction.getId(), order.getAmount(), paymentMethod);
        return SettlementOutcome.SETTLED;
    }
}
