package com.playmarket.ecommerce.infrastructure.lock;

import com.playmarket.ecommerce.common.exception.ErrorCode;
import com.playmarket.ecommerce.common.exception.SystemException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * &#64;DistributedLock 처리 Aspect
 *
 * 실행 순서:
 * 1. Spring EL로 락 키 생성 후 tryLock
 * 2. 트랜잭션이 진행 중이면 완료(커밋/롤백) 후 해제하도록 콜백 등록
 * 3. 메서드 실행
 * 4. 트랜잭션이 없으면 finally에서 해제
 *
 * &#64;Transactional보다 먼저 실행되도록 우선순위를 높게 둔다.
 */
@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
@Order(Ordered.LOWEST_PRECEDENCE - 1000)
public class DistributedLockAop {

    private final RedissonClient redissonClient;
    private final ExpressionParser expressionParser = new SpelExpressionParser();

    @Around("@annotation(distributedLock)")
    public Object around(ProceedingJoinPoint joinPoint, DistributedLock distributedLock) throws Throwable {
        String lockKey = generateKey(joinPoint, distributedLock.key());
        RLock rLock = redissonClient.getLock(lockKey);

        boolean lockAcquired = false;
        boolean releaseOnCompletion = false;
        try {
            lockAcquired = rLock.tryLock(
                    distributedLock.waitTime(),
                    distributedLock.leaseTime(),
                    distributedLock.timeUnit()
            );

            if (!lockAcquired) {
                log.warn("[DistributedLock] 락 획득 실패 - key: {}", lockKey);
                throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "key: " + lockKey);
            }
            log.debug("[DistributedLock] 락 획득 - key: {}", lockKey);

            if (TransactionSynchronizationManager.isSynchronizationActive()) {
                TransactionSynchronizationManager.registerSynchronization(
                        new LockReleaseSynchronization(rLock, lockKey)
                );
                releaseOnCompletion = true;
            }

            return joinPoint.proceed();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, e);

        } finally {
            if (lockAcquired && !releaseOnCompletion) {
                unlockQuietly(rLock, lockKey);
            }
        }
    }

    /**
     * "'checkout:customer:' + #p0" → "checkout:customer:10"
     */
    String generateKey(ProceedingJoinPoint joinPoint, String keyPattern) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Object[] args = joinPoint.getArgs();

        EvaluationContext context = new StandardEvaluationContext();
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
        }

        String key = expressionParser.parseExpression(keyPattern).getValue(context, String.class);
        log.debug("[DistributedLock] 키 생성 - method: {}, key: {}", signature.getName(), key);
        return key;
    }

    private static void unlockQuietly(RLock rLock, String lockKey) {
        try {
            if (rLock.isHeldByCurrentThread()) {
                rLock.unlock();
                log.debug("[DistributedLock] 락 해제 - key: {}", lockKey);
            }
        } catch (Exception e) {
            log.error("[DistributedLock] 락 해제 중 오류 - key: {}", lockKey, e);
        }
    }

    /**
     * 트랜잭션 완료 후 락 해제
     */
    private static class LockReleaseSynchronization implements TransactionSynchronization {
        private final RLock rLock;
        private final String lockKey;

        LockReleaseSynchronization(RLock rLock, String lockKey) {
            this.rLock = rLock;
            this.lockKey = lockKey;
        }

        @Override
        public void afterCompletion(int status) {
            unlockQuietly(rLock, lockKey);
        }
    }
}
