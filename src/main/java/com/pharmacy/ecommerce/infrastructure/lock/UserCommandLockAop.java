package com.pharmacy.ecommerce.infrastructure.lock;

import com.pharmacy.ecommerce.common.exception.ErrorCode;
import com.pharmacy.ecommerce.common.exception.SystemException;
import com.pharmacy.ecommerce.infrastructure.config.LockProperties;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.Ordered;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.integration.support.locks.LockRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * {@link UserCommandLock} AOP 처리
 *
 * 실행 순서:
 * 1. 락 획득 (이 Aspect, 트랜잭션 Advisor보다 먼저 실행)
 * 2. @Transactional 시작/커밋 (있는 경우)
 * 3. 락 해제
 *
 * 대기 시간 안에 락을 얻지 못하면 SystemException(LOCK_ACQUISITION_FAILED).
 * 락 구현은 LockRegistry 빈이 결정한다 (LockConfig 참고).
 */
@Slf4j
@Aspect
@Component
public class UserCommandLockAop implements Ordered {

    private static final int LOCK_ORDER = Ordered.LOWEST_PRECEDENCE - 1000;

    private final LockRegistry lockRegistry;
    private final LockProperties lockProperties;
    private final ExpressionParser parser = new SpelExpressionParser();

    public UserCommandLockAop(LockRegistry lockRegistry, LockProperties lockProperties) {
        this.lockRegistry = lockRegistry;
        this.lockProperties = lockProperties;
    }

    @Around("@annotation(userCommandLock)")
    public Object around(ProceedingJoinPoint joinPoint, UserCommandLock userCommandLock) throws Throwable {
        String key = generateKey(joinPoint, userCommandLock.key());
        long waitTimeMs = userCommandLock.waitTimeMs() > 0
                ? userCommandLock.waitTimeMs()
                : lockProperties.getWaitTimeMs();
        Lock lock = lockRegistry.obtain(key);

        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, e);
        }
        if (!acquired) {
            log.warn("[UserCommandLock] 락 획득 실패 - key={}, waitTimeMs={}", key, waitTimeMs);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "key=" + key);
        }

        log.debug("[UserCommandLock] 락 획득 - key={}", key);
        try {
            return joinPoint.proceed();
        } finally {
            lock.unlock();
            log.debug("[UserCommandLock] 락 해제 - key={}", key);
        }
    }

    @Override
    public int getOrder() {
        return LOCK_ORDER;
    }

    /**
     * Spring EL로 동적 키를 생성합니다.
     * 예: "'user:orders:' + #p0" → "user:orders:u-1"
     */
    private String generateKey(ProceedingJoinPoint joinPoint, String keyExpression) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Object[] args = joinPoint.getArgs();

        EvaluationContext context = new StandardEvaluationContext();
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
        }
        context.setVariable("args", args);

        Object value = parser.parseExpression(keyExpression).getValue(context);
        if (value == null) {
            throw new IllegalArgumentException(
                    "락 키가 null입니다 - method=" + signature.getMethod().getName() + ", key=" + keyExpression);
        }
        return value.toString();
    }
}
