package com.pharmacy.ecommerce.infrastructure.lock;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 사용자 단위 명령 직렬화 락 어노테이션
 *
 * 같은 키로 들어온 호출은 한 번에 하나씩 실행된다.
 * 키는 Spring EL을 지원한다.
 *
 * 예제:
 * @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
 * public Order addItemToCart(String userId, ...) { ... }
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface UserCommandLock {

    /**
     * 락 키 (Spring EL)
     * - #p0, #p1, ... : 메서드 파라미터 (위치 기반)
     */
    String key();

    /**
     * 락 획득 대기 시간(ms). 0 이하이면 pharmacy.lock.wait-time-ms 설정값을 사용한다.
     */
    long waitTimeMs() default 0;
}
