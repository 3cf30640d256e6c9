package com.pharmacy.ecommerce.infrastructure.lock;

import org.redisson.api.RedissonClient;
import org.springframework.integration.support.locks.LockRegistry;

import java.util.concurrent.locks.Lock;

/**
 * Redisson RLock 기반 LockRegistry
 *
 * 여러 인스턴스가 같은 Redis를 바라보면 사용자 명령이 노드 간에도 직렬화된다.
 * 락 객체는 Redis 키로만 존재하므로 JVM에 누적되지 않는다.
 */
public class RedissonLockRegistry implements LockRegistry {

    private final RedissonClient redissonClient;

    public RedissonLockRegistry(RedissonClient redissonClient) {
        this.redissonClient = redissonClient;
    }

    @Override
    public Lock obtain(Object lockKey) {
        return redissonClient.getLock(lockKey.toString());
    }
}
