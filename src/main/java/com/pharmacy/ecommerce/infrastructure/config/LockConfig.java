package com.pharmacy.ecommerce.infrastructure.config;

import com.pharmacy.ecommerce.infrastructure.lock.RedissonLockRegistry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.integration.support.locks.DefaultLockRegistry;
import org.springframework.integration.support.locks.LockRegistry;

/**
 * 사용자 명령 락 구성
 *
 * pharmacy.lock.provider 값에 따라 LockRegistry 구현을 선택한다.
 * - local (기본): 고정 크기 락 테이블. 키 해시로 락을 공유하므로 사용자 수와 무관하게 메모리가 일정하다.
 * - redisson: Redis 분산 락 (RLock)
 */
@Slf4j
@Configuration
public class LockConfig {

    /**
     * 로컬 락 테이블 마스크 (2^10 - 1 → 락 1024개)
     */
    public static final int LOCAL_LOCK_MASK = 0x3FF;

    @Bean
    @ConditionalOnProperty(prefix = "pharmacy.lock", name = "provider", havingValue = "local", matchIfMissing = true)
    public LockRegistry localLockRegistry() {
        log.info("[LockConfig] 로컬 락 레지스트리 사용 - size={}", LOCAL_LOCK_MASK + 1);
        return new DefaultLockRegistry(LOCAL_LOCK_MASK);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "pharmacy.lock", name = "provider", havingValue = "redisson")
    public RedissonClient redissonClient(LockProperties lockProperties) {
        LockProperties.Redis redis = lockProperties.getRedis();
        Config config = new Config();
        config.useSingleServer()
                .setAddress(redis.getAddress())
                .setDatabase(redis.getDatabase())
                .setTimeout(redis.getTimeoutMs())
                .setConnectionPoolSize(20)
                .setConnectionMinimumIdleSize(5);
        log.info("[LockConfig] Redisson 분산 락 사용 - address={}", redis.getAddress());
        return Redisson.create(config);
    }

    @Bean
    @ConditionalOnProperty(prefix = "pharmacy.lock", name = "provider", havingValue = "redisson")
    public LockRegistry redissonLockRegistry(RedissonClient redissonClient) {
        return new RedissonLockRegistry(redissonClient);
    }
}
