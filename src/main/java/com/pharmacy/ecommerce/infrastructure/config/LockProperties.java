package com.pharmacy.ecommerce.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 사용자 명령 락 설정 (pharmacy.lock.*)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pharmacy.lock")
public class LockProperties {

    /**
     * local: 단일 인스턴스 (Spring Integration DefaultLockRegistry)
     * redisson: Redis 분산 락
     */
    private Provider provider = Provider.LOCAL;

    private long waitTimeMs = 3000;

    private Redis redis = new Redis();

    public enum Provider {
        LOCAL, REDISSON
    }

    @Getter
    @Setter
    public static class Redis {
        private String address = "redis://localhost:6379";
        private int database = 0;
        private int timeoutMs = 2000;
    }
}
