package com.pharmacy.ecommerce.infrastructure.config;

import com.pharmacy.ecommerce.domain.order.OrderRepository;
import com.pharmacy.ecommerce.infrastructure.persistence.order.InMemoryOrderRepository;
import com.pharmacy.ecommerce.infrastructure.persistence.order.JpaOrderRepository;
import com.pharmacy.ecommerce.infrastructure.persistence.order.OrderJpaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

/**
 * OrderRepository 구현체 선택 (pharmacy.order.storage)
 *
 * - jpa (기본): MySQL
 * - memory: 참조 구현 (로컬 실행/테스트)
 */
@Slf4j
@Configuration
public class OrderRepositoryConfig {

    @Bean
    @ConditionalOnProperty(name = "pharmacy.order.storage", havingValue = "jpa", matchIfMissing = true)
    public OrderRepository jpaOrderRepository(OrderJpaRepository orderJpaRepository, Clock clock,
                                              OrderProperties orderProperties,
                                              PlatformTransactionManager transactionManager) {
        log.info("[OrderRepositoryConfig] 주문 저장소: JPA");
        return new JpaOrderRepository(orderJpaRepository, clock, orderProperties.getDefaultCurrency(),
                transactionManager);
    }

    @Bean
    @ConditionalOnProperty(name = "pharmacy.order.storage", havingValue = "memory")
    public OrderRepository inMemoryOrderRepository(Clock clock, OrderProperties orderProperties) {
        log.info("[OrderRepositoryConfig] 주문 저장소: InMemory");
        return new InMemoryOrderRepository(clock, orderProperties.getDefaultCurrency());
    }
}
