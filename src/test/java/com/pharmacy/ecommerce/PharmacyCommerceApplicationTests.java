package com.pharmacy.ecommerce;

import com.pharmacy.ecommerce.domain.catalog.ProductCatalog;
import com.pharmacy.ecommerce.domain.order.OrderRepository;
import com.pharmacy.ecommerce.infrastructure.persistence.order.InMemoryOrderRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.integration.support.locks.DefaultLockRegistry;
import org.springframework.integration.support.locks.LockRegistry;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@DisplayName("애플리케이션 컨텍스트 테스트")
class PharmacyCommerceApplicationTests {

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private ProductCatalog productCatalog;

    @Autowired
    private LockRegistry lockRegistry;

    @Test
    @DisplayName("컨텍스트 로드 - 기본 저장소는 JPA")
    void contextLoads() {
        assertNotNull(orderRepository);
        assertFalse(orderRepository instanceof InMemoryOrderRepository);
        assertTrue(productCatalog.findById("prod-001").isPresent());
    }

    @Test
    @DisplayName("기본 락 레지스트리는 로컬 고정 크기 테이블")
    void defaultLockRegistryIsLocal() {
        assertInstanceOf(DefaultLockRegistry.class, lockRegistry);
    }
}
