package com.pharmacy.ecommerce.infrastructure.config;

import com.pharmacy.ecommerce.application.cart.CartService;
import com.pharmacy.ecommerce.domain.order.OrderRepository;
import com.pharmacy.ecommerce.infrastructure.persistence.order.InMemoryOrderRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "pharmacy.order.storage=memory",
        "pharmacy.order.default-currency=USD"
})
@DisplayName("OrderRepositoryConfig - 인메모리 저장소 선택")
class InMemoryStorageConfigTest {

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OrderProperties orderProperties;

    @Autowired
    private CartService cartService;

    @Test
    @DisplayName("pharmacy.order.storage=memory 이면 인메모리 저장소와 설정 통화 사용")
    void usesInMemoryRepository() {
        assertInstanceOf(InMemoryOrderRepository.class, orderRepository);
        assertEquals(OrderProperties.Storage.MEMORY, orderProperties.getStorage());
        assertEquals("USD", cartService.createDraftOrder("memory-user", "corr").getCurrency());
    }
}
