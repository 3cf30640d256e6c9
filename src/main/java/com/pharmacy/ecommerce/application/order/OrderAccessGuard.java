package com.pharmacy.ecommerce.application.order;

import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderNotFoundException;
import com.pharmacy.ecommerce.domain.order.OrderRepository;
import com.pharmacy.ecommerce.domain.order.UnauthorizedOrderAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 주문 ID로 조회 후 소유권을 검증한다.
 */
@Slf4j
@Component
public class OrderAccessGuard {

    private final OrderRepository orderRepository;

    public OrderAccessGuard(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    /**
     * @throws OrderNotFoundException 주문이 없는 경우
     * @throws UnauthorizedOrderAccessException 다른 사용자의 주문인 경우
     */
    public Order getOwnedOrder(String orderId, String userId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!order.isOwnedBy(userId)) {
            log.warn("[OrderAccessGuard] 소유자 불일치 접근 차단 - orderId={}, userId={}", orderId, userId);
            throw new UnauthorizedOrderAccessException();
        }
        return order;
    }
}
