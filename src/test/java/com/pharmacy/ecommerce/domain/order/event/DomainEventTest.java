package com.pharmacy.ecommerce.domain.order.event;

import com.pharmacy.ecommerce.domain.common.vo.Money;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderItem;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("도메인 이벤트 / DomainEventCollector 테스트")
class DomainEventTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 9, 30);

    private final Order order = Order.builder()
            .id("order-1")
            .userId("user-1")
            .status(OrderStatus.CONFIRMED)
            .items(List.of(
                    OrderItem.create("prod-001", "Paracetamol 500mg", Money.of(2500), 2, NOW),
                    OrderItem.create("prod-003", "Amoxicillin 500mg", Money.of(12000), 1, NOW)))
            .createdAt(NOW)
            .updatedAt(NOW)
            .build();

    @Test
    @DisplayName("OrderConfirmedEvent - 합계와 항목 요약을 담는다")
    void testOrderConfirmedEvent() {
        OrderConfirmedEvent event = OrderConfirmedEvent.of(order, "corr-1", NOW);

        assertEquals(OrderConfirmedEvent.TYPE, event.getType());
        assertEquals("order-1", event.getOrderId());
        assertEquals(Money.of(17000), event.getTotal());
        assertEquals(3, event.getItemCount());
        assertEquals(2, event.getItemSummary().size());
        assertEquals(Money.of(5000), event.getItemSummary().get(0).getSubtotal());
        assertEquals("corr-1", event.getCorrelationId());
        assertEquals(NOW, event.getOccurredAt());
    }

    @Test
    @DisplayName("OrderCancelledEvent - 취소 직전 상태와 사유")
    void testOrderCancelledEvent() {
        OrderCancelledEvent event = OrderCancelledEvent.of(order, "고객 요청", null, NOW);

        assertEquals(OrderCancelledEvent.TYPE, event.getType());
        assertEquals(OrderStatus.CONFIRMED, event.getPreviousStatus());
        assertEquals("고객 요청", event.getReason());
        assertNull(event.getCorrelationId());
    }

    @Test
    @DisplayName("Collector - 순서 유지, 타입별 조회, 비우기")
    void testCollector() {
        DomainEventCollector collector = new DomainEventCollector();
        assertFalse(collector.hasEvents());

        collector.add(OrderConfirmedEvent.of(order, "c", NOW));
        collector.add(OrderCancelledEvent.of(order, null, "c", NOW));

        List<DomainEvent> events = collector.getEvents();
        assertEquals(2, events.size());
        assertEquals(OrderConfirmedEvent.TYPE, events.get(0).getType());
        assertEquals(1, collector.getEventsOfType(OrderCancelledEvent.class).size());
        assertThrows(UnsupportedOperationException.class, () -> events.add(events.get(0)));

        collector.clear();
        assertFalse(collector.hasEvents());
    }

    @Test
    @DisplayName("Collector - null 이벤트는 거부")
    void testCollector_NullRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DomainEventCollector().add(null));
    }
}
