package com.pharmacy.ecommerce.application.order.dto;

import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.event.DomainEvent;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 상태 전이 유스케이스 결과: 전이 후 주문 스냅샷 + 발생한 이벤트
 */
@Getter
@ToString
public class OrderTransitionResult {

    private final Order order;
    private final List<DomainEvent> events;

    public OrderTransitionResult(Order order, List<DomainEvent> events) {
        this.order = order;
        this.events = List.copyOf(events);
    }
}
