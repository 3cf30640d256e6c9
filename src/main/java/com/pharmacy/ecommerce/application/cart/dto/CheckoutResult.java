package com.pharmacy.ecommerce.application.cart.dto;

import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.event.DomainEvent;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 체크아웃 결과
 *
 * requiresPrescription이 true여도 주문은 이미 CONFIRMED 상태다.
 * 호출자는 이 값을 보고 사용자를 처방 검토 흐름으로 안내한다.
 */
@Getter
@ToString
public class CheckoutResult {

    private final Order order;
    private final List<DomainEvent> events;
    private final boolean requiresPrescription;

    public CheckoutResult(Order order, List<DomainEvent> events, boolean requiresPrescription) {
        this.order = order;
        this.events = List.copyOf(events);
        this.requiresPrescription = requiresPrescription;
    }
}
