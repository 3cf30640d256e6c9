package com.pharmacy.ecommerce.domain.order.event;

import com.pharmacy.ecommerce.domain.common.vo.Money;
import com.pharmacy.ecommerce.domain.order.Order;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 확정 이벤트
 * 장바구니 체크아웃(DRAFT → CONFIRMED) 또는 주문 확정(CREATED → CONFIRMED) 시 발행된다.
 * 확정 시점의 합계와 항목 요약을 스냅샷으로 담는다.
 */
@Getter
@ToString
public final class OrderConfirmedEvent implements DomainEvent {

    public static final String TYPE = "ORDER_CONFIRMED";

    private final String orderId;
    private final String userId;
    private final Money total;
    private final int itemCount;
    private final List<OrderItemSummary> itemSummary;
    private final LocalDateTime occurredAt;
    private final String correlationId;

    private OrderConfirmedEvent(String orderId, String userId, Money total, int itemCount,
                                List<OrderItemSummary> itemSummary, LocalDateTime occurredAt,
                                String correlationId) {
        this.orderId = orderId;
        this.userId = userId;
        this.total = total;
        this.itemCount = itemCount;
        this.itemSummary = List.copyOf(itemSummary);
        this.occurredAt = occurredAt;
        this.correlationId = correlationId;
    }

    public static OrderConfirmedEvent of(Order order, String correlationId, LocalDateTime occurredAt) {
        List<OrderItemSummary> summary = order.getItems().stream()
                .map(OrderItemSummary::from)
                .toList();
        return new OrderConfirmedEvent(order.getId(), order.getUserId(), order.getTotal(),
                order.getItemCount(), summary, occurredAt, correlationId);
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
