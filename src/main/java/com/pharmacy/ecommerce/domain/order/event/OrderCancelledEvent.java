package com.pharmacy.ecommerce.domain.order.event;

import com.pharmacy.ecommerce.domain.common.vo.Money;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 주문 취소 이벤트
 * 취소 직전 상태(previousStatus)와 취소 시점의 합계/수량을 담는다.
 */
@Getter
@ToString
public final class OrderCancelledEvent implements DomainEvent {

    public static final String TYPE = "ORDER_CANCELLED";

    private final String orderId;
    private final String userId;
    private final OrderStatus previousStatus;
    private final Money total;
    private final int itemCount;
    private final String reason;
    private final LocalDateTime occurredAt;
    private final String correlationId;

    private OrderCancelledEvent(String orderId, String userId, OrderStatus previousStatus, Money total,
                                int itemCount, String reason, LocalDateTime occurredAt, String correlationId) {
        this.orderId = orderId;
        this.userId = userId;
        this.previousStatus = previousStatus;
        this.total = total;
        this.itemCount = itemCount;
        this.reason = reason;
        this.occurredAt = occurredAt;
        this.correlationId = correlationId;
    }

    /**
     * @param order 취소 직전의 주문 스냅샷
     */
    public static OrderCancelledEvent of(Order order, String reason, String correlationId,
                                         LocalDateTime occurredAt) {
        return new OrderCancelledEvent(order.getId(), order.getUserId(), order.getStatus(),
                order.getTotal(), order.getItemCount(), reason, occurredAt, correlationId);
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
