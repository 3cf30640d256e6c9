package com.pharmacy.ecommerce.domain.order.event;

import com.pharmacy.ecommerce.domain.common.vo.Money;
import com.pharmacy.ecommerce.domain.order.OrderItem;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 이벤트에 실리는 주문 항목 요약
 */
@Getter
@ToString
@EqualsAndHashCode
public final class OrderItemSummary {

    private final String productId;
    private final String productName;
    private final int quantity;
    private final Money subtotal;

    private OrderItemSummary(String productId, String productName, int quantity, Money subtotal) {
        this.productId = productId;
        this.productName = productName;
        this.quantity = quantity;
        this.subtotal = subtotal;
    }

    public static OrderItemSummary from(OrderItem item) {
        return new OrderItemSummary(item.getProductId(), item.getProductName(),
                item.getQuantity(), item.getSubtotal());
    }
}
