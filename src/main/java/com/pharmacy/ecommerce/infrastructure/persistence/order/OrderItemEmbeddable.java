package com.pharmacy.ecommerce.infrastructure.persistence.order;

import com.pharmacy.ecommerce.domain.common.vo.Money;
import com.pharmacy.ecommerce.domain.order.OrderItem;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * order_items 테이블 행. 주문 시점의 상품명/단가 스냅샷을 그대로 저장한다.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItemEmbeddable {

    @Column(name = "product_id", nullable = false, length = 64)
    private String productId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "unit_price", nullable = false)
    private Long unitPrice;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "added_at", nullable = false)
    private LocalDateTime addedAt;

    static OrderItemEmbeddable from(OrderItem item) {
        OrderItemEmbeddable row = new OrderItemEmbeddable();
        row.productId = item.getProductId();
        row.productName = item.getProductName();
        row.unitPrice = item.getUnitPrice().getAmount();
        row.currency = item.getUnitPrice().getCurrency();
        row.quantity = item.getQuantity();
        row.addedAt = item.getAddedAt();
        return row;
    }

    OrderItem toDomain() {
        return OrderItem.create(productId, productName, Money.of(unitPrice, currency), quantity, addedAt);
    }
}
