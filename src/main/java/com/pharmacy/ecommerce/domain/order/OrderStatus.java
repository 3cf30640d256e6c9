package com.pharmacy.ecommerce.domain.order;

import lombok.Getter;

import java.util.Locale;

/**
 * OrderStatus - 주문 생명주기 상태 (Enum + 메타데이터)
 *
 * - DRAFT: 장바구니. 항목 변경이 가능한 유일한 상태
 * - CREATED → CONFIRMED → PAID → SHIPPED → DELIVERED
 * - CANCELLED: 취소됨
 *
 * DELIVERED, CANCELLED는 종료 상태(terminal)로 더 이상 전이할 수 없다.
 * 전이 규칙은 {@link OrderStateMachine}에 있다.
 */
@Getter
public enum OrderStatus {
    DRAFT("Draft", "Cart/draft order, can be modified", false, true),
    CREATED("Created", "Order placed, awaiting confirmation", false, false),
    CONFIRMED("Confirmed", "Order confirmed, awaiting payment", false, false),
    PAID("Paid", "Payment received, awaiting fulfillment", false, false),
    SHIPPED("Shipped", "Order shipped, in transit", false, false),
    DELIVERED("Delivered", "Order delivered successfully", true, false),
    CANCELLED("Cancelled", "Order has been cancelled", true, false);

    private final String label;
    private final String description;
    private final boolean terminal;
    private final boolean mutable;

    OrderStatus(String label, String description, boolean terminal, boolean mutable) {
        this.label = label;
        this.description = description;
        this.terminal = terminal;
        this.mutable = mutable;
    }

    /**
     * 문자열에서 OrderStatus로 변환 (대소문자 무시)
     */
    public static OrderStatus from(String status) {
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("주문 상태는 필수입니다");
        }
        try {
            return OrderStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("유효하지 않은 주문 상태입니다: " + status);
        }
    }
}
