package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.domain.common.vo.Money;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * OrderItem - 주문 항목 값 객체 (Immutable)
 *
 * 핵심 비즈니스 규칙:
 * - productName, unitPrice는 담는 시점의 스냅샷이다.
 *   이후 카탈로그 가격이 바뀌어도 이미 담긴 항목은 변하지 않는다.
 * - 소계(subtotal) = 단가 × 수량. 저장하지 않고 항상 계산한다.
 * - 수량은 1 이상
 */
@Getter
@ToString
@EqualsAndHashCode
public final class OrderItem {

    private final String productId;
    private final String productName;
    private final Money unitPrice;
    private final int quantity;
    private final LocalDateTime addedAt;

    private OrderItem(String productId, String productName, Money unitPrice, int quantity, LocalDateTime addedAt) {
        this.productId = productId;
        this.productName = productName;
        this.unitPrice = unitPrice;
        this.quantity = quantity;
        this.addedAt = addedAt;
    }

    /**
     * 검증을 거쳐 주문 항목을 생성합니다.
     *
     * @throws IllegalArgumentException 상품 ID/이름이 비었거나 단가가 없는 경우
     * @throws InvalidQuantityException 수량이 1 미만인 경우
     */
    public static OrderItem create(String productId, String productName, Money unitPrice,
                                   int quantity, LocalDateTime addedAt) {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("상품 ID는 필수입니다");
        }
        if (productName == null || productName.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
        if (unitPrice == null) {
            throw new IllegalArgumentException("단가는 필수입니다");
        }
        if (addedAt == null) {
            throw new IllegalArgumentException("추가 시각은 필수입니다");
        }
        validateQuantity(quantity);
        return new OrderItem(productId, productName, unitPrice, quantity, addedAt);
    }

    /**
     * 수량만 바꾼 새 항목을 반환합니다. 스냅샷 필드와 addedAt은 유지됩니다.
     */
    public OrderItem withQuantity(int newQuantity) {
        validateQuantity(newQuantity);
        return new OrderItem(productId, productName, unitPrice, newQuantity, addedAt);
    }

    public Money getSubtotal() {
        return unitPrice.multiply(quantity);
    }

    private static void validateQuantity(int quantity) {
        if (quantity <= 0) {
            throw new InvalidQuantityException(quantity);
        }
    }
}
