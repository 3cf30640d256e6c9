package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 주문(장바구니)에 해당 상품 항목이 없을 때 발생하는 예외 (404)
 */
@Getter
public class OrderItemNotFoundException extends DomainException {

    private final String productId;

    public OrderItemNotFoundException(String orderId, String productId) {
        super(ErrorCode.ORDER_ITEM_NOT_FOUND, "orderId=" + orderId + ", productId=" + productId);
        this.productId = productId;
    }
}
