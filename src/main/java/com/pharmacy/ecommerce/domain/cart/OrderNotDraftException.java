package com.pharmacy.ecommerce.domain.cart;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;
import com.pharmacy.ecommerce.domain.order.OrderStatus;

public class OrderNotDraftException extends DomainException {

    public OrderNotDraftException(String orderId, OrderStatus status) {
        super(ErrorCode.ORDER_NOT_DRAFT, "orderId=" + orderId + ", status=" + status);
    }
}
