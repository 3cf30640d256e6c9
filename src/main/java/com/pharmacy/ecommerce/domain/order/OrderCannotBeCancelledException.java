package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

@Getter
public class OrderCannotBeCancelledException extends DomainException {

    private final OrderStatus status;

    public OrderCannotBeCancelledException(String orderId, OrderStatus status) {
        super(ErrorCode.ORDER_CANNOT_BE_CANCELLED, "orderId=" + orderId + ", status=" + status);
        this.status = status;
    }
}
