package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;

public class OrderAlreadyConfirmedException extends DomainException {

    public OrderAlreadyConfirmedException(String orderId) {
        super(ErrorCode.ORDER_ALREADY_CONFIRMED, "orderId=" + orderId);
    }
}
