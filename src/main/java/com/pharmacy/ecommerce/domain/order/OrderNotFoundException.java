package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 주문을 찾을 수 없을 때 발생하는 예외 (404)
 */
@Getter
public class OrderNotFoundException extends DomainException {

    private final String orderId;

    public OrderNotFoundException(String orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "orderId=" + orderId);
        this.orderId = orderId;
    }
}
