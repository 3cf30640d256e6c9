package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 결제 요청 시 주문이 CONFIRMED 상태가 아닐 때 발생하는 예외 (409)
 */
@Getter
public class OrderNotConfirmedException extends DomainException {

    private final OrderStatus status;

    public OrderNotConfirmedException(String orderId, OrderStatus status) {
        super(ErrorCode.ORDER_NOT_CONFIRMED, "orderId=" + orderId + ", status=" + status);
        this.status = status;
    }
}
