package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 종료 상태(DELIVERED, CANCELLED)의 주문을 변경하려 할 때 발생하는 예외 (409)
 */
@Getter
public class OrderTerminalStateException extends DomainException {

    private final OrderStatus status;

    public OrderTerminalStateException(String orderId, OrderStatus status) {
        super(ErrorCode.ORDER_TERMINAL_STATE, "orderId=" + orderId + ", status=" + status);
        this.status = status;
    }
}
