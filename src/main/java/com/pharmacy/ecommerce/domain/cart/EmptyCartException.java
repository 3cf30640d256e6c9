package com.pharmacy.ecommerce.domain.cart;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;

/**
 * 항목이 없는 장바구니로 주문을 진행하려 할 때 발생하는 예외 (409)
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException(String orderId) {
        super(ErrorCode.EMPTY_CART, "orderId=" + orderId);
    }
}
