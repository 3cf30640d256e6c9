package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;

/**
 * 수량이 없거나 1 미만일 때 발생하는 예외 (400)
 */
public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(Integer quantity) {
        super(ErrorCode.INVALID_QUANTITY, "quantity=" + quantity);
    }
}
