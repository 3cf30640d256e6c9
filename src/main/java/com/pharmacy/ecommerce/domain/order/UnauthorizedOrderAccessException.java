package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;

/**
 * 호출자가 주문의 소유자가 아닐 때 발생하는 예외 (403)
 *
 * 주문 ID 열거를 막기 위해 메시지에 주문 ID나 소유자 ID를 담지 않는다.
 */
public class UnauthorizedOrderAccessException extends DomainException {

    public UnauthorizedOrderAccessException() {
        super(ErrorCode.UNAUTHORIZED_ORDER_ACCESS);
    }
}
