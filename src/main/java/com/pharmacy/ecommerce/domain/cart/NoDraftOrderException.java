package com.pharmacy.ecommerce.domain.cart;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;

/**
 * 사용자에게 활성 장바구니(DRAFT 주문)가 없을 때 발생하는 예외 (404)
 *
 * 동시에 들어온 다른 요청이 장바구니를 확정/취소한 경우에도 이 예외로 실패한다.
 */
public class NoDraftOrderException extends DomainException {

    public NoDraftOrderException(String userId) {
        super(ErrorCode.NO_DRAFT_ORDER, "userId=" + userId);
    }
}
