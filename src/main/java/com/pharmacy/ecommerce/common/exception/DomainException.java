package com.pharmacy.ecommerce.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 주문 상태, 소유권, 수량 검증 등 호출자가 복구 가능한 오류.
 * 항상 클라이언트 오류(4XX)로 응답한다.
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
