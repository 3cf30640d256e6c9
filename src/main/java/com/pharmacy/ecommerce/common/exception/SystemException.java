package com.pharmacy.ecommerce.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 락 획득 실패, 저장소 장애 등 도메인과 무관한 오류.
 * 항상 서버 오류(5XX)로 응답하며 클라이언트 재시도가 가능하다.
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
