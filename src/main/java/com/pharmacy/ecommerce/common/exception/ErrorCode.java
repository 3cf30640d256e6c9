package com.pharmacy.ecommerce.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 코드 값은 클라이언트에 노출되는 안정적인 식별자이므로 변경하지 않는다.
 */
public enum ErrorCode {

    // ========== Order Domain (4XX) ==========

    ORDER_NOT_FOUND("ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    UNAUTHORIZED_ORDER_ACCESS("UNAUTHORIZED_ORDER_ACCESS", "해당 주문에 접근할 권한이 없습니다", 403),
    INVALID_ORDER_STATE_TRANSITION("INVALID_ORDER_STATE_TRANSITION", "허용되지 않는 주문 상태 전이입니다", 409),
    ORDER_TERMINAL_STATE("ORDER_TERMINAL_STATE", "이미 종료된 주문입니다", 409),
    ORDER_CANNOT_BE_CANCELLED("ORDER_CANNOT_BE_CANCELLED", "현재 상태에서는 주문을 취소할 수 없습니다", 409),
    ORDER_NOT_CONFIRMED("ORDER_NOT_CONFIRMED", "확정되지 않은 주문입니다", 409),
    ORDER_ALREADY_CONFIRMED("ORDER_ALREADY_CONFIRMED", "이미 확정된 주문입니다", 409),
    ORDER_ITEM_NOT_FOUND("ORDER_ITEM_NOT_FOUND", "주문 항목을 찾을 수 없습니다", 404),

    // ========== Cart Domain (4XX) ==========

    NO_DRAFT_ORDER("NO_DRAFT_ORDER", "활성화된 장바구니가 없습니다", 404),
    ORDER_NOT_DRAFT("ORDER_NOT_DRAFT", "장바구니 상태의 주문이 아닙니다", 409),
    INVALID_QUANTITY("INVALID_QUANTITY", "수량은 1 이상의 정수여야 합니다", 400),
    EMPTY_CART("EMPTY_CART", "장바구니가 비어 있습니다", 409),

    // ========== Catalog (4XX) ==========

    PRODUCT_NOT_FOUND("PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),

    // ========== System Errors (5XX) ==========

    LOCK_ACQUISITION_FAILED("LOCK_ACQUISITION_FAILED", "요청이 몰려 처리하지 못했습니다. 잠시 후 다시 시도해주세요", 503),
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
