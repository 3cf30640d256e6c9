package com.pharmacy.ecommerce.domain.order;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 상태 전이 검증 결과. 실패 시 사유와 허용 가능한 전이 목록을 함께 제공한다.
 */
@Getter
@ToString
public final class TransitionValidation {

    private final boolean valid;
    private final String reason;
    private final List<OrderStatus> allowedTransitions;

    private TransitionValidation(boolean valid, String reason, List<OrderStatus> allowedTransitions) {
        this.valid = valid;
        this.reason = reason;
        this.allowedTransitions = List.copyOf(allowedTransitions);
    }

    static TransitionValidation ok(List<OrderStatus> allowedTransitions) {
        return new TransitionValidation(true, null, allowedTransitions);
    }

    static TransitionValidation rejected(String reason, List<OrderStatus> allowedTransitions) {
        return new TransitionValidation(false, reason, allowedTransitions);
    }
}
