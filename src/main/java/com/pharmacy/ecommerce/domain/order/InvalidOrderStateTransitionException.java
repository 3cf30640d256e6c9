package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

import java.util.List;

/**
 * 상태 머신이 요청된 전이를 거부했을 때 발생하는 예외 (409)
 * 클라이언트 안내를 위해 허용 가능한 전이 목록을 포함한다.
 */
@Getter
public class InvalidOrderStateTransitionException extends DomainException {

    private final OrderStatus currentStatus;
    private final OrderStatus targetStatus;
    private final List<OrderStatus> allowedTransitions;

    public InvalidOrderStateTransitionException(OrderStatus currentStatus, OrderStatus targetStatus,
                                                List<OrderStatus> allowedTransitions) {
        super(ErrorCode.INVALID_ORDER_STATE_TRANSITION,
                String.format("%s → %s (허용: %s)", currentStatus, targetStatus, allowedTransitions));
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
        this.allowedTransitions = List.copyOf(allowedTransitions);
    }

    public static InvalidOrderStateTransitionException of(OrderStatus current, OrderStatus target) {
        return new InvalidOrderStateTransitionException(current, target,
                OrderStateMachine.getAllowedTransitions(current));
    }
}
