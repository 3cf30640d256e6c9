package com.pharmacy.ecommerce.domain.order;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * OrderStateMachine - 주문 상태 전이 규칙 (순수 함수 모듈)
 *
 * 전이 테이블:
 * DRAFT     → CREATED, CONFIRMED, CANCELLED
 * CREATED   → CONFIRMED, CANCELLED
 * CONFIRMED → PAID, CANCELLED
 * PAID      → SHIPPED, CANCELLED
 * SHIPPED   → DELIVERED, CANCELLED
 * DELIVERED, CANCELLED → (없음)
 *
 * 내부 상태가 없으므로 어느 스레드에서든 호출할 수 있다.
 */
public final class OrderStateMachine {

    private static final Map<OrderStatus, List<OrderStatus>> ALLOWED_TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        ALLOWED_TRANSITIONS.put(OrderStatus.DRAFT,
                List.of(OrderStatus.CREATED, OrderStatus.CONFIRMED, OrderStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(OrderStatus.CREATED,
                List.of(OrderStatus.CONFIRMED, OrderStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(OrderStatus.CONFIRMED,
                List.of(OrderStatus.PAID, OrderStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(OrderStatus.PAID,
                List.of(OrderStatus.SHIPPED, OrderStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(OrderStatus.SHIPPED,
                List.of(OrderStatus.DELIVERED, OrderStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(OrderStatus.DELIVERED, List.of());
        ALLOWED_TRANSITIONS.put(OrderStatus.CANCELLED, List.of());
    }

    private OrderStateMachine() {
    }

    public static List<OrderStatus> getAllowedTransitions(OrderStatus status) {
        return ALLOWED_TRANSITIONS.get(status);
    }

    public static boolean canTransition(OrderStatus from, OrderStatus to) {
        if (from.isTerminal()) {
            return false;
        }
        return ALLOWED_TRANSITIONS.get(from).contains(to);
    }

    public static TransitionValidation validateTransition(OrderStatus from, OrderStatus to) {
        List<OrderStatus> allowed = getAllowedTransitions(from);
        if (from.isTerminal()) {
            return TransitionValidation.rejected("Cannot transition from terminal state " + from, allowed);
        }
        if (!allowed.contains(to)) {
            String allowedText = allowed.stream().map(Enum::name).collect(Collectors.joining(", "));
            return TransitionValidation.rejected(
                    "Invalid transition from " + from + " to " + to + ". Allowed: " + allowedText, allowed);
        }
        return TransitionValidation.ok(allowed);
    }

    // ========== 파생 판정 ==========

    public static boolean canCancel(OrderStatus status) {
        return canTransition(status, OrderStatus.CANCELLED);
    }

    /**
     * 결제가 완료된 이후 단계인지 (PAID, SHIPPED, DELIVERED)
     */
    public static boolean isPaid(OrderStatus status) {
        return status == OrderStatus.PAID
                || status == OrderStatus.SHIPPED
                || status == OrderStatus.DELIVERED;
    }

    /**
     * 아직 결제 전 단계라 상태 변경 여지가 있는지 (DRAFT, CREATED, CONFIRMED)
     */
    public static boolean isModifiable(OrderStatus status) {
        return status == OrderStatus.DRAFT
                || status == OrderStatus.CREATED
                || status == OrderStatus.CONFIRMED;
    }

    public static boolean canModifyItems(OrderStatus status) {
        return status.isMutable();
    }

    public static boolean canConfirmOrder(OrderStatus status) {
        return canTransition(status, OrderStatus.CONFIRMED);
    }

    public static boolean isTerminal(OrderStatus status) {
        return status.isTerminal();
    }

    public static boolean isDraft(OrderStatus status) {
        return status == OrderStatus.DRAFT;
    }
}
