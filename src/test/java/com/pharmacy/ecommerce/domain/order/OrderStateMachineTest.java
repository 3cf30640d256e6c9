package com.pharmacy.ecommerce.domain.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OrderStateMachine - 전이 테이블과 파생 판정 검증
 */
@DisplayName("OrderStateMachine 테스트")
class OrderStateMachineTest {

    @Test
    @DisplayName("전이 테이블 - 상태별 허용 목록")
    void testAllowedTransitions() {
        assertEquals(List.of(OrderStatus.CREATED, OrderStatus.CONFIRMED, OrderStatus.CANCELLED),
                OrderStateMachine.getAllowedTransitions(OrderStatus.DRAFT));
        assertEquals(List.of(OrderStatus.CONFIRMED, OrderStatus.CANCELLED),
                OrderStateMachine.getAllowedTransitions(OrderStatus.CREATED));
        assertEquals(List.of(OrderStatus.PAID, OrderStatus.CANCELLED),
                OrderStateMachine.getAllowedTransitions(OrderStatus.CONFIRMED));
        assertEquals(List.of(OrderStatus.SHIPPED, OrderStatus.CANCELLED),
                OrderStateMachine.getAllowedTransitions(OrderStatus.PAID));
        assertEquals(List.of(OrderStatus.DELIVERED, OrderStatus.CANCELLED),
                OrderStateMachine.getAllowedTransitions(OrderStatus.SHIPPED));
        assertTrue(OrderStateMachine.getAllowedTransitions(OrderStatus.DELIVERED).isEmpty());
        assertTrue(OrderStateMachine.getAllowedTransitions(OrderStatus.CANCELLED).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(OrderStatus.class)
    @DisplayName("canTransition과 validateTransition은 모든 상태 쌍에서 일치")
    void testCanTransitionMatchesValidation(OrderStatus from) {
        for (OrderStatus to : OrderStatus.values()) {
            TransitionValidation validation = OrderStateMachine.validateTransition(from, to);
            assertEquals(OrderStateMachine.canTransition(from, to), validation.isValid(), from + " → " + to);
            assertEquals(OrderStateMachine.getAllowedTransitions(from), validation.getAllowedTransitions());
        }
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"DELIVERED", "CANCELLED"})
    @DisplayName("종료 상태에서는 어떤 전이도 불가")
    void testTerminalStates(OrderStatus terminal) {
        assertTrue(OrderStateMachine.isTerminal(terminal));
        assertFalse(OrderStateMachine.canCancel(terminal));

        TransitionValidation validation = OrderStateMachine.validateTransition(terminal, OrderStatus.CANCELLED);
        assertFalse(validation.isValid());
        assertEquals("Cannot transition from terminal state " + terminal, validation.getReason());
    }

    @Test
    @DisplayName("거부 사유 - 허용 목록을 포함")
    void testValidateTransition_RejectedReason() {
        TransitionValidation validation = OrderStateMachine.validateTransition(OrderStatus.CREATED, OrderStatus.PAID);

        assertFalse(validation.isValid());
        assertEquals("Invalid transition from CREATED to PAID. Allowed: CONFIRMED, CANCELLED",
                validation.getReason());
    }

    @Test
    @DisplayName("허용된 전이는 사유 없음")
    void testValidateTransition_Ok() {
        TransitionValidation validation = OrderStateMachine.validateTransition(OrderStatus.CONFIRMED, OrderStatus.PAID);

        assertTrue(validation.isValid());
        assertNull(validation.getReason());
    }

    @Test
    @DisplayName("자기 자신으로의 전이는 불가")
    void testSelfTransition() {
        for (OrderStatus status : OrderStatus.values()) {
            assertFalse(OrderStateMachine.canTransition(status, status));
        }
    }

    @Test
    @DisplayName("파생 판정 - 결제 여부, 변경 가능 여부, DRAFT 여부")
    void testDerivedPredicates() {
        assertTrue(OrderStateMachine.isPaid(OrderStatus.PAID));
        assertTrue(OrderStateMachine.isPaid(OrderStatus.SHIPPED));
        assertTrue(OrderStateMachine.isPaid(OrderStatus.DELIVERED));
        assertFalse(OrderStateMachine.isPaid(OrderStatus.CONFIRMED));

        assertTrue(OrderStateMachine.isModifiable(OrderStatus.CREATED));
        assertFalse(OrderStateMachine.isModifiable(OrderStatus.PAID));

        assertTrue(OrderStateMachine.canModifyItems(OrderStatus.DRAFT));
        assertFalse(OrderStateMachine.canModifyItems(OrderStatus.CREATED));

        assertTrue(OrderStateMachine.canConfirmOrder(OrderStatus.DRAFT));
        assertTrue(OrderStateMachine.canConfirmOrder(OrderStatus.CREATED));
        assertFalse(OrderStateMachine.canConfirmOrder(OrderStatus.PAID));

        assertTrue(OrderStateMachine.isDraft(OrderStatus.DRAFT));
    }

    @Test
    @DisplayName("OrderStatus.from - 대소문자 무시, 잘못된 값은 예외")
    void testStatusFrom() {
        assertEquals(OrderStatus.PAID, OrderStatus.from("paid"));
        assertEquals(OrderStatus.DRAFT, OrderStatus.from(" Draft "));
        assertThrows(IllegalArgumentException.class, () -> OrderStatus.from("REFUNDED"));
        assertThrows(IllegalArgumentException.class, () -> OrderStatus.from(null));
    }
}
