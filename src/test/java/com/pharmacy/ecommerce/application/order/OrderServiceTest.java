package com.pharmacy.ecommerce.application.order;

import com.pharmacy.ecommerce.application.cart.DraftOrderGuard;
import com.pharmacy.ecommerce.application.order.dto.OrderTransitionResult;
import com.pharmacy.ecommerce.domain.cart.EmptyCartException;
import com.pharmacy.ecommerce.domain.cart.NoDraftOrderException;
import com.pharmacy.ecommerce.domain.common.vo.Money;
import com.pharmacy.ecommerce.domain.order.InvalidOrderStateTransitionException;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderAlreadyConfirmedException;
import com.pharmacy.ecommerce.domain.order.OrderItem;
import com.pharmacy.ecommerce.domain.order.OrderNotConfirmedException;
import com.pharmacy.ecommerce.domain.order.OrderNotFoundException;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
import com.pharmacy.ecommerce.domain.order.OrderTerminalStateException;
import com.pharmacy.ecommerce.domain.order.UnauthorizedOrderAccessException;
import com.pharmacy.ecommerce.domain.order.event.OrderCancelledEvent;
import com.pharmacy.ecommerce.domain.order.event.OrderConfirmedEvent;
import com.pharmacy.ecommerce.infrastructure.persistence.order.InMemoryOrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OrderServiceTest - Application 계층 단위 테스트
 *
 * 테스트 대상: OrderService
 * - 주문 접수 / 확정 / 결제 / 취소
 *
 * 테스트 유형:
 * - 성공 케이스: 허용된 상태 전이와 이벤트
 * - 실패 케이스: 소유권, 종료 상태, 상태 머신 거부
 */
@DisplayName("OrderService 단위 테스트")
class OrderServiceTest {

    private static final String USER_ID = "user-1";
    private static final String OTHER_USER_ID = "user-2";
    private static final String CORRELATION_ID = "corr-1";
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 2, 1, 9, 0);

    private InMemoryOrderRepository orderRepository;
    private OrderService orderService;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-01T09:00:00Z"), ZoneOffset.UTC);
        orderRepository = new InMemoryOrderRepository(clock, "INR");
        orderService = new OrderService(orderRepository, new OrderAccessGuard(orderRepository),
                new DraftOrderGuard(orderRepository), clock);
    }

    private Order orderWithItems(OrderStatus status) {
        Order order = orderRepository.createOrder(USER_ID, status);
        return orderRepository.addItem(order.getId(),
                OrderItem.create("prod-001", "Paracetamol 500mg", Money.of(2500), 2, NOW));
    }

    // ========== 주문 접수 ==========

    @Test
    @DisplayName("placeOrder - DRAFT → CREATED, 이벤트 없음")
    void testPlaceOrder_Success() {
        Order draft = orderWithItems(OrderStatus.DRAFT);

        OrderTransitionResult result = orderService.placeOrder(USER_ID, CORRELATION_ID);

        assertEquals(draft.getId(), result.getOrder().getId());
        assertEquals(OrderStatus.CREATED, result.getOrder().getStatus());
        assertTrue(result.getEvents().isEmpty());
        assertFalse(orderRepository.hasDraft(USER_ID));
    }

    @Test
    @DisplayName("placeOrder 실패 - 장바구니 없음 / 빈 장바구니")
    void testPlaceOrder_Failures() {
        assertThrows(NoDraftOrderException.class, () -> orderService.placeOrder(USER_ID, CORRELATION_ID));

        orderRepository.findOrCreateDraft(USER_ID);
        assertThrows(EmptyCartException.class, () -> orderService.placeOrder(USER_ID, CORRELATION_ID));
    }

    // ========== 주문 확정 ==========

    @Test
    @DisplayName("confirmOrder - CREATED → CONFIRMED, OrderConfirmed 이벤트")
    void testConfirmOrder_Success() {
        Order order = orderWithItems(OrderStatus.CREATED);

        OrderTransitionResult result = orderService.confirmOrder(USER_ID, order.getId(), CORRELATION_ID);

        assertEquals(OrderStatus.CONFIRMED, result.getOrder().getStatus());
        OrderConfirmedEvent event = (OrderConfirmedEvent) result.getEvents().get(0);
        assertEquals(order.getId(), event.getOrderId());
        assertEquals(Money.of(5000), event.getTotal());
        assertEquals(2, event.getItemCount());
    }

    @Test
    @DisplayName("confirmOrder 실패 - 이미 확정/결제된 주문")
    void testConfirmOrder_AlreadyConfirmed() {
        Order confirmed = orderWithItems(OrderStatus.CONFIRMED);
        Order paid = orderWithItems(OrderStatus.PAID);

        assertThrows(OrderAlreadyConfirmedException.class,
                () -> orderService.confirmOrder(USER_ID, confirmed.getId(), CORRELATION_ID));
        assertThrows(OrderAlreadyConfirmedException.class,
                () -> orderService.confirmOrder(USER_ID, paid.getId(), CORRELATION_ID));
    }

    @Test
    @DisplayName("confirmOrder 실패 - 취소된 주문은 상태 전이 오류 (허용 목록 비어 있음)")
    void testConfirmOrder_Cancelled() {
        Order cancelled = orderWithItems(OrderStatus.CANCELLED);

        InvalidOrderStateTransitionException e = assertThrows(InvalidOrderStateTransitionException.class,
                () -> orderService.confirmOrder(USER_ID, cancelled.getId(), CORRELATION_ID));

        assertEquals(OrderStatus.CANCELLED, e.getCurrentStatus());
        assertTrue(e.getAllowedTransitions().isEmpty());
    }

    @Test
    @DisplayName("confirmOrder 실패 - 빈 주문")
    void testConfirmOrder_Empty() {
        Order empty = orderRepository.createOrder(USER_ID, OrderStatus.CREATED);

        assertThrows(EmptyCartException.class,
                () -> orderService.confirmOrder(USER_ID, empty.getId(), CORRELATION_ID));
    }

    @Test
    @DisplayName("소유권 - 다른 사용자 주문은 UnauthorizedOrderAccessException, 없는 주문은 OrderNotFoundException")
    void testOwnershipAndNotFound() {
        Order order = orderWithItems(OrderStatus.CREATED);

        assertThrows(UnauthorizedOrderAccessException.class,
                () -> orderService.confirmOrder(OTHER_USER_ID, order.getId(), CORRELATION_ID));
        assertThrows(UnauthorizedOrderAccessException.class,
                () -> orderService.cancelOrder(OTHER_USER_ID, order.getId(), null, CORRELATION_ID));
        assertThrows(OrderNotFoundException.class,
                () -> orderService.payForOrder(USER_ID, "missing", CORRELATION_ID));

        assertEquals(OrderStatus.CREATED, orderRepository.findById(order.getId()).orElseThrow().getStatus());
    }

    // ========== 결제 ==========

    @Test
    @DisplayName("payForOrder - CONFIRMED → PAID")
    void testPayForOrder_Success() {
        Order order = orderWithItems(OrderStatus.CONFIRMED);

        OrderTransitionResult result = orderService.payForOrder(USER_ID, order.getId(), CORRELATION_ID);

        assertEquals(OrderStatus.PAID, result.getOrder().getStatus());
        assertTrue(result.getEvents().isEmpty());
    }

    @Test
    @DisplayName("payForOrder 실패 - CONFIRMED가 아니면 OrderNotConfirmedException")
    void testPayForOrder_NotConfirmed() {
        Order created = orderWithItems(OrderStatus.CREATED);
        Order paid = orderWithItems(OrderStatus.PAID);

        assertThrows(OrderNotConfirmedException.class,
                () -> orderService.payForOrder(USER_ID, created.getId(), CORRELATION_ID));
        assertThrows(OrderNotConfirmedException.class,
                () -> orderService.payForOrder(USER_ID, paid.getId(), CORRELATION_ID));
    }

    // ========== 취소 ==========

    @Test
    @DisplayName("cancelOrder - PAID → CANCELLED, 이전 상태와 사유가 이벤트에 기록")
    void testCancelOrder_Success() {
        Order order = orderWithItems(OrderStatus.PAID);

        OrderTransitionResult result = orderService.cancelOrder(USER_ID, order.getId(), "고객 변심", CORRELATION_ID);

        assertEquals(OrderStatus.CANCELLED, result.getOrder().getStatus());
        OrderCancelledEvent event = (OrderCancelledEvent) result.getEvents().get(0);
        assertEquals(OrderStatus.PAID, event.getPreviousStatus());
        assertEquals("고객 변심", event.getReason());
        assertEquals(Money.of(5000), event.getTotal());
    }

    @Test
    @DisplayName("cancelOrder - 사유 없이도 취소 가능")
    void testCancelOrder_WithoutReason() {
        Order order = orderWithItems(OrderStatus.SHIPPED);

        OrderTransitionResult result = orderService.cancelOrder(USER_ID, order.getId(), null, CORRELATION_ID);

        assertNull(((OrderCancelledEvent) result.getEvents().get(0)).getReason());
    }

    @Test
    @DisplayName("cancelOrder 실패 - 종료 상태 (DELIVERED, CANCELLED)")
    void testCancelOrder_Terminal() {
        Order delivered = orderWithItems(OrderStatus.DELIVERED);
        Order cancelled = orderWithItems(OrderStatus.CANCELLED);

        assertThrows(OrderTerminalStateException.class,
                () -> orderService.cancelOrder(USER_ID, delivered.getId(), null, CORRELATION_ID));
        assertThrows(OrderTerminalStateException.class,
                () -> orderService.cancelOrder(USER_ID, cancelled.getId(), null, CORRELATION_ID));
    }
}
