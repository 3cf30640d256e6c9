package com.pharmacy.ecommerce.application.order;

import com.pharmacy.ecommerce.application.cart.DraftOrderGuard;
import com.pharmacy.ecommerce.application.order.dto.OrderTransitionResult;
import com.pharmacy.ecommerce.domain.cart.EmptyCartException;
import com.pharmacy.ecommerce.domain.cart.NoDraftOrderException;
import com.pharmacy.ecommerce.domain.order.InvalidOrderStateTransitionException;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderAlreadyConfirmedException;
import com.pharmacy.ecommerce.domain.order.OrderCannotBeCancelledException;
import com.pharmacy.ecommerce.domain.order.OrderNotConfirmedException;
import com.pharmacy.ecommerce.domain.order.OrderNotFoundException;
import com.pharmacy.ecommerce.domain.order.OrderRepository;
import com.pharmacy.ecommerce.domain.order.OrderStateMachine;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
import com.pharmacy.ecommerce.domain.order.OrderTerminalStateException;
import com.pharmacy.ecommerce.domain.order.TransitionValidation;
import com.pharmacy.ecommerce.domain.order.event.DomainEventCollector;
import com.pharmacy.ecommerce.domain.order.event.OrderCancelledEvent;
import com.pharmacy.ecommerce.domain.order.event.OrderConfirmedEvent;
import com.pharmacy.ecommerce.infrastructure.lock.LockKeyGenerator;
import com.pharmacy.ecommerce.infrastructure.lock.UserCommandLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * OrderService - Application 계층 (확정 이후 주문 생명주기)
 *
 * 책임:
 * - 주문 접수 (장바구니 DRAFT → CREATED)
 * - 주문 확정 (CREATED → CONFIRMED)
 * - 결제 처리 (CONFIRMED → PAID). 실제 결제 연동은 없음
 * - 주문 취소 (종료 상태가 아닌 모든 상태 → CANCELLED)
 *
 * 모든 연산은 소유권을 먼저 확인하고, 다음으로 상태 머신 규칙을 확인한다.
 * 상태 저장은 compare-and-set이므로 동시에 다른 전이가 끼어들면 최신 상태 기준으로 실패한다.
 */
@Slf4j
@Service
public class OrderService {

    private final OrderRepository orderRepository;
    private final OrderAccessGuard orderAccessGuard;
    private final DraftOrderGuard draftOrderGuard;
    private final Clock clock;

    public OrderService(OrderRepository orderRepository,
                        OrderAccessGuard orderAccessGuard,
                        DraftOrderGuard draftOrderGuard,
                        Clock clock) {
        this.orderRepository = orderRepository;
        this.orderAccessGuard = orderAccessGuard;
        this.draftOrderGuard = draftOrderGuard;
        this.clock = clock;
    }

    /**
     * 주문 접수: 장바구니를 CREATED 상태로 넘긴다. 이후 confirmOrder로 확정한다.
     *
     * @throws NoDraftOrderException 장바구니가 없는 경우
     * @throws EmptyCartException 장바구니가 비어 있는 경우
     */
    @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
    public OrderTransitionResult placeOrder(String userId, String correlationId) {
        Order draft = draftOrderGuard.getDraftWithOwnershipCheck(userId);
        if (draft.getItemCount() == 0) {
            throw new EmptyCartException(draft.getId());
        }
        assertTransition(draft.getStatus(), OrderStatus.CREATED);

        Order placed = orderRepository
                .updateStatusIfCurrent(draft.getId(), OrderStatus.DRAFT, OrderStatus.CREATED)
                .orElseThrow(() -> new NoDraftOrderException(userId));

        log.info("[OrderService] 주문 접수 - orderId={}, total={}, correlationId={}",
                placed.getId(), placed.getTotal(), correlationId);
        return new OrderTransitionResult(placed, List.of());
    }

    /**
     * 주문 확정 (CREATED → CONFIRMED)
     *
     * @throws OrderAlreadyConfirmedException 이미 CONFIRMED 이후 단계인 경우
     * @throws InvalidOrderStateTransitionException 그 밖에 상태 머신이 거부하는 경우
     */
    @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
    public OrderTransitionResult confirmOrder(String userId, String orderId, String correlationId) {
        Order order = orderAccessGuard.getOwnedOrder(orderId, userId);
        OrderStatus current = order.getStatus();

        if (current == OrderStatus.CONFIRMED || OrderStateMachine.isPaid(current)) {
            throw new OrderAlreadyConfirmedException(orderId);
        }
        assertTransition(current, OrderStatus.CONFIRMED);
        if (order.getItemCount() == 0) {
            throw new EmptyCartException(orderId);
        }

        Order confirmed = compareAndSet(orderId, current, OrderStatus.CONFIRMED);

        DomainEventCollector events = new DomainEventCollector();
        events.add(OrderConfirmedEvent.of(confirmed, correlationId, LocalDateTime.now(clock)));

        log.info("[OrderService] 주문 확정 - orderId={}, from={}, total={}, correlationId={}",
                orderId, current, confirmed.getTotal(), correlationId);
        return new OrderTransitionResult(confirmed, events.getEvents());
    }

    /**
     * 결제 처리 (CONFIRMED → PAID)
     *
     * @throws OrderNotConfirmedException 현재 상태가 CONFIRMED가 아닌 경우
     */
    @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
    public OrderTransitionResult payForOrder(String userId, String orderId, String correlationId) {
        Order order = orderAccessGuard.getOwnedOrder(orderId, userId);
        if (order.getStatus() != OrderStatus.CONFIRMED) {
            throw new OrderNotConfirmedException(orderId, order.getStatus());
        }

        Order paid = compareAndSet(orderId, OrderStatus.CONFIRMED, OrderStatus.PAID);

        log.info("[OrderService] 결제 완료 - orderId={}, amount={}, correlationId={}",
                orderId, paid.getTotal(), correlationId);
        return new OrderTransitionResult(paid, List.of());
    }

    /**
     * 주문 취소
     *
     * @throws OrderTerminalStateException DELIVERED, CANCELLED 상태인 경우
     * @throws OrderCannotBeCancelledException 상태 머신이 취소를 거부하는 경우
     */
    @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
    public OrderTransitionResult cancelOrder(String userId, String orderId, String reason, String correlationId) {
        Order order = orderAccessGuard.getOwnedOrder(orderId, userId);
        OrderStatus previous = order.getStatus();

        if (previous.isTerminal()) {
            throw new OrderTerminalStateException(orderId, previous);
        }
        if (!OrderStateMachine.canCancel(previous)) {
            throw new OrderCannotBeCancelledException(orderId, previous);
        }

        Order cancelled = compareAndSet(orderId, previous, OrderStatus.CANCELLED);

        DomainEventCollector events = new DomainEventCollector();
        events.add(OrderCancelledEvent.of(order, reason, correlationId, LocalDateTime.now(clock)));

        log.info("[OrderService] 주문 취소 - orderId={}, previousStatus={}, reason={}, correlationId={}",
                orderId, previous, reason, correlationId);
        return new OrderTransitionResult(cancelled, events.getEvents());
    }

    // ========== 내부 헬퍼 ==========

    /**
     * 상태가 그 사이 바뀌었으면 최신 상태 기준의 전이 오류로 실패한다.
     */
    private Order compareAndSet(String orderId, OrderStatus expected, OrderStatus target) {
        return orderRepository.updateStatusIfCurrent(orderId, expected, target)
                .orElseThrow(() -> {
                    OrderStatus actual = orderRepository.findById(orderId)
                            .map(Order::getStatus)
                            .orElseThrow(() -> new OrderNotFoundException(orderId));
                    log.warn("[OrderService] 동시 상태 변경 감지 - orderId={}, expected={}, actual={}",
                            orderId, expected, actual);
                    return InvalidOrderStateTransitionException.of(actual, target);
                });
    }

    private static void assertTransition(OrderStatus from, OrderStatus to) {
        TransitionValidation validation = OrderStateMachine.validateTransition(from, to);
        if (!validation.isValid()) {
            throw new InvalidOrderStateTransitionException(from, to, validation.getAllowedTransitions());
        }
    }
}
