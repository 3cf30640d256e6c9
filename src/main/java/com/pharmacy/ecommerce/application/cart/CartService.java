package com.pharmacy.ecommerce.application.cart;

import com.pharmacy.ecommerce.application.cart.dto.CheckoutResult;
import com.pharmacy.ecommerce.application.order.PrescriptionRequirementChecker;
import com.pharmacy.ecommerce.application.order.dto.OrderTransitionResult;
import com.pharmacy.ecommerce.domain.cart.EmptyCartException;
import com.pharmacy.ecommerce.domain.cart.NoDraftOrderException;
import com.pharmacy.ecommerce.domain.catalog.CatalogProduct;
import com.pharmacy.ecommerce.domain.catalog.ProductCatalog;
import com.pharmacy.ecommerce.domain.catalog.ProductNotFoundException;
import com.pharmacy.ecommerce.domain.order.InvalidOrderStateTransitionException;
import com.pharmacy.ecommerce.domain.order.InvalidQuantityException;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderItem;
import com.pharmacy.ecommerce.domain.order.OrderItemNotFoundException;
import com.pharmacy.ecommerce.domain.order.OrderRepository;
import com.pharmacy.ecommerce.domain.order.OrderStateMachine;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
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
import java.util.Optional;

/**
 * CartService - Application 계층
 *
 * 장바구니는 DRAFT 상태의 주문이다. 사용자당 DRAFT는 최대 1개.
 *
 * 책임:
 * - DRAFT 생성(멱등), 항목 추가/수량 변경/삭제/비우기
 * - 장바구니 포기 (DRAFT → CANCELLED)
 * - 체크아웃 (DRAFT → CONFIRMED) 및 OrderConfirmed 이벤트 생성
 *
 * 모든 변경 명령은 사용자 단위 락 안에서 DRAFT를 다시 읽고 소유권/상태를 재검증한다.
 * 항목 변경은 저장소 잠금 안에서 DRAFT를 한 번 더 확인하므로, 검증 이후 확정/취소된
 * 장바구니를 대상으로 한 요청도 NoDraftOrder로 실패한다.
 */
@Slf4j
@Service
public class CartService {

    static final String ABANDON_REASON = "CART_ABANDONED";

    private final OrderRepository orderRepository;
    private final ProductCatalog productCatalog;
    private final DraftOrderGuard draftOrderGuard;
    private final PrescriptionRequirementChecker prescriptionRequirementChecker;
    private final Clock clock;

    public CartService(OrderRepository orderRepository,
                       ProductCatalog productCatalog,
                       DraftOrderGuard draftOrderGuard,
                       PrescriptionRequirementChecker prescriptionRequirementChecker,
                       Clock clock) {
        this.orderRepository = orderRepository;
        this.productCatalog = productCatalog;
        this.draftOrderGuard = draftOrderGuard;
        this.prescriptionRequirementChecker = prescriptionRequirementChecker;
        this.clock = clock;
    }

    // ========== 조회 ==========

    /**
     * 사용자의 장바구니 조회. 부수 효과 없음.
     */
    public Optional<Order> getCart(String userId, String correlationId) {
        log.debug("[CartService] 장바구니 조회 - userId={}, correlationId={}", userId, correlationId);
        return orderRepository.findDraftByUserId(userId);
    }

    /**
     * @throws NoDraftOrderException 장바구니가 없는 경우
     */
    public Order getCartOrFail(String userId, String correlationId) {
        return getCart(userId, correlationId)
                .orElseThrow(() -> new NoDraftOrderException(userId));
    }

    // ========== 생성/항목 변경 ==========

    /**
     * 장바구니 생성 (멱등). 이미 있으면 기존 DRAFT를 반환한다.
     */
    @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
    public Order createDraftOrder(String userId, String correlationId) {
        Order draft = orderRepository.findOrCreateDraft(userId);
        draftOrderGuard.verify(draft, userId);
        log.info("[CartService] 장바구니 확보 - orderId={}, userId={}, correlationId={}",
                draft.getId(), userId, correlationId);
        return draft;
    }

    /**
     * 장바구니에 상품 추가
     *
     * 처리 순서:
     * 1. 수량 검증 (1 이상)
     * 2. 카탈로그 조회 (존재 + 판매 중)
     * 3. 상품명/단가 스냅샷 생성
     * 4. DRAFT 확보 (없으면 생성)
     * 5. 같은 상품이면 수량 합산, 아니면 추가
     *
     * @throws InvalidQuantityException 수량이 없거나 1 미만
     * @throws ProductNotFoundException 상품이 없거나 판매 중지
     */
    @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
    public Order addItemToCart(String userId, String productId, Integer quantity, String correlationId) {
        validateQuantity(quantity);

        CatalogProduct product = productCatalog.getProductById(productId);
        if (!product.isActive()) {
            log.warn("[CartService] 판매 중지 상품 추가 시도 - productId={}, userId={}", productId, userId);
            throw new ProductNotFoundException(productId);
        }

        OrderItem snapshot = OrderItem.create(product.getId(), product.getName(), product.getPrice(),
                quantity, LocalDateTime.now(clock));

        Order draft = orderRepository.findOrCreateDraft(userId);
        draftOrderGuard.verify(draft, userId);

        Order updated = orderRepository.changeDraftItems(draft.getId(), order -> order.withItemMerged(snapshot));
        log.info("[CartService] 상품 추가 - orderId={}, productId={}, quantity={}, total={}, correlationId={}",
                updated.getId(), productId, quantity, updated.getTotal(), correlationId);
        return updated;
    }

    /**
     * @throws OrderItemNotFoundException 장바구니에 없는 상품
     */
    @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
    public Order removeItemFromCart(String userId, String productId, String correlationId) {
        Order draft = draftOrderGuard.getDraftWithOwnershipCheck(userId);
        requireItem(draft, productId);

        Order updated = orderRepository.changeDraftItems(draft.getId(), order -> order.withoutItem(productId));
        log.info("[CartService] 상품 삭제 - orderId={}, productId={}, correlationId={}",
                draft.getId(), productId, correlationId);
        return updated;
    }

    @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
    public Order updateItemQuantity(String userId, String productId, Integer quantity, String correlationId) {
        validateQuantity(quantity);
        Order draft = draftOrderGuard.getDraftWithOwnershipCheck(userId);
        requireItem(draft, productId);

        Order updated = orderRepository.changeDraftItems(draft.getId(),
                order -> order.withItemQuantity(productId, quantity));
        log.info("[CartService] 수량 변경 - orderId={}, productId={}, quantity={}, correlationId={}",
                draft.getId(), productId, quantity, correlationId);
        return updated;
    }

    /**
     * 항목만 비우고 DRAFT 상태는 유지한다.
     */
    @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
    public Order clearCart(String userId, String correlationId) {
        Order draft = draftOrderGuard.getDraftWithOwnershipCheck(userId);
        Order updated = orderRepository.changeDraftItems(draft.getId(), Order::withoutItems);
        log.info("[CartService] 장바구니 비움 - orderId={}, correlationId={}", draft.getId(), correlationId);
        return updated;
    }

    // ========== 상태 전이 ==========

    /**
     * 장바구니 포기 (DRAFT → CANCELLED). 이후 사용자는 새 장바구니를 만들 수 있다.
     */
    @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
    public OrderTransitionResult abandonCart(String userId, String correlationId) {
        Order draft = draftOrderGuard.getDraftWithOwnershipCheck(userId);
        assertTransition(draft.getStatus(), OrderStatus.CANCELLED);

        Order cancelled = orderRepository
                .updateStatusIfCurrent(draft.getId(), OrderStatus.DRAFT, OrderStatus.CANCELLED)
                .orElseThrow(() -> new NoDraftOrderException(userId));

        DomainEventCollector events = new DomainEventCollector();
        events.add(OrderCancelledEvent.of(draft, ABANDON_REASON, correlationId, LocalDateTime.now(clock)));

        log.info("[CartService] 장바구니 포기 - orderId={}, correlationId={}", draft.getId(), correlationId);
        return new OrderTransitionResult(cancelled, events.getEvents());
    }

    /**
     * 체크아웃 (DRAFT → CONFIRMED)
     *
     * 단계 (각 단계 실패 시 즉시 중단):
     * 1. DRAFT + 소유권 확인 → NoDraftOrder / UnauthorizedOrderAccess
     * 2. 빈 장바구니 거부 → EmptyCart
     * 3. 처방 필요 여부 계산 (체크아웃을 막지 않음)
     * 4. 상태 머신 검증 → InvalidOrderStateTransition
     * 5. CONFIRMED 저장 (합계 확정, 이후 항목 변경 불가)
     * 6. OrderConfirmed 이벤트 생성
     *
     * 같은 장바구니를 두 번 확정하면 두 번째는 NoDraftOrder로 실패한다.
     */
    @UserCommandLock(key = LockKeyGenerator.USER_ORDER_KEY_TEMPLATE)
    public CheckoutResult confirmDraftOrder(String userId, String correlationId) {
        Order draft = draftOrderGuard.getDraftWithOwnershipCheck(userId);

        if (draft.getItemCount() == 0) {
            throw new EmptyCartException(draft.getId());
        }

        boolean requiresPrescription = prescriptionRequirementChecker.requiresPrescription(draft);

        assertTransition(draft.getStatus(), OrderStatus.CONFIRMED);

        Order confirmed = orderRepository
                .updateStatusIfCurrent(draft.getId(), OrderStatus.DRAFT, OrderStatus.CONFIRMED)
                .orElseThrow(() -> new NoDraftOrderException(userId));

        DomainEventCollector events = new DomainEventCollector();
        events.add(OrderConfirmedEvent.of(confirmed, correlationId, LocalDateTime.now(clock)));

        log.info("[CartService] 체크아웃 완료 - orderId={}, total={}, itemCount={}, requiresPrescription={}, correlationId={}",
                confirmed.getId(), confirmed.getTotal(), confirmed.getItemCount(), requiresPrescription, correlationId);
        return new CheckoutResult(confirmed, events.getEvents(), requiresPrescription);
    }

    // ========== 내부 헬퍼 ==========

    private static void validateQuantity(Integer quantity) {
        if (quantity == null || quantity <= 0) {
            throw new InvalidQuantityException(quantity);
        }
    }

    private static void requireItem(Order draft, String productId) {
        if (draft.findItem(productId).isEmpty()) {
            throw new OrderItemNotFoundException(draft.getId(), productId);
        }
    }

    private static void assertTransition(OrderStatus from, OrderStatus to) {
        TransitionValidation validation = OrderStateMachine.validateTransition(from, to);
        if (!validation.isValid()) {
            throw new InvalidOrderStateTransitionException(from, to, validation.getAllowedTransitions());
        }
    }
}
