package com.pharmacy.ecommerce.infrastructure.persistence.order;

import com.pharmacy.ecommerce.domain.cart.NoDraftOrderException;
import com.pharmacy.ecommerce.domain.common.page.PageQuery;
import com.pharmacy.ecommerce.domain.common.page.PagedResult;
import com.pharmacy.ecommerce.domain.common.vo.Money;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderItem;
import com.pharmacy.ecommerce.domain.order.OrderNotFoundException;
import com.pharmacy.ecommerce.domain.order.OrderRepository;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * InMemoryOrderRepository - Order 저장소 구현체 (인메모리)
 *
 * ConcurrentHashMap으로 보관하고, 조회 후 변경이 필요한 연산은 synchronized로 묶는다.
 * 사용자 단위 조회는 전체 순회(O(n))이므로 참조 구현/테스트 용도로만 사용한다.
 *
 * createdAt이 같은 주문은 나중에 저장된 것이 먼저 오도록 저장 순번으로 정렬한다.
 */
@Slf4j
public class InMemoryOrderRepository implements OrderRepository {

    private final ConcurrentHashMap<String, Order> orders = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> insertionSequence = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;
    private final String defaultCurrency;

    public InMemoryOrderRepository(Clock clock, String defaultCurrency) {
        this.clock = clock;
        this.defaultCurrency = defaultCurrency;
    }

    public InMemoryOrderRepository() {
        this(Clock.systemDefaultZone(), Money.DEFAULT_CURRENCY);
    }

    // ========== 생성/조회 ==========

    @Override
    public synchronized Order createOrder(String userId, OrderStatus status) {
        LocalDateTime now = LocalDateTime.now(clock);
        Order order = Order.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .status(status)
                .items(List.of())
                .createdAt(now)
                .updatedAt(now)
                .currency(defaultCurrency)
                .build();
        orders.put(order.getId(), order);
        insertionSequence.put(order.getId(), sequence.incrementAndGet());
        log.debug("[InMemoryOrderRepository] 주문 생성 - orderId={}, userId={}, status={}",
                order.getId(), userId, status);
        return order;
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public boolean exists(String orderId) {
        return orders.containsKey(orderId);
    }

    @Override
    public List<Order> findByUserId(String userId) {
        return orders.values().stream()
                .filter(order -> order.getUserId().equals(userId))
                .sorted(newestFirst())
                .toList();
    }

    @Override
    public List<Order> findByUserId(String userId, OrderStatus status) {
        return orders.values().stream()
                .filter(order -> order.getUserId().equals(userId))
                .filter(order -> order.getStatus() == status)
                .sorted(newestFirst())
                .toList();
    }

    @Override
    public PagedResult<Order> findByUserIdPaginated(String userId, PageQuery query) {
        List<Order> history = orders.values().stream()
                .filter(order -> order.getUserId().equals(userId))
                .filter(order -> order.getStatus() != OrderStatus.DRAFT)
                .sorted(newestFirst())
                .toList();
        List<Order> page = history.stream()
                .skip(query.getOffset())
                .limit(query.getLimit())
                .toList();
        return PagedResult.of(page, history.size(), query);
    }

    @Override
    public Optional<Order> findDraftByUserId(String userId) {
        return orders.values().stream()
                .filter(order -> order.getUserId().equals(userId))
                .filter(Order::isDraft)
                .findFirst();
    }

    @Override
    public boolean hasDraft(String userId) {
        return findDraftByUserId(userId).isPresent();
    }

    @Override
    public synchronized Order findOrCreateDraft(String userId) {
        return findDraftByUserId(userId)
                .orElseGet(() -> createOrder(userId, OrderStatus.DRAFT));
    }

    // ========== 상태 변경 ==========

    @Override
    public synchronized Order updateStatus(String orderId, OrderStatus status) {
        return modify(orderId, order -> order.toBuilder().status(status).build());
    }

    @Override
    public synchronized Optional<Order> updateStatusIfCurrent(String orderId, OrderStatus expected, OrderStatus target) {
        Order current = getOrThrow(orderId);
        if (current.getStatus() != expected) {
            return Optional.empty();
        }
        return Optional.of(updateStatus(orderId, target));
    }

    // ========== 항목 변경 ==========

    @Override
    public synchronized Order addItem(String orderId, OrderItem item) {
        return modify(orderId, order -> order.withItemMerged(item));
    }

    @Override
    public synchronized Order updateItemQuantity(String orderId, String productId, int quantity) {
        return modify(orderId, order -> order.withItemQuantity(productId, quantity));
    }

    @Override
    public synchronized Order removeItem(String orderId, String productId) {
        return modify(orderId, order -> order.withoutItem(productId));
    }

    @Override
    public synchronized Order clearItems(String orderId) {
        return modify(orderId, Order::withoutItems);
    }

    @Override
    public synchronized Order changeDraftItems(String orderId, UnaryOperator<Order> change) {
        Order current = getOrThrow(orderId);
        if (!current.isDraft()) {
            log.warn("[InMemoryOrderRepository] DRAFT 아님, 항목 변경 거부 - orderId={}, status={}",
                    orderId, current.getStatus());
            throw new NoDraftOrderException(current.getUserId());
        }
        return modify(orderId, change);
    }

    @Override
    public Optional<OrderItem> getItem(String orderId, String productId) {
        return findById(orderId).flatMap(order -> order.findItem(productId));
    }

    /**
     * 테스트용 저장소 초기화
     */
    public synchronized void clear() {
        orders.clear();
        insertionSequence.clear();
    }

    // ========== 내부 헬퍼 ==========

    private Order modify(String orderId, UnaryOperator<Order> change) {
        Order current = getOrThrow(orderId);
        Order updated = change.apply(current).toBuilder()
                .updatedAt(LocalDateTime.now(clock))
                .build();
        orders.put(orderId, updated);
        return updated;
    }

    private Order getOrThrow(String orderId) {
        Order order = orders.get(orderId);
        if (order == null) {
            throw new OrderNotFoundException(orderId);
        }
        return order;
    }

    private Comparator<Order> newestFirst() {
        return Comparator.comparing(Order::getCreatedAt)
                .thenComparing(order -> insertionSequence.getOrDefault(order.getId(), 0L))
                .reversed();
    }
}
