package com.pharmacy.ecommerce.infrastructure.persistence.order;

import com.pharmacy.ecommerce.domain.cart.NoDraftOrderException;
import com.pharmacy.ecommerce.domain.common.page.PageQuery;
import com.pharmacy.ecommerce.domain.common.page.PagedResult;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderItem;
import com.pharmacy.ecommerce.domain.order.OrderNotFoundException;
import com.pharmacy.ecommerce.domain.order.OrderRepository;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * MySQL 기반 Order Repository 구현
 *
 * 동시성 제어:
 * - 사용자당 DRAFT 1개: orders.draft_owner UNIQUE 제약
 * - 상태 전이/항목 변경: SELECT ... FOR UPDATE 후 변경 (같은 트랜잭션)
 * - 장바구니 항목 변경: 잠금 안에서 DRAFT 재확인 (확정된 주문의 합계는 바뀌지 않음)
 */
@Slf4j
public class JpaOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;
    private final Clock clock;
    private final String defaultCurrency;
    private final TransactionTemplate newTransaction;
    private final TransactionTemplate readTransaction;

    public JpaOrderRepository(OrderJpaRepository orderJpaRepository, Clock clock, String defaultCurrency,
                              PlatformTransactionManager transactionManager) {
        this.orderJpaRepository = orderJpaRepository;
        this.clock = clock;
        this.defaultCurrency = defaultCurrency;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
    }

    // ========== 생성/조회 ==========

    @Override
    @Transactional
    public Order createOrder(String userId, OrderStatus status) {
        OrderEntity entity = OrderEntity.create(UUID.randomUUID().toString(), userId, status,
                defaultCurrency, LocalDateTime.now(clock));
        return orderJpaRepository.saveAndFlush(entity).toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findById(String orderId) {
        return orderJpaRepository.findById(orderId).map(OrderEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String orderId) {
        return orderJpaRepository.existsById(orderId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findByUserId(String userId) {
        return orderJpaRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(OrderEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findByUserId(String userId, OrderStatus status) {
        return orderJpaRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status).stream()
                .map(OrderEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public PagedResult<Order> findByUserIdPaginated(String userId, PageQuery query) {
        PageRequest pageable = PageRequest.of(query.getPage() - 1, query.getLimit(),
                Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "id")));
        Page<OrderEntity> page = orderJpaRepository.findByUserIdAndStatusNot(userId, OrderStatus.DRAFT, pageable);
        List<Order> items = page.getContent().stream()
                .map(OrderEntity::toDomain)
                .toList();
        return PagedResult.of(items, page.getTotalElements(), query);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findDraftByUserId(String userId) {
        return orderJpaRepository.findByDraftOwner(userId).map(OrderEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasDraft(String userId) {
        return orderJpaRepository.existsByDraftOwner(userId);
    }

    /**
     * 없으면 별도 트랜잭션으로 DRAFT를 생성한다.
     * 다른 노드가 먼저 생성해 UNIQUE 제약에 걸리면 그 DRAFT를 다시 읽어 반환한다.
     */
    @Override
    public Order findOrCreateDraft(String userId) {
        Optional<Order> existing = readTransaction.execute(status -> findDraftByUserId(userId));
        if (existing != null && existing.isPresent()) {
            return existing.get();
        }
        try {
            return newTransaction.execute(status -> {
                OrderEntity entity = OrderEntity.create(UUID.randomUUID().toString(), userId,
                        OrderStatus.DRAFT, defaultCurrency, LocalDateTime.now(clock));
                return orderJpaRepository.saveAndFlush(entity).toDomain();
            });
        } catch (DataIntegrityViolationException e) {
            log.info("[JpaOrderRepository] DRAFT 동시 생성 감지, 기존 DRAFT 재조회 - userId={}", userId);
            Optional<Order> winner = readTransaction.execute(status -> findDraftByUserId(userId));
            if (winner == null || winner.isEmpty()) {
                throw e;
            }
            return winner.get();
        }
    }

    // ========== 상태 변경 ==========

    @Override
    @Transactional
    public Order updateStatus(String orderId, OrderStatus status) {
        OrderEntity entity = lockOrThrow(orderId);
        entity.changeStatus(status, LocalDateTime.now(clock));
        return orderJpaRepository.saveAndFlush(entity).toDomain();
    }

    @Override
    @Transactional
    public Optional<Order> updateStatusIfCurrent(String orderId, OrderStatus expected, OrderStatus target) {
        OrderEntity entity = lockOrThrow(orderId);
        if (entity.getStatus() != expected) {
            log.debug("[JpaOrderRepository] 상태 불일치로 전이 생략 - orderId={}, expected={}, actual={}",
                    orderId, expected, entity.getStatus());
            return Optional.empty();
        }
        entity.changeStatus(target, LocalDateTime.now(clock));
        return Optional.of(orderJpaRepository.saveAndFlush(entity).toDomain());
    }

    // ========== 항목 변경 ==========

    @Override
    @Transactional
    public Order addItem(String orderId, OrderItem item) {
        return modifyItems(orderId, order -> order.withItemMerged(item));
    }

    @Override
    @Transactional
    public Order updateItemQuantity(String orderId, String productId, int quantity) {
        return modifyItems(orderId, order -> order.withItemQuantity(productId, quantity));
    }

    @Override
    @Transactional
    public Order removeItem(String orderId, String productId) {
        return modifyItems(orderId, order -> order.withoutItem(productId));
    }

    @Override
    @Transactional
    public Order clearItems(String orderId) {
        return modifyItems(orderId, Order::withoutItems);
    }

    @Override
    @Transactional
    public Order changeDraftItems(String orderId, UnaryOperator<Order> change) {
        OrderEntity entity = lockOrThrow(orderId);
        if (entity.getStatus() != OrderStatus.DRAFT) {
            log.warn("[JpaOrderRepository] DRAFT 아님, 항목 변경 거부 - orderId={}, status={}",
                    orderId, entity.getStatus());
            throw new NoDraftOrderException(entity.getUserId());
        }
        return applyItemChange(entity, change);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderItem> getItem(String orderId, String productId) {
        return findById(orderId).flatMap(order -> order.findItem(productId));
    }

    // ========== 내부 헬퍼 ==========

    private Order modifyItems(String orderId, UnaryOperator<Order> change) {
        return applyItemChange(lockOrThrow(orderId), change);
    }

    private Order applyItemChange(OrderEntity entity, UnaryOperator<Order> change) {
        Order updated = change.apply(entity.toDomain());
        entity.replaceItems(updated.getItems(), LocalDateTime.now(clock));
        return orderJpaRepository.saveAndFlush(entity).toDomain();
    }

    private OrderEntity lockOrThrow(String orderId) {
        return orderJpaRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
