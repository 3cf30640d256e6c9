package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.domain.common.page.PageQuery;
import com.pharmacy.ecommerce.domain.common.page.PagedResult;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * OrderRepository - 주문 저장소 인터페이스 (Domain Port)
 *
 * 구현체:
 * - InMemoryOrderRepository: 참조 구현 및 테스트용
 * - JpaOrderRepository: MySQL 운영용
 *
 * 저장소는 소유권 검증을 하지 않는다. 서비스 계층의 책임이다.
 * 단, 아래는 모든 구현이 동일하게 지켜야 한다.
 * - 페이지 조회에서 DRAFT 주문 제외
 * - 같은 상품 추가 시 라인 중복 없이 수량 증가
 * - changeDraftItems는 잠금 안에서 DRAFT 상태를 다시 확인
 *
 * 반환되는 Order는 모두 스냅샷이다.
 */
public interface OrderRepository {

    default Order createOrder(String userId) {
        return createOrder(userId, OrderStatus.CREATED);
    }

    Order createOrder(String userId, OrderStatus status);

    Optional<Order> findById(String orderId);

    boolean exists(String orderId);

    /**
     * 사용자 주문 목록 (createdAt 내림차순, DRAFT 포함)
     */
    List<Order> findByUserId(String userId);

    List<Order> findByUserId(String userId, OrderStatus status);

    /**
     * 주문 이력 페이지 조회 (DRAFT 제외, createdAt 내림차순)
     */
    PagedResult<Order> findByUserIdPaginated(String userId, PageQuery query);

    /**
     * @throws OrderNotFoundException 주문이 없는 경우
     */
    Order updateStatus(String orderId, OrderStatus status);

    /**
     * 현재 상태가 expected일 때만 target으로 변경합니다 (compare-and-set).
     *
     * @return 변경된 주문. 현재 상태가 expected가 아니면 empty
     * @throws OrderNotFoundException 주문이 없는 경우
     */
    Optional<Order> updateStatusIfCurrent(String orderId, OrderStatus expected, OrderStatus target);

    Optional<Order> findDraftByUserId(String userId);

    boolean hasDraft(String userId);

    /**
     * 사용자의 DRAFT 주문을 반환하고, 없으면 원자적으로 생성합니다.
     * 동시에 호출되어도 사용자당 DRAFT는 하나만 생긴다.
     */
    Order findOrCreateDraft(String userId);

    /**
     * 같은 productId 항목이 있으면 수량을 더하고, 없으면 뒤에 추가합니다.
     * 기존 항목의 스냅샷(상품명, 단가)은 유지됩니다.
     */
    Order addItem(String orderId, OrderItem item);

    /**
     * @throws OrderItemNotFoundException 항목이 없는 경우
     */
    Order updateItemQuantity(String orderId, String productId, int quantity);

    /**
     * @throws OrderItemNotFoundException 항목이 없는 경우
     */
    Order removeItem(String orderId, String productId);

    Order clearItems(String orderId);

    /**
     * 주문을 잠근 상태에서 DRAFT인지 다시 확인한 뒤 항목을 변경합니다.
     * 확인과 변경 사이에 다른 요청(다른 노드 포함)이 확정/취소하면 변경하지 않는다.
     *
     * @throws com.pharmacy.ecommerce.domain.cart.NoDraftOrderException 더 이상 DRAFT가 아닌 경우
     * @throws OrderNotFoundException 주문이 없는 경우
     */
    Order changeDraftItems(String orderId, UnaryOperator<Order> change);

    Optional<OrderItem> getItem(String orderId, String productId);
}
