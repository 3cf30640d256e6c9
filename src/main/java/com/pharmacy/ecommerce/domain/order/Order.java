package com.pharmacy.ecommerce.domain.order;

import com.pharmacy.ecommerce.domain.common.vo.Money;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Order - 주문 애그리거트 루트 (Immutable Snapshot)
 *
 * 책임:
 * - 주문 소유자, 상태, 항목 보관
 * - 합계(total), 수량 합(itemCount) 계산. 두 값 모두 저장하지 않는다.
 *
 * 비즈니스 규칙:
 * - userId는 생성 후 바뀌지 않는다
 * - 항목은 productId 기준으로 유일하다
 * - DRAFT 상태에서만 항목이 변경된다 (저장소 구현이 아닌 서비스 계층에서 보장)
 *
 * 저장소는 항상 새 스냅샷을 반환하므로 호출자가 저장소 내부 상태를 참조하는 일은 없다.
 */
@Getter
@ToString
public final class Order {

    private final String id;
    private final String userId;
    private final OrderStatus status;
    private final List<OrderItem> items;
    private final LocalDateTime createdAt;
    private final LocalDateTime updatedAt;
    private final String currency;

    @Builder(toBuilder = true)
    private Order(String id, String userId, OrderStatus status, List<OrderItem> items,
                  LocalDateTime createdAt, LocalDateTime updatedAt, String currency) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("주문 ID는 필수입니다");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("사용자 ID는 필수입니다");
        }
        if (status == null) {
            throw new IllegalArgumentException("주문 상태는 필수입니다");
        }
        this.id = id;
        this.userId = userId;
        this.status = status;
        this.items = items == null ? List.of() : List.copyOf(items);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.currency = currency == null ? Money.DEFAULT_CURRENCY : currency;
    }

    /**
     * 항목 소계의 합. 항목이 없으면 주문 통화의 0원.
     */
    public Money getTotal() {
        Money total = Money.zero(items.isEmpty() ? currency : items.get(0).getUnitPrice().getCurrency());
        for (OrderItem item : items) {
            total = total.add(item.getSubtotal());
        }
        return total;
    }

    /**
     * 수량의 합 (라인 수가 아님)
     */
    public int getItemCount() {
        return items.stream().mapToInt(OrderItem::getQuantity).sum();
    }

    public int getLineCount() {
        return items.size();
    }

    public Optional<OrderItem> findItem(String productId) {
        return items.stream()
                .filter(item -> item.getProductId().equals(productId))
                .findFirst();
    }

    public boolean isOwnedBy(String candidateUserId) {
        return userId.equals(candidateUserId);
    }

    public boolean isDraft() {
        return status == OrderStatus.DRAFT;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    // ========== 항목 변경 (새 스냅샷 반환) ==========

    /**
     * 같은 상품이 있으면 수량을 더하고(기존 스냅샷 유지), 없으면 뒤에 추가한 주문을 반환합니다.
     */
    public Order withItemMerged(OrderItem item) {
        List<OrderItem> next = new ArrayList<>(items);
        int index = indexOf(item.getProductId());
        if (index >= 0) {
            OrderItem existing = next.get(index);
            next.set(index, existing.withQuantity(existing.getQuantity() + item.getQuantity()));
        } else {
            next.add(item);
        }
        return toBuilder().items(next).build();
    }

    /**
     * @throws OrderItemNotFoundException 항목이 없는 경우
     */
    public Order withItemQuantity(String productId, int quantity) {
        int index = requireIndex(productId);
        List<OrderItem> next = new ArrayList<>(items);
        next.set(index, next.get(index).withQuantity(quantity));
        return toBuilder().items(next).build();
    }

    /**
     * @throws OrderItemNotFoundException 항목이 없는 경우
     */
    public Order withoutItem(String productId) {
        int index = requireIndex(productId);
        List<OrderItem> next = new ArrayList<>(items);
        next.remove(index);
        return toBuilder().items(next).build();
    }

    public Order withoutItems() {
        return toBuilder().items(List.of()).build();
    }

    private int requireIndex(String productId) {
        int index = indexOf(productId);
        if (index < 0) {
            throw new OrderItemNotFoundException(id, productId);
        }
        return index;
    }

    private int indexOf(String productId) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).getProductId().equals(productId)) {
                return i;
            }
        }
        return -1;
    }
}
