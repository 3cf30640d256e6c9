package com.pharmacy.ecommerce.infrastructure.persistence.order;

import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderItem;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * orders 테이블 JPA 엔티티
 *
 * draft_owner:
 * - DRAFT 상태일 때만 userId, 그 외에는 NULL
 * - UNIQUE 제약으로 사용자당 DRAFT 주문 1개를 DB 레벨에서 보장 (NULL은 중복 허용)
 */
@Entity
@Table(name = "orders",
        uniqueConstraints = @UniqueConstraint(name = "uk_orders_draft_owner", columnNames = "draft_owner"),
        indexes = @Index(name = "idx_orders_user_created", columnList = "user_id, created_at"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderEntity {

    @Id
    @Column(name = "order_id", length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "draft_owner", length = 64)
    private String draftOwner;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_items", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "line_no")
    private List<OrderItemEmbeddable> items = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    static OrderEntity create(String id, String userId, OrderStatus status, String currency, LocalDateTime now) {
        OrderEntity entity = new OrderEntity();
        entity.id = id;
        entity.userId = userId;
        entity.currency = currency;
        entity.createdAt = now;
        entity.changeStatus(status, now);
        return entity;
    }

    void changeStatus(OrderStatus newStatus, LocalDateTime now) {
        this.status = newStatus;
        this.draftOwner = newStatus == OrderStatus.DRAFT ? userId : null;
        this.updatedAt = now;
    }

    void replaceItems(List<OrderItem> newItems, LocalDateTime now) {
        this.items.clear();
        for (OrderItem item : newItems) {
            this.items.add(OrderItemEmbeddable.from(item));
        }
        this.updatedAt = now;
    }

    List<OrderItem> itemsAsDomain() {
        List<OrderItem> result = new ArrayList<>(items.size());
        for (OrderItemEmbeddable row : items) {
            result.add(row.toDomain());
        }
        return result;
    }

    Order toDomain() {
        return Order.builder()
                .id(id)
                .userId(userId)
                .status(status)
                .items(itemsAsDomain())
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .currency(currency)
                .build();
    }
}
