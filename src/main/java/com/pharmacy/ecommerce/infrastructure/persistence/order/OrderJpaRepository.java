package com.pharmacy.ecommerce.infrastructure.persistence.order;

import com.pharmacy.ecommerce.domain.order.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 */
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    Optional<OrderEntity> findByDraftOwner(String userId);

    boolean existsByDraftOwner(String userId);

    List<OrderEntity> findByUserIdOrderByCreatedAtDesc(String userId);

    List<OrderEntity> findByUserIdAndStatusOrderByCreatedAtDesc(String userId, OrderStatus status);

    /**
     * 주문 이력 페이지 조회 (정렬은 Pageable로 전달)
     */
    Page<OrderEntity> findByUserIdAndStatusNot(String userId, OrderStatus status, Pageable pageable);

    /**
     * 주문 ID로 조회 (비관적 락 - SELECT ... FOR UPDATE)
     * 상태 전이와 항목 변경은 모두 이 조회 후 수행한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM OrderEntity o WHERE o.id = :orderId")
    Optional<OrderEntity> findByIdForUpdate(@Param("orderId") String orderId);
}
