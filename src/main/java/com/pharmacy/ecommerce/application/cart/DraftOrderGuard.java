package com.pharmacy.ecommerce.application.cart;

import com.pharmacy.ecommerce.domain.cart.NoDraftOrderException;
import com.pharmacy.ecommerce.domain.cart.OrderNotDraftException;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderRepository;
import com.pharmacy.ecommerce.domain.order.UnauthorizedOrderAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 장바구니(DRAFT 주문) 변경 전 공통 검증
 *
 * 매 호출마다 저장소에서 다시 읽고 아래를 순서대로 확인한다.
 * 1. DRAFT 존재 → NoDraftOrder
 * 2. 소유자 일치 → UnauthorizedOrderAccess (사용자 기준 조회여도 재확인)
 * 3. DRAFT 상태 → OrderNotDraft
 */
@Slf4j
@Component
public class DraftOrderGuard {

    private final OrderRepository orderRepository;

    public DraftOrderGuard(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    public Order getDraftWithOwnershipCheck(String userId) {
        Order draft = orderRepository.findDraftByUserId(userId)
                .orElseThrow(() -> new NoDraftOrderException(userId));
        verify(draft, userId);
        return draft;
    }

    public void verify(Order draft, String userId) {
        if (!draft.isOwnedBy(userId)) {
            log.warn("[DraftOrderGuard] 소유자 불일치 - orderId={}, userId={}", draft.getId(), userId);
            throw new UnauthorizedOrderAccessException();
        }
        if (!draft.getStatus().isMutable()) {
            throw new OrderNotDraftException(draft.getId(), draft.getStatus());
        }
    }
}
