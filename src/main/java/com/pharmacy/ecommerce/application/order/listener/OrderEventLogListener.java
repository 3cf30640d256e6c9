package com.pharmacy.ecommerce.application.order.listener;

import com.pharmacy.ecommerce.domain.order.event.OrderCancelledEvent;
import com.pharmacy.ecommerce.domain.order.event.OrderConfirmedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 주문 이벤트 리스너 - 이벤트를 감사 로그로 남긴다.
 *
 * 처방 검토 연계, 알림 발송 등 후속 처리가 붙을 자리다.
 */
@Slf4j
@Component
public class OrderEventLogListener {

    @EventListener
    public void handleOrderConfirmed(OrderConfirmedEvent event) {
        log.info("[OrderEventLogListener] 주문 확정 이벤트 - orderId={}, userId={}, total={}, itemCount={}, correlationId={}",
                event.getOrderId(), event.getUserId(), event.getTotal(), event.getItemCount(),
                event.getCorrelationId());
    }

    @EventListener
    public void handleOrderCancelled(OrderCancelledEvent event) {
        log.info("[OrderEventLogListener] 주문 취소 이벤트 - orderId={}, previousStatus={}, reason={}, correlationId={}",
                event.getOrderId(), event.getPreviousStatus(), event.getReason(), event.getCorrelationId());
    }
}
