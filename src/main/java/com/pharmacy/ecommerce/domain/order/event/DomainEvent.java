package com.pharmacy.ecommerce.domain.order.event;

import java.time.LocalDateTime;

/**
 * 도메인 이벤트 - 상태 전이 시점에 일어난 사실의 불변 기록
 *
 * 이벤트는 취소되거나 수정되지 않는다. correlationId는 요청 추적용이며 없을 수 있다.
 */
public interface DomainEvent {

    String getType();

    LocalDateTime getOccurredAt();

    String getCorrelationId();
}
