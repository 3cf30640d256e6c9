package com.pharmacy.ecommerce.application.event;

import com.pharmacy.ecommerce.domain.order.event.DomainEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 유스케이스가 반환한 도메인 이벤트를 Spring 이벤트로 발행한다.
 *
 * 유스케이스가 성공적으로 끝난 뒤에만 호출한다. 전달 보장/재시도 없음.
 */
@Slf4j
@Component
public class DomainEventDispatcher {

    private final ApplicationEventPublisher eventPublisher;

    public DomainEventDispatcher(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    public void dispatch(List<? extends DomainEvent> events) {
        for (DomainEvent event : events) {
            log.debug("[DomainEventDispatcher] 이벤트 발행 - type={}, correlationId={}",
                    event.getType(), event.getCorrelationId());
            eventPublisher.publishEvent(event);
        }
    }
}
