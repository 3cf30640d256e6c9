package com.pharmacy.ecommerce.domain.order.event;

import java.util.ArrayList;
import java.util.List;

/**
 * 유스케이스 호출 1회 동안 발생한 이벤트를 모으는 버퍼
 *
 * 영속 이벤트 로그나 메시지 버스가 아니다. 재시도/전달 보장 없음.
 * 호출마다 새로 만들어 쓰며 스레드 간 공유하지 않는다.
 */
public class DomainEventCollector {

    private final List<DomainEvent> events = new ArrayList<>();

    public void add(DomainEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("이벤트는 null이 될 수 없습니다");
        }
        events.add(event);
    }

    public List<DomainEvent> getEvents() {
        return List.copyOf(events);
    }

    public <T extends DomainEvent> List<T> getEventsOfType(Class<T> type) {
        List<T> matched = new ArrayList<>();
        for (DomainEvent event : events) {
            if (type.isInstance(event)) {
                matched.add(type.cast(event));
            }
        }
        return matched;
    }

    public boolean hasEvents() {
        return !events.isEmpty();
    }

    public void clear() {
        events.clear();
    }
}
