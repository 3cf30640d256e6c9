package com.pharmacy.ecommerce.infrastructure.compliance;

import com.pharmacy.ecommerce.domain.compliance.ComplianceInfo;
import com.pharmacy.ecommerce.domain.compliance.OrderComplianceLookup;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 주문별 처방 검토 정보 보관소 (InMemory)
 *
 * 검토 워크플로가 결과를 record()로 기록하고, 주문 상세 조회가 읽어간다.
 */
@Component
public class InMemoryOrderComplianceRegistry implements OrderComplianceLookup {

    private final Map<String, ComplianceInfo> complianceByOrder = new ConcurrentHashMap<>();

    @Override
    public Optional<ComplianceInfo> getComplianceInfo(String orderId) {
        return Optional.ofNullable(complianceByOrder.get(orderId));
    }

    public void record(String orderId, ComplianceInfo info) {
        complianceByOrder.put(orderId, info);
    }

    public void clear() {
        complianceByOrder.clear();
    }
}
