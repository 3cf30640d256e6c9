package com.pharmacy.ecommerce.domain.compliance;

import java.util.Optional;

/**
 * OrderComplianceLookup - 처방 검토 정보 조회 Port
 *
 * 처방 검토 워크플로 자체는 이 서비스 범위 밖이다. 주문 상세 조회 시 읽기 전용으로만 사용한다.
 */
public interface OrderComplianceLookup {

    /**
     * @return 처방 항목이 없거나 검토 기록이 없으면 empty
     */
    Optional<ComplianceInfo> getComplianceInfo(String orderId);
}
