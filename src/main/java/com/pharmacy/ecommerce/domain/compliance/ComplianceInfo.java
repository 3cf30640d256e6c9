package com.pharmacy.ecommerce.domain.compliance;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 주문 단위 처방 검토 정보 (읽기 전용)
 *
 * 처방/상담 각각의 상태를 종합한 status를 함께 제공한다.
 */
@Getter
@ToString
public final class ComplianceInfo {

    private final ComplianceStatus status;
    private final List<LinkedPrescription> prescriptions;
    private final List<LinkedConsultation> consultations;

    public ComplianceInfo(ComplianceStatus status, List<LinkedPrescription> prescriptions,
                          List<LinkedConsultation> consultations) {
        this.status = status;
        this.prescriptions = prescriptions == null ? List.of() : List.copyOf(prescriptions);
        this.consultations = consultations == null ? List.of() : List.copyOf(consultations);
    }

    /**
     * 아직 처방이 제출되지 않은 주문의 기본 상태
     */
    public static ComplianceInfo pending() {
        return new ComplianceInfo(ComplianceStatus.PENDING, List.of(), List.of());
    }
}
