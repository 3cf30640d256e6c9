package com.pharmacy.ecommerce.domain.compliance;

/**
 * 처방 검토 상태
 */
public enum ComplianceStatus {
    PENDING,
    APPROVED,
    REJECTED
}
