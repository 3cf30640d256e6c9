package com.pharmacy.ecommerce.domain.compliance;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class LinkedPrescription {

    private final String id;
    private final ComplianceStatus status;
    private final String rejectionReason;
}
