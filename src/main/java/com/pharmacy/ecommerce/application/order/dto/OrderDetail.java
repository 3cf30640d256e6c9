package com.pharmacy.ecommerce.application.order.dto;

import com.pharmacy.ecommerce.domain.compliance.ComplianceInfo;
import com.pharmacy.ecommerce.domain.order.Order;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * 주문 상세 조회 결과. 처방 상품이 있는 주문에만 compliance가 채워진다.
 */
@Getter
@ToString
public class OrderDetail {

    private final Order order;
    private final boolean requiresPrescription;
    private final ComplianceInfo compliance;

    public OrderDetail(Order order, boolean requiresPrescription, ComplianceInfo compliance) {
        this.order = order;
        this.requiresPrescription = requiresPrescription;
        this.compliance = compliance;
    }

    public Optional<ComplianceInfo> findCompliance() {
        return Optional.ofNullable(compliance);
    }
}
