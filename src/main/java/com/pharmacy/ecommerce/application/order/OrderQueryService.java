package com.pharmacy.ecommerce.application.order;

import com.pharmacy.ecommerce.application.order.dto.OrderDetail;
import com.pharmacy.ecommerce.domain.common.page.PageQuery;
import com.pharmacy.ecommerce.domain.common.page.PagedResult;
import com.pharmacy.ecommerce.domain.compliance.ComplianceInfo;
import com.pharmacy.ecommerce.domain.compliance.OrderComplianceLookup;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderRepository;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * OrderQueryService - 주문 조회 (읽기 전용)
 */
@Slf4j
@Service
public class OrderQueryService {

    private final OrderRepository orderRepository;
    private final OrderAccessGuard orderAccessGuard;
    private final PrescriptionRequirementChecker prescriptionRequirementChecker;
    private final OrderComplianceLookup complianceLookup;

    public OrderQueryService(OrderRepository orderRepository,
                             OrderAccessGuard orderAccessGuard,
                             PrescriptionRequirementChecker prescriptionRequirementChecker,
                             OrderComplianceLookup complianceLookup) {
        this.orderRepository = orderRepository;
        this.orderAccessGuard = orderAccessGuard;
        this.prescriptionRequirementChecker = prescriptionRequirementChecker;
        this.complianceLookup = complianceLookup;
    }

    /**
     * 주문 이력 (DRAFT 제외, 최신순)
     */
    public PagedResult<Order> getOrderHistory(String userId, PageQuery query, String correlationId) {
        log.debug("[OrderQueryService] 주문 이력 조회 - userId={}, page={}, limit={}, correlationId={}",
                userId, query.getPage(), query.getLimit(), correlationId);
        return orderRepository.findByUserIdPaginated(userId, query);
    }

    /**
     * 사용자 주문 전체 목록. status가 있으면 해당 상태만.
     */
    public List<Order> getOrders(String userId, Optional<OrderStatus> status, String correlationId) {
        log.debug("[OrderQueryService] 주문 목록 조회 - userId={}, status={}, correlationId={}",
                userId, status.orElse(null), correlationId);
        return status.map(s -> orderRepository.findByUserId(userId, s))
                .orElseGet(() -> orderRepository.findByUserId(userId));
    }

    /**
     * 주문 상세. 처방 상품이 있으면 처방 검토 정보를 붙인다 (기록이 없으면 PENDING).
     */
    public OrderDetail getOrderById(String orderId, String userId, String correlationId) {
        Order order = orderAccessGuard.getOwnedOrder(orderId, userId);

        boolean requiresPrescription = prescriptionRequirementChecker.requiresPrescription(order);
        ComplianceInfo compliance = null;
        if (requiresPrescription) {
            compliance = complianceLookup.getComplianceInfo(orderId)
                    .orElseGet(ComplianceInfo::pending);
        }

        log.debug("[OrderQueryService] 주문 상세 조회 - orderId={}, requiresPrescription={}, correlationId={}",
                orderId, requiresPrescription, correlationId);
        return new OrderDetail(order, requiresPrescription, compliance);
    }
}
