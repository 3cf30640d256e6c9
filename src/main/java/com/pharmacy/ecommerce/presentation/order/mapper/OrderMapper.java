package com.pharmacy.ecommerce.presentation.order.mapper;

import com.pharmacy.ecommerce.application.cart.dto.CheckoutResult;
import com.pharmacy.ecommerce.application.order.dto.OrderDetail;
import com.pharmacy.ecommerce.application.order.dto.OrderTransitionResult;
import com.pharmacy.ecommerce.domain.common.page.PagedResult;
import com.pharmacy.ecommerce.domain.compliance.ComplianceInfo;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderItem;
import com.pharmacy.ecommerce.domain.order.event.DomainEvent;
import com.pharmacy.ecommerce.presentation.cart.response.CheckoutResponse;
import com.pharmacy.ecommerce.presentation.common.response.MoneyResponse;
import com.pharmacy.ecommerce.presentation.order.response.DomainEventResponse;
import com.pharmacy.ecommerce.presentation.order.response.OrderDetailResponse;
import com.pharmacy.ecommerce.presentation.order.response.OrderHistoryResponse;
import com.pharmacy.ecommerce.presentation.order.response.OrderItemResponse;
import com.pharmacy.ecommerce.presentation.order.response.OrderResponse;
import com.pharmacy.ecommerce.presentation.order.response.OrderSummaryResponse;
import com.pharmacy.ecommerce.presentation.order.response.OrderTransitionResponse;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * OrderMapper - 도메인/Application 결과 → Presentation 응답 DTO 변환
 *
 * @JsonProperty 같은 직렬화 관심사는 Presentation DTO에만 둔다.
 */
@Component
public class OrderMapper {

    public OrderResponse toOrderResponse(Order order) {
        return OrderResponse.builder()
                .orderId(order.getId())
                .userId(order.getUserId())
                .status(order.getStatus().name())
                .statusLabel(order.getStatus().getLabel())
                .items(order.getItems().stream().map(this::toItemResponse).toList())
                .total(MoneyResponse.from(order.getTotal()))
                .itemCount(order.getItemCount())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }

    public List<OrderSummaryResponse> toSummaries(List<Order> orders) {
        return orders.stream().map(this::toSummary).toList();
    }

    public OrderHistoryResponse toHistoryResponse(PagedResult<Order> page) {
        return OrderHistoryResponse.builder()
                .orders(toSummaries(page.getItems()))
                .pagination(OrderHistoryResponse.Pagination.builder()
                        .page(page.getPage())
                        .limit(page.getLimit())
                        .total(page.getTotal())
                        .totalPages(page.getTotalPages())
                        .hasNextPage(page.isHasNextPage())
                        .hasPreviousPage(page.isHasPreviousPage())
                        .build())
                .build();
    }

    public OrderDetailResponse toDetailResponse(OrderDetail detail) {
        return OrderDetailResponse.builder()
                .order(toOrderResponse(detail.getOrder()))
                .requiresPrescription(detail.isRequiresPrescription())
                .compliance(detail.findCompliance().map(this::toCompliance).orElse(null))
                .build();
    }

    public OrderTransitionResponse toTransitionResponse(OrderTransitionResult result) {
        return OrderTransitionResponse.builder()
                .order(toOrderResponse(result.getOrder()))
                .events(toEventResponses(result.getEvents()))
                .build();
    }

    public CheckoutResponse toCheckoutResponse(CheckoutResult result) {
        return CheckoutResponse.builder()
                .order(toOrderResponse(result.getOrder()))
                .requiresPrescription(result.isRequiresPrescription())
                .events(toEventResponses(result.getEvents()))
                .build();
    }

    private OrderItemResponse toItemResponse(OrderItem item) {
        return OrderItemResponse.builder()
                .productId(item.getProductId())
                .productName(item.getProductName())
                .unitPrice(MoneyResponse.from(item.getUnitPrice()))
                .quantity(item.getQuantity())
                .subtotal(MoneyResponse.from(item.getSubtotal()))
                .addedAt(item.getAddedAt())
                .build();
    }

    private OrderSummaryResponse toSummary(Order order) {
        return OrderSummaryResponse.builder()
                .orderId(order.getId())
                .status(order.getStatus().name())
                .total(MoneyResponse.from(order.getTotal()))
                .itemCount(order.getItemCount())
                .createdAt(order.getCreatedAt())
                .build();
    }

    private OrderDetailResponse.Compliance toCompliance(ComplianceInfo info) {
        return OrderDetailResponse.Compliance.builder()
                .requiresPrescription(true)
                .status(info.getStatus().name())
                .prescriptions(info.getPrescriptions().stream()
                        .map(p -> OrderDetailResponse.Prescription.builder()
                                .id(p.getId())
                                .status(p.getStatus().name())
                                .rejectionReason(p.getRejectionReason())
                                .build())
                        .toList())
                .consultations(info.getConsultations().stream()
                        .map(c -> OrderDetailResponse.Consultation.builder()
                                .id(c.getId())
                                .status(c.getStatus())
                                .build())
                        .toList())
                .build();
    }

    private List<DomainEventResponse> toEventResponses(List<DomainEvent> events) {
        return events.stream()
                .map(event -> DomainEventResponse.builder()
                        .type(event.getType())
                        .occurredAt(event.getOccurredAt())
                        .correlationId(event.getCorrelationId())
                        .build())
                .toList();
    }
}
