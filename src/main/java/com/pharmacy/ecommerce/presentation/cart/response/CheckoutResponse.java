package com.pharmacy.ecommerce.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmacy.ecommerce.presentation.order.response.DomainEventResponse;
import com.pharmacy.ecommerce.presentation.order.response.OrderResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 체크아웃 응답 DTO
 * requires_prescription=true면 클라이언트는 처방전 업로드 화면으로 안내한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutResponse {

    @JsonProperty("order")
    private OrderResponse order;

    @JsonProperty("requires_prescription")
    private boolean requiresPrescription;

    @JsonProperty("events")
    private List<DomainEventResponse> events;
}
