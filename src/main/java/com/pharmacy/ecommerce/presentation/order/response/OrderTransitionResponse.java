package com.pharmacy.ecommerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 상태 전이(확정/결제/취소/접수/장바구니 포기) 응답
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderTransitionResponse {

    @JsonProperty("order")
    private OrderResponse order;

    @JsonProperty("events")
    private List<DomainEventResponse> events;
}
