package com.pharmacy.ecommerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmacy.ecommerce.presentation.common.response.MoneyResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 주문 이력 목록의 한 줄
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderSummaryResponse {

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("status")
    private String status;

    @JsonProperty("total")
    private MoneyResponse total;

    @JsonProperty("item_count")
    private int itemCount;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
