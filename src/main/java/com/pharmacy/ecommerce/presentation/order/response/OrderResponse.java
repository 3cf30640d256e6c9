package com.pharmacy.ecommerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmacy.ecommerce.presentation.common.response.MoneyResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문(장바구니 포함) 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("status")
    private String status;

    @JsonProperty("status_label")
    private String statusLabel;

    @JsonProperty("items")
    private List<OrderItemResponse> items;

    @JsonProperty("total")
    private MoneyResponse total;

    @JsonProperty("item_count")
    private int itemCount;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;
}
