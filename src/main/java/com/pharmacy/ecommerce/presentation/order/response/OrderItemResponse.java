package com.pharmacy.ecommerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmacy.ecommerce.presentation.common.response.MoneyResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemResponse {

    @JsonProperty("product_id")
    private String productId;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("unit_price")
    private MoneyResponse unitPrice;

    @JsonProperty("quantity")
    private int quantity;

    @JsonProperty("subtotal")
    private MoneyResponse subtotal;

    @JsonProperty("added_at")
    private LocalDateTime addedAt;
}
