package com.pharmacy.ecommerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderHistoryResponse {

    @JsonProperty("orders")
    private List<OrderSummaryResponse> orders;

    @JsonProperty("pagination")
    private Pagination pagination;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pagination {
        @JsonProperty("page")
        private int page;

        @JsonProperty("limit")
        private int limit;

        @JsonProperty("total")
        private long total;

        @JsonProperty("total_pages")
        private int totalPages;

        @JsonProperty("has_next_page")
        private boolean hasNextPage;

        @JsonProperty("has_previous_page")
        private boolean hasPreviousPage;
    }
}
